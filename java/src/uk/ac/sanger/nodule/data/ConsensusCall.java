// Copyright (c) 2026 Genome Research Ltd.
//
// This file is part of Nodule.
//
// Nodule is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.nodule.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The identification made for a well: a table of hits with the best hit
 * first, and the query which produced them. When the call was reached by
 * agreement between several contig sets, the provenance fields hold the
 * colon-separated values of all of the contributing queries.
 */

public class ConsensusCall {
	public static final String PROVENANCE_SEPARATOR = ":";

	private final List<HomologyHit> hits;
	private final boolean fromIntersection;
	private final String queryFile;
	private final String queryName;
	private final String querySequence;

	public ConsensusCall(List<HomologyHit> hits, boolean fromIntersection,
			String queryFile, String queryName, String querySequence) {
		if (hits == null || hits.isEmpty())
			throw new IllegalArgumentException("A consensus call needs at least one hit");

		this.hits = new ArrayList<HomologyHit>(hits);
		this.fromIntersection = fromIntersection;
		this.queryFile = queryFile;
		this.queryName = queryName;
		this.querySequence = querySequence;
	}

	public List<HomologyHit> getHits() {
		return Collections.unmodifiableList(hits);
	}

	public HomologyHit getBestHit() {
		return hits.get(0);
	}

	public String getAccession() {
		return getBestHit().getSubjectAccession();
	}

	/**
	 * Returns the subject accessions of every hit after the best one. These
	 * are the candidates which scored as well as the best hit, or which were
	 * also common to every replicate.
	 */

	public List<String> getAlternativeAccessions() {
		List<String> accessions = new ArrayList<String>();

		for (int i = 1; i < hits.size(); i++)
			accessions.add(hits.get(i).getSubjectAccession());

		return accessions;
	}

	public boolean isFromIntersection() {
		return fromIntersection;
	}

	public String getQueryFile() {
		return queryFile;
	}

	public String getQueryName() {
		return queryName;
	}

	public String getQuerySequence() {
		return querySequence;
	}

	public List<String> getQueryFiles() {
		List<String> files = new ArrayList<String>();

		if (queryFile == null)
			return files;

		if (!fromIntersection) {
			files.add(queryFile);
			return files;
		}

		for (String file : queryFile.split(PROVENANCE_SEPARATOR))
			if (!file.isEmpty())
				files.add(file);

		return files;
	}

	public String toString() {
		return "ConsensusCall[accession=" + getAccession() + ", evalue=" + getBestHit().getEvalue()
				+ ", hits=" + hits.size() + ", fromIntersection=" + fromIntersection
				+ ", query=\"" + queryName + "\"]";
	}
}
