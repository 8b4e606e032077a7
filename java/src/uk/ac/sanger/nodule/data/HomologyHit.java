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

/**
 * One alignment reported by a homology search, in the column order of the
 * tabular BLAST output, together with the query which produced it.
 */

public class HomologyHit {
	protected String queryName;
	protected String subjectAccession;
	protected double percentIdentity;
	protected int alignmentLength;
	protected int mismatches;
	protected int gapOpens;
	protected int queryStart;
	protected int queryEnd;
	protected int subjectStart;
	protected int subjectEnd;
	protected double evalue;
	protected double bitScore;

	protected String queryFile = null;
	protected String querySequence = null;

	public HomologyHit(String queryName, String subjectAccession, double percentIdentity,
			int alignmentLength, int mismatches, int gapOpens, int queryStart, int queryEnd,
			int subjectStart, int subjectEnd, double evalue, double bitScore) {
		this.queryName = queryName;
		this.subjectAccession = subjectAccession;
		this.percentIdentity = percentIdentity;
		this.alignmentLength = alignmentLength;
		this.mismatches = mismatches;
		this.gapOpens = gapOpens;
		this.queryStart = queryStart;
		this.queryEnd = queryEnd;
		this.subjectStart = subjectStart;
		this.subjectEnd = subjectEnd;
		this.evalue = evalue;
		this.bitScore = bitScore;
	}

	/**
	 * Returns a copy of this hit annotated with the query file and the query
	 * sequence.
	 */

	public HomologyHit withProvenance(String queryFile, String querySequence) {
		HomologyHit hit = new HomologyHit(queryName, subjectAccession, percentIdentity,
				alignmentLength, mismatches, gapOpens, queryStart, queryEnd,
				subjectStart, subjectEnd, evalue, bitScore);

		hit.queryFile = queryFile;
		hit.querySequence = querySequence;

		return hit;
	}

	public String getQueryName() {
		return queryName;
	}

	public String getSubjectAccession() {
		return subjectAccession;
	}

	public double getPercentIdentity() {
		return percentIdentity;
	}

	public int getAlignmentLength() {
		return alignmentLength;
	}

	public int getMismatches() {
		return mismatches;
	}

	public int getGapOpens() {
		return gapOpens;
	}

	public int getQueryStart() {
		return queryStart;
	}

	public int getQueryEnd() {
		return queryEnd;
	}

	public int getSubjectStart() {
		return subjectStart;
	}

	public int getSubjectEnd() {
		return subjectEnd;
	}

	public double getEvalue() {
		return evalue;
	}

	public double getBitScore() {
		return bitScore;
	}

	public String getQueryFile() {
		return queryFile;
	}

	public String getQuerySequence() {
		return querySequence;
	}

	public String toString() {
		return "HomologyHit[query=\"" + queryName + "\", subject=\"" + subjectAccession
				+ "\", identity=" + percentIdentity + ", length=" + alignmentLength
				+ ", mismatches=" + mismatches + ", gaps=" + gapOpens
				+ ", query " + queryStart + " to " + queryEnd
				+ ", subject " + subjectStart + " to " + subjectEnd
				+ ", evalue=" + evalue + ", bitscore=" + bitScore + "]";
	}
}
