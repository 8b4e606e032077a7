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

package uk.ac.sanger.nodule.homology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.data.ConsensusCall;
import uk.ac.sanger.nodule.data.HomologyHit;
import uk.ac.sanger.nodule.data.HomologyResultSet;

/**
 * Reduces the homology search results of a well to a single identification.
 * <p>
 * For one result set, the best hits of each query are those which have both
 * the smallest e-value and the largest bit-score, and the query whose best
 * hits have the smallest e-value provides the call.
 * <p>
 * For several result sets, typically one per replicate, each set is resolved
 * on its own. If more than one call results, only subject accessions which
 * every call shares are kept, and the call is made from the hits on those
 * accessions.
 */

public class ConsensusResolver {
	private static final String NO_VALUE = "";

	/**
	 * Orders hits from best to worst so that equal e-values are still ranked
	 * the same way whatever the order of the input.
	 */

	public static final Comparator<HomologyHit> HIT_ORDER = new Comparator<HomologyHit>() {
		public int compare(HomologyHit a, HomologyHit b) {
			int diff = Double.compare(a.getEvalue(), b.getEvalue());

			if (diff != 0)
				return diff;

			diff = Double.compare(b.getBitScore(), a.getBitScore());

			if (diff != 0)
				return diff;

			diff = valueOf(a.getSubjectAccession()).compareTo(valueOf(b.getSubjectAccession()));

			if (diff != 0)
				return diff;

			diff = valueOf(a.getQueryName()).compareTo(valueOf(b.getQueryName()));

			if (diff != 0)
				return diff;

			diff = Double.compare(b.getPercentIdentity(), a.getPercentIdentity());

			if (diff != 0)
				return diff;

			return valueOf(a.getQueryFile()).compareTo(valueOf(b.getQueryFile()));
		}
	};

	private static final Comparator<ConsensusCall> PROVENANCE_ORDER = new Comparator<ConsensusCall>() {
		public int compare(ConsensusCall a, ConsensusCall b) {
			int diff = valueOf(a.getQueryFile()).compareTo(valueOf(b.getQueryFile()));

			return diff != 0 ? diff : valueOf(a.getQueryName()).compareTo(valueOf(b.getQueryName()));
		}
	};

	private final Logger logger;

	public ConsensusResolver(Logger logger) {
		this.logger = logger;
	}

	private static String valueOf(String s) {
		return s == null ? NO_VALUE : s;
	}

	/**
	 * Selects the hits whose e-value is the smallest and whose bit-score is the
	 * largest in the list. If no single hit has both, the result is empty.
	 * Hits are returned in input order.
	 */

	public List<HomologyHit> chooseHighestScore(List<HomologyHit> hits) {
		List<HomologyHit> winners = new ArrayList<HomologyHit>();

		if (hits == null || hits.isEmpty())
			return winners;

		double minEvalue = Double.POSITIVE_INFINITY;
		double maxBitScore = Double.NEGATIVE_INFINITY;

		for (HomologyHit hit : hits) {
			minEvalue = Math.min(minEvalue, hit.getEvalue());
			maxBitScore = Math.max(maxBitScore, hit.getBitScore());
		}

		for (HomologyHit hit : hits)
			if (hit.getEvalue() == minEvalue && hit.getBitScore() == maxBitScore)
				winners.add(hit);

		return winners;
	}

	public Optional<ConsensusCall> resolveSingle(HomologyResultSet resultSet) {
		HomologyResultSet.Query bestQuery = null;
		List<HomologyHit> bestWinners = null;

		for (HomologyResultSet.Query query : resultSet.getQueries()) {
			if (!query.hasHits())
				continue;

			List<HomologyHit> winners = chooseHighestScore(query.getHits());

			if (winners.isEmpty()) {
				if (logger.isLoggable(Level.FINE))
					logger.fine("Query " + query.getName() + " in " + resultSet.getQueryFile()
							+ " has no hit with both the best e-value and the best bit-score");

				continue;
			}

			if (bestWinners == null || winners.get(0).getEvalue() < bestWinners.get(0).getEvalue()) {
				bestQuery = query;
				bestWinners = winners;
			}
		}

		if (bestQuery == null)
			return Optional.empty();

		return Optional.of(new ConsensusCall(bestWinners, false, bestQuery.getQueryFile(), bestQuery.getName(),
				bestQuery.getSequence()));
	}

	public Optional<ConsensusCall> resolveMulti(List<HomologyResultSet> resultSets) {
		List<ConsensusCall> calls = new ArrayList<ConsensusCall>();

		for (HomologyResultSet resultSet : resultSets) {
			Optional<ConsensusCall> call = resolveSingle(resultSet);

			if (call.isPresent())
				calls.add(call.get());
		}

		if (calls.isEmpty())
			return Optional.empty();

		if (calls.size() == 1)
			return Optional.of(calls.get(0));

		return intersect(calls);
	}

	/**
	 * Combines calls from independent result sets. Only accessions present in
	 * every call survive; the hits on them are ranked by {@link #HIT_ORDER}
	 * and reduced to the best hit per accession.
	 */

	public Optional<ConsensusCall> intersect(List<ConsensusCall> calls) {
		if (calls == null || calls.isEmpty())
			return Optional.empty();

		Set<String> common = null;

		for (ConsensusCall call : calls) {
			Set<String> accessions = new HashSet<String>();

			for (HomologyHit hit : call.getHits())
				accessions.add(hit.getSubjectAccession());

			if (common == null)
				common = accessions;
			else
				common.retainAll(accessions);
		}

		if (common.isEmpty()) {
			logger.fine("No accession is common to all " + calls.size() + " calls");
			return Optional.empty();
		}

		List<HomologyHit> rows = new ArrayList<HomologyHit>();

		for (ConsensusCall call : calls)
			for (HomologyHit hit : call.getHits())
				if (common.contains(hit.getSubjectAccession()))
					rows.add(hit);

		Collections.sort(rows, HIT_ORDER);

		List<HomologyHit> table = new ArrayList<HomologyHit>();
		Set<String> seen = new HashSet<String>();

		for (HomologyHit hit : rows)
			if (seen.add(hit.getSubjectAccession()))
				table.add(hit);

		List<ConsensusCall> sources = new ArrayList<ConsensusCall>(calls);

		Collections.sort(sources, PROVENANCE_ORDER);

		Set<String> files = new LinkedHashSet<String>();
		Set<String> names = new LinkedHashSet<String>();
		Set<String> sequences = new LinkedHashSet<String>();

		for (ConsensusCall call : sources) {
			files.add(valueOf(call.getQueryFile()));
			names.add(valueOf(call.getQueryName()));
			sequences.add(valueOf(call.getQuerySequence()));
		}

		return Optional.of(new ConsensusCall(table, true, join(files), join(names), join(sequences)));
	}

	private String join(Set<String> values) {
		StringBuilder sb = new StringBuilder();

		for (String value : values) {
			if (sb.length() > 0)
				sb.append(ConsensusCall.PROVENANCE_SEPARATOR);

			sb.append(value);
		}

		return sb.toString();
	}
}
