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

package uk.ac.sanger.nodule.report;

import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.data.ConsensusCall;
import uk.ac.sanger.nodule.data.HomologyHit;
import uk.ac.sanger.nodule.data.Well;

/**
 * One line of the final call report: the identification made for a well,
 * with the read and query counts which support it.
 */

public class CallReportRow implements Comparable<CallReportRow> {
	public static final String PLATE = "plate";
	public static final String WELL = "well";
	public static final String CANDIDATE = "candidate";
	public static final String PERCENT_IDENTITY = "percent_identity";
	public static final String LENGTH = "length";
	public static final String EVALUE = "evalue";
	public static final String BITSCORE = "bitscore";
	public static final String QUERY_SEQ = "query_seq";
	public static final String QUERY_FILE = "query_file";
	public static final String QUERY_NAME = "query_name";
	public static final String FROM_INTERSECTION = "from_intersection";
	public static final String RAW_COUNT = "raw_count";
	public static final String QUERY_COUNT = "query_count";
	public static final String OTHER_CANDIDATES = "other_candidates";

	public static final String[] COLUMNS = { PLATE, WELL, CANDIDATE, PERCENT_IDENTITY, LENGTH, EVALUE, BITSCORE,
			QUERY_SEQ, QUERY_FILE, QUERY_NAME, FROM_INTERSECTION, RAW_COUNT, QUERY_COUNT, OTHER_CANDIDATES };

	public static final String CANDIDATE_SEPARATOR = ";";

	private final Well well;
	private final ConsensusCall call;
	private final long rawCount;
	private final int queryCount;

	/**
	 * @param well
	 *            the well which was identified.
	 * @param call
	 *            the identification.
	 * @param rawCount
	 *            the number of read pairs in the well, over all replicates.
	 * @param queryCount
	 *            the number of contigs which were searched to make the call.
	 */

	public CallReportRow(Well well, ConsensusCall call, long rawCount, int queryCount) {
		this.well = well;
		this.call = call;
		this.rawCount = rawCount;
		this.queryCount = queryCount;
	}

	public Well getWell() {
		return well;
	}

	public ConsensusCall getCall() {
		return call;
	}

	public long getRawCount() {
		return rawCount;
	}

	public int getQueryCount() {
		return queryCount;
	}

	public static boolean isNumeric(String column) {
		return PLATE.equals(column) || PERCENT_IDENTITY.equals(column) || LENGTH.equals(column)
				|| EVALUE.equals(column) || BITSCORE.equals(column) || RAW_COUNT.equals(column)
				|| QUERY_COUNT.equals(column);
	}

	public static boolean isColumn(String column) {
		for (String name : COLUMNS)
			if (name.equals(column))
				return true;

		return false;
	}

	/**
	 * Returns the value of a column: a {@link Number} for numeric columns, a
	 * {@link Boolean} for <code>from_intersection</code>, otherwise a string.
	 *
	 * @throws IllegalArgumentException
	 *             if there is no such column.
	 */

	public Object getValue(String column) {
		HomologyHit best = call.getBestHit();

		if (PLATE.equals(column))
			return well.getPlate();
		else if (WELL.equals(column))
			return well.getPosition();
		else if (CANDIDATE.equals(column))
			return best.getSubjectAccession();
		else if (PERCENT_IDENTITY.equals(column))
			return best.getPercentIdentity();
		else if (LENGTH.equals(column))
			return best.getAlignmentLength();
		else if (EVALUE.equals(column))
			return best.getEvalue();
		else if (BITSCORE.equals(column))
			return best.getBitScore();
		else if (QUERY_SEQ.equals(column))
			return call.getQuerySequence();
		else if (QUERY_FILE.equals(column))
			return call.getQueryFile();
		else if (QUERY_NAME.equals(column))
			return call.getQueryName();
		else if (FROM_INTERSECTION.equals(column))
			return call.isFromIntersection();
		else if (RAW_COUNT.equals(column))
			return rawCount;
		else if (QUERY_COUNT.equals(column))
			return queryCount;
		else if (OTHER_CANDIDATES.equals(column))
			return join(call.getAlternativeAccessions());
		else
			throw new IllegalArgumentException("Unknown report column: " + column);
	}

	public List<Object> getValues() {
		List<Object> values = new ArrayList<Object>();

		for (String column : COLUMNS)
			values.add(getValue(column));

		return values;
	}

	private String join(List<String> values) {
		StringBuilder sb = new StringBuilder();

		for (String value : values) {
			if (sb.length() > 0)
				sb.append(CANDIDATE_SEPARATOR);

			sb.append(value);
		}

		return sb.toString();
	}

	public int compareTo(CallReportRow that) {
		return well.compareTo(that.well);
	}

	public String toString() {
		return "CallReportRow[well=" + well + ", call=" + call + ", raw=" + rawCount + ", queries=" + queryCount + "]";
	}
}
