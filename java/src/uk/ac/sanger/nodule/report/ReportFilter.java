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
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A filter on report rows, written as comparisons joined by <code>and</code>,
 * for example
 *
 * <pre>
 * evalue &lt;= 1e-50 and raw_count &gt;= 10
 * </pre>
 *
 * Numeric columns accept the operators <code>&lt; &lt;= &gt; &gt;= == !=</code>;
 * the other columns accept only <code>==</code> and <code>!=</code>.
 */

public class ReportFilter implements Predicate<CallReportRow> {
	private static final Pattern CONDITION = Pattern.compile("^\\s*([a-z_]+)\\s*(<=|>=|==|!=|<|>|=)\\s*(\\S.*?)\\s*$");

	private static final Pattern AND = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

	private final String expression;
	private final List<Condition> conditions;

	private ReportFilter(String expression, List<Condition> conditions) {
		this.expression = expression;
		this.conditions = conditions;
	}

	/**
	 * Parses a filter expression.
	 *
	 * @throws IllegalArgumentException
	 *             if the expression is malformed or names an unknown column.
	 */

	public static ReportFilter parse(String expression) {
		if (expression == null || expression.trim().isEmpty())
			throw new IllegalArgumentException("The report filter is empty");

		List<Condition> conditions = new ArrayList<Condition>();

		for (String term : AND.split(expression.trim()))
			conditions.add(parseCondition(term));

		return new ReportFilter(expression.trim(), conditions);
	}

	private static Condition parseCondition(String term) {
		Matcher matcher = CONDITION.matcher(term);

		if (!matcher.matches())
			throw new IllegalArgumentException("Cannot parse the filter condition \"" + term + "\"");

		String column = matcher.group(1);
		String operator = matcher.group(2);
		String operand = unquote(matcher.group(3));

		if ("=".equals(operator))
			operator = "==";

		if (!CallReportRow.isColumn(column))
			throw new IllegalArgumentException("Unknown report column \"" + column + "\" in the filter condition \""
					+ term + "\"");

		if (CallReportRow.isNumeric(column)) {
			try {
				return new Condition(column, operator, Double.valueOf(operand), null);
			} catch (NumberFormatException nfe) {
				throw new IllegalArgumentException("The filter condition \"" + term + "\" compares the numeric column "
						+ column + " with a non-numeric value", nfe);
			}
		}

		if (!"==".equals(operator) && !"!=".equals(operator))
			throw new IllegalArgumentException("The filter condition \"" + term + "\" uses " + operator
					+ " on the non-numeric column " + column);

		return new Condition(column, operator, null, operand);
	}

	private static String unquote(String s) {
		if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("'") && s.endsWith("'")))
			return s.substring(1, s.length() - 1);
		else
			return s;
	}

	public boolean test(CallReportRow row) {
		for (Condition condition : conditions)
			if (!condition.test(row))
				return false;

		return true;
	}

	public String getExpression() {
		return expression;
	}

	public String toString() {
		return "ReportFilter[" + expression + "]";
	}

	private static class Condition {
		private final String column;
		private final String operator;
		private final Double number;
		private final String text;

		Condition(String column, String operator, Double number, String text) {
			this.column = column;
			this.operator = operator;
			this.number = number;
			this.text = text;
		}

		boolean test(CallReportRow row) {
			Object value = row.getValue(column);

			int diff;

			if (number != null)
				diff = Double.compare(((Number) value).doubleValue(), number.doubleValue());
			else
				diff = String.valueOf(value).equalsIgnoreCase(text) ? 0 : 1;

			if ("<".equals(operator))
				return diff < 0;
			else if ("<=".equals(operator))
				return diff <= 0;
			else if (">".equals(operator))
				return diff > 0;
			else if (">=".equals(operator))
				return diff >= 0;
			else if ("==".equals(operator))
				return diff == 0;
			else
				return diff != 0;
		}
	}
}
