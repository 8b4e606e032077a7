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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * This class represents one well of a 96-well plate, identified by the plate
 * number, the row letter (A to H) and the column number (1 to 12). Its
 * canonical form is a four-character code such as <code>1A01</code>.
 */

public class Well implements Comparable<Well> {
	public static final int ROWS = 8;
	public static final int COLUMNS = 12;

	public static final String ROW_LETTERS = "ABCDEFGH";

	private static final Pattern WELL_CODE = Pattern.compile("^([1-9])([A-H])(\\d\\d)$");

	protected final int plate;
	protected final char row;
	protected final int column;

	/**
	 * Constructs a well.
	 *
	 * @param plate
	 *            the plate number, from 1 to 9.
	 * @param row
	 *            the row letter, from A to H.
	 * @param column
	 *            the column number, from 1 to 12.
	 */

	public Well(int plate, char row, int column) {
		if (plate < 1 || plate > 9)
			throw new IllegalArgumentException("Plate number out of range: " + plate);

		if (ROW_LETTERS.indexOf(row) < 0)
			throw new IllegalArgumentException("Row letter out of range: " + row);

		if (column < 1 || column > COLUMNS)
			throw new IllegalArgumentException("Column number out of range: " + column);

		this.plate = plate;
		this.row = row;
		this.column = column;
	}

	/**
	 * Parses a well code such as <code>1A01</code>.
	 *
	 * @param code
	 *            the four-character well code.
	 *
	 * @return the well which the code represents.
	 *
	 * @throws IllegalArgumentException
	 *             if the code is not a valid well code.
	 */

	public static Well parse(String code) {
		Matcher matcher = code == null ? null : WELL_CODE.matcher(code.trim());

		if (matcher == null || !matcher.matches())
			throw new IllegalArgumentException("Not a valid well code: \"" + code + "\"");

		return new Well(Integer.parseInt(matcher.group(1)), matcher.group(2).charAt(0),
				Integer.parseInt(matcher.group(3)));
	}

	public int getPlate() {
		return plate;
	}

	public char getRow() {
		return row;
	}

	/**
	 * Returns the zero-based index of the row, so that row A is 0 and row H is 7.
	 */

	public int getRowIndex() {
		return ROW_LETTERS.indexOf(row);
	}

	public int getColumn() {
		return column;
	}

	/**
	 * Returns the part of the well code which identifies the well within its
	 * plate, for example <code>A01</code>.
	 */

	public String getPosition() {
		return row + (column < 10 ? "0" : "") + column;
	}

	public String getCode() {
		return plate + getPosition();
	}

	public int compareTo(Well that) {
		if (plate != that.plate)
			return plate < that.plate ? -1 : 1;

		if (row != that.row)
			return row < that.row ? -1 : 1;

		return column == that.column ? 0 : (column < that.column ? -1 : 1);
	}

	public boolean equals(Object o) {
		if (!(o instanceof Well))
			return false;

		Well that = (Well) o;

		return plate == that.plate && row == that.row && column == that.column;
	}

	public int hashCode() {
		return (plate * 31 + row) * 31 + column;
	}

	public String toString() {
		return getCode();
	}
}
