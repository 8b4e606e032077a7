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
 * The pair of barcode suffixes left on the forward and reverse read headers by
 * tag trimming.
 */

public class BarcodePair {
	private final String forward;
	private final String reverse;

	public BarcodePair(String forward, String reverse) {
		if (forward == null || reverse == null)
			throw new IllegalArgumentException("A barcode pair needs both a forward and a reverse suffix");

		this.forward = forward;
		this.reverse = reverse;
	}

	public String getForward() {
		return forward;
	}

	public String getReverse() {
		return reverse;
	}

	public boolean equals(Object o) {
		if (!(o instanceof BarcodePair))
			return false;

		BarcodePair that = (BarcodePair) o;

		return forward.equals(that.forward) && reverse.equals(that.reverse);
	}

	public int hashCode() {
		return forward.hashCode() * 31 + reverse.hashCode();
	}

	public String toString() {
		return "(" + forward + ", " + reverse + ")";
	}
}
