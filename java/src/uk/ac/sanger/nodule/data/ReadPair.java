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

import htsjdk.samtools.fastq.FastqRecord;

/**
 * A forward read and its reverse mate, as read from a pair of FASTQ files.
 */

public class ReadPair {
	private final FastqRecord forward;
	private final FastqRecord reverse;

	public ReadPair(FastqRecord forward, FastqRecord reverse) {
		this.forward = forward;
		this.reverse = reverse;
	}

	public FastqRecord getForward() {
		return forward;
	}

	public FastqRecord getReverse() {
		return reverse;
	}

	public String getForwardSuffix() {
		return getTrailingToken(forward.getReadName());
	}

	public String getReverseSuffix() {
		return getTrailingToken(reverse.getReadName());
	}

	public BarcodePair getBarcodePair() {
		return new BarcodePair(getForwardSuffix(), getReverseSuffix());
	}

	/**
	 * Returns the part of a FASTQ header after the last run of whitespace, or
	 * the whole header if it contains no whitespace.
	 */

	public static String getTrailingToken(String header) {
		if (header == null)
			return "";

		String[] words = header.trim().split("\\s+");

		return words[words.length - 1];
	}

	public String toString() {
		return "ReadPair[forward=\"" + forward.getReadName() + "\", reverse=\"" + reverse.getReadName() + "\"]";
	}
}
