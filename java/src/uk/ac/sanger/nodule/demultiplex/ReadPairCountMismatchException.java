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

package uk.ac.sanger.nodule.demultiplex;

import java.io.File;

import uk.ac.sanger.nodule.NoduleException;

/**
 * Thrown when the forward and reverse FASTQ files of a replicate hold
 * different numbers of records. The inputs are corrupt and the run cannot
 * proceed.
 */

public class ReadPairCountMismatchException extends NoduleException {
	private final long forwardCount;
	private final long reverseCount;

	public ReadPairCountMismatchException(File forward, long forwardCount, File reverse, long reverseCount) {
		super("Read count mismatch: " + forward.getPath() + " has " + forwardCount + " records but "
				+ reverse.getPath() + " has " + reverseCount);
		this.forwardCount = forwardCount;
		this.reverseCount = reverseCount;
	}

	public long getForwardCount() {
		return forwardCount;
	}

	public long getReverseCount() {
		return reverseCount;
	}
}
