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
import java.io.IOException;
import java.util.List;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.fastq.BasicFastqWriter;

import uk.ac.sanger.nodule.data.ReadPair;

/**
 * Writes the read pairs of one well and one replicate as a pair of FASTQ files
 * in the well's directory.
 */

public class WellFileWriter {
	public void write(File wellDirectory, String replicate, List<ReadPair> pairs) throws IOException {
		if (!wellDirectory.isDirectory() && !wellDirectory.mkdirs())
			throw new IOException("Failed to create the well directory " + wellDirectory.getPath());

		File forward = WellFiles.getForwardReads(wellDirectory, replicate);
		File reverse = WellFiles.getReverseReads(wellDirectory, replicate);

		BasicFastqWriter forwardWriter = null;
		BasicFastqWriter reverseWriter = null;

		try {
			forwardWriter = new BasicFastqWriter(forward);
			reverseWriter = new BasicFastqWriter(reverse);

			for (ReadPair pair : pairs) {
				forwardWriter.write(pair.getForward());
				reverseWriter.write(pair.getReverse());
			}
		} catch (SAMException se) {
			throw new IOException("Failed to write reads to " + wellDirectory.getPath() + ": " + se.getMessage(), se);
		} finally {
			if (forwardWriter != null)
				forwardWriter.close();

			if (reverseWriter != null)
				reverseWriter.close();
		}
	}
}
