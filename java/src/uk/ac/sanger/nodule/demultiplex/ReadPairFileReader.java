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
import java.util.ArrayList;
import java.util.List;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.fastq.FastqReader;

import uk.ac.sanger.nodule.data.ReadPair;

/**
 * Reads the forward and reverse FASTQ files of one replicate into memory as
 * read pairs.
 */

public class ReadPairFileReader {
	public List<ReadPair> read(File forward, File reverse) throws IOException, ReadPairCountMismatchException {
		List<ReadPair> pairs = new ArrayList<ReadPair>();

		FastqReader forwardReader = null;
		FastqReader reverseReader = null;

		try {
			forwardReader = new FastqReader(forward, true);
			reverseReader = new FastqReader(reverse, true);

			while (forwardReader.hasNext() && reverseReader.hasNext())
				pairs.add(new ReadPair(forwardReader.next(), reverseReader.next()));

			long forwardExtra = drain(forwardReader);
			long reverseExtra = drain(reverseReader);

			if (forwardExtra != reverseExtra)
				throw new ReadPairCountMismatchException(forward, pairs.size() + forwardExtra,
						reverse, pairs.size() + reverseExtra);
		} catch (SAMException se) {
			throw new IOException("Malformed FASTQ input in " + forward.getPath() + " or " + reverse.getPath()
					+ ": " + se.getMessage(), se);
		} finally {
			if (forwardReader != null)
				forwardReader.close();

			if (reverseReader != null)
				reverseReader.close();
		}

		return pairs;
	}

	/**
	 * Checks that the forward and reverse files hold the same number of
	 * records, without keeping the records.
	 *
	 * @return the number of read pairs.
	 */

	public long verifyPairedCounts(File forward, File reverse) throws IOException, ReadPairCountMismatchException {
		long forwardCount = countRecords(forward);
		long reverseCount = countRecords(reverse);

		if (forwardCount != reverseCount)
			throw new ReadPairCountMismatchException(forward, forwardCount, reverse, reverseCount);

		return forwardCount;
	}

	public long countRecords(File file) throws IOException {
		if (!file.exists())
			throw new IOException("FASTQ file " + file.getPath() + " does not exist");

		if (file.length() == 0)
			return 0;

		FastqReader reader = null;

		try {
			reader = new FastqReader(file, true);
			return drain(reader);
		} catch (SAMException se) {
			throw new IOException("Malformed FASTQ input in " + file.getPath() + ": " + se.getMessage(), se);
		} finally {
			if (reader != null)
				reader.close();
		}
	}

	private long drain(FastqReader reader) {
		long count = 0;

		while (reader.hasNext()) {
			reader.next();
			count++;
		}

		return count;
	}
}
