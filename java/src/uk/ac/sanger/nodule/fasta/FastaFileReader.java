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

package uk.ac.sanger.nodule.fasta;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.data.Contig;

public class FastaFileReader {
	private static final String FASTA_PREFIX = ">";

	private static final String DNA_PATTERN = "^[ACGTNRYSWKMBDHVacgtnryswkmbdhv\\-\\*]+$";

	public void processFile(File file, SequenceProcessor processor) throws IOException, FastaFileException {
		FileInputStream fis = new FileInputStream(file);

		try {
			processFile(fis, processor);
		} finally {
			fis.close();
		}
	}

	public void processFile(InputStream is, SequenceProcessor processor) throws IOException, FastaFileException {
		BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.US_ASCII));

		StringBuilder sb = null;

		String seqname = null;

		String line;

		int lineNumber = 0;

		while ((line = br.readLine()) != null) {
			lineNumber++;

			line = line.trim();

			if (line.isEmpty())
				continue;

			if (line.startsWith(FASTA_PREFIX)) {
				if (seqname != null)
					processor.processSequence(seqname, sb.toString());

				String[] words = line.substring(1).trim().split("\\s+");

				seqname = words[0];

				if (seqname.isEmpty())
					throw new FastaFileException("Data format error: sequence without a name at line " + lineNumber);

				sb = new StringBuilder();
			} else if (seqname == null) {
				throw new FastaFileException("Data format error: line " + lineNumber + " precedes the first sequence name");
			} else if (line.matches(DNA_PATTERN)) {
				sb.append(line);
			} else {
				throw new FastaFileException("Data format error: line " + lineNumber
						+ " does not look like DNA for sequence \"" + seqname + "\"");
			}
		}

		if (seqname != null)
			processor.processSequence(seqname, sb.toString());
	}

	/**
	 * Reads every sequence in a file. A file which does not exist or is empty
	 * yields no sequences.
	 */

	public List<Contig> readContigs(File file) throws IOException, FastaFileException {
		final List<Contig> contigs = new ArrayList<Contig>();

		if (file == null || !file.exists() || file.length() == 0)
			return contigs;

		processFile(file, new SequenceProcessor() {
			public void processSequence(String name, String sequence) {
				contigs.add(new Contig(name, sequence));
			}
		});

		return contigs;
	}
}
