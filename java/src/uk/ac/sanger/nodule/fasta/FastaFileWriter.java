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

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import uk.ac.sanger.nodule.data.Contig;

public class FastaFileWriter {
	private static final int LINE_LENGTH = 60;

	public void writeContigs(File file, List<Contig> contigs) throws IOException {
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.US_ASCII));

		try {
			for (Contig contig : contigs) {
				bw.write(">" + contig.getName());
				bw.newLine();

				String sequence = contig.getSequence() == null ? "" : contig.getSequence();

				for (int i = 0; i < sequence.length(); i += LINE_LENGTH) {
					bw.write(sequence, i, Math.min(LINE_LENGTH, sequence.length() - i));
					bw.newLine();
				}
			}
		} finally {
			bw.close();
		}
	}
}
