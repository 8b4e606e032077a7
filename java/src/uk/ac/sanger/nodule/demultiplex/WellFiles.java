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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.List;

/**
 * Naming conventions for the files in a well directory:
 *
 * <pre>
 * cells/1A01/rep1_R1.fastq           forward reads of replicate rep1
 * cells/1A01/rep1_R2.fastq           reverse reads of replicate rep1
 * cells/1A01/tmp_R1.fastq            forward reads of all replicates
 * cells/1A01/tmp_R2.fastq            reverse reads of all replicates
 * cells/1A01/contigs.fasta           pooled assembly
 * cells/1A01/rep1_ind_contigs.fasta  assembly of replicate rep1 alone
 * </pre>
 */

public class WellFiles {
	public static final String FORWARD_SUFFIX = "_R1.fastq";
	public static final String REVERSE_SUFFIX = "_R2.fastq";

	public static final String POOLED_FORWARD = "tmp_R1.fastq";
	public static final String POOLED_REVERSE = "tmp_R2.fastq";

	public static final String POOLED_CONTIGS = "contigs.fasta";
	public static final String REPLICATE_CONTIGS_SUFFIX = "_ind_contigs.fasta";

	public static File getForwardReads(File wellDirectory, String replicate) {
		return new File(wellDirectory, replicate + FORWARD_SUFFIX);
	}

	public static File getReverseReads(File wellDirectory, String replicate) {
		return new File(wellDirectory, replicate + REVERSE_SUFFIX);
	}

	public static File getPooledForwardReads(File wellDirectory) {
		return new File(wellDirectory, POOLED_FORWARD);
	}

	public static File getPooledReverseReads(File wellDirectory) {
		return new File(wellDirectory, POOLED_REVERSE);
	}

	public static File getPooledContigs(File wellDirectory) {
		return new File(wellDirectory, POOLED_CONTIGS);
	}

	public static File getReplicateContigs(File wellDirectory, String replicate) {
		return new File(wellDirectory, replicate + REPLICATE_CONTIGS_SUFFIX);
	}

	/**
	 * Writes the contents of the source files, one after another, to the
	 * target file. Missing source files are skipped.
	 */

	public static void concatenate(List<File> sources, File target) throws IOException {
		OutputStream os = new FileOutputStream(target);

		try {
			for (File source : sources)
				if (source.exists())
					Files.copy(source.toPath(), os);
		} finally {
			os.close();
		}
	}

	/**
	 * Counts the records in a well's FASTQ file. Each record is four lines, and
	 * the sequence and quality lines of a zero-length read are empty, so only
	 * blank lines between records are skipped.
	 */

	public static long countFastqRecords(File file) throws IOException {
		if (!file.exists())
			return 0;

		long records = 0;

		BufferedReader br = Files.newBufferedReader(file.toPath());

		try {
			String header;

			while ((header = br.readLine()) != null) {
				if (header.isEmpty())
					continue;

				if (!header.startsWith("@"))
					throw new IOException("Record " + (records + 1) + " of " + file.getPath()
							+ " does not start with a header line: \"" + header + "\"");

				for (int i = 0; i < 3; i++)
					if (br.readLine() == null)
						throw new IOException("Record " + (records + 1) + " of " + file.getPath() + " is truncated");

				records++;
			}
		} finally {
			br.close();
		}

		return records;
	}
}
