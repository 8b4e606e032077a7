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

package uk.ac.sanger.nodule.assembly;

import java.io.File;
import java.util.List;

import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;

public interface Assembler {
	/**
	 * Assembles a pair of FASTQ files.
	 *
	 * @param well
	 *            the well which the reads came from.
	 * @param tag
	 *            the mode tag of the resulting contig set: "pooled" or the name
	 *            of a replicate.
	 * @param forwardReads
	 *            the forward reads.
	 * @param reverseReads
	 *            the reverse reads.
	 * @param outputDirectory
	 *            the directory which the assembler may use for its own files.
	 * @param params
	 *            extra parameters passed to the assembler.
	 *
	 * @return the contigs, possibly none. The contig set refers to the file
	 *         which the assembler wrote, or to no file if the assembler did not
	 *         run.
	 *
	 * @throws AssemblyException
	 *             if the assembler failed.
	 */

	public ContigSet assemble(Well well, String tag, File forwardReads, File reverseReads, File outputDirectory,
			List<String> params) throws AssemblyException;
}
