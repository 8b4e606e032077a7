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
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.demultiplex.WellFiles;
import uk.ac.sanger.nodule.fasta.FastaFileWriter;

/**
 * Assembles the reads in one well directory, either pooled across replicates
 * or for a single replicate, and writes the contigs to the well directory
 * under their well-known names.
 */

public class WellAssembler {
	private final Assembler assembler;
	private final String engineName;
	private final List<String> params;
	private final Logger logger;

	private final FastaFileWriter fastaWriter = new FastaFileWriter();

	public WellAssembler(Assembler assembler, String engineName, List<String> params, Logger logger) {
		this.assembler = assembler;
		this.engineName = engineName;
		this.params = params;
		this.logger = logger;
	}

	/**
	 * Concatenates the reads of every replicate into <code>tmp_R1.fastq</code>
	 * and <code>tmp_R2.fastq</code>, assembles them and writes
	 * <code>contigs.fasta</code>. A well without reads gets an empty contigs
	 * file.
	 */

	public ContigSet assemblePooled(Well well, File wellDirectory, List<String> replicates) throws AssemblyException {
		File forward = WellFiles.getPooledForwardReads(wellDirectory);
		File reverse = WellFiles.getPooledReverseReads(wellDirectory);

		List<File> forwardSources = new ArrayList<File>();
		List<File> reverseSources = new ArrayList<File>();

		for (String replicate : replicates) {
			forwardSources.add(WellFiles.getForwardReads(wellDirectory, replicate));
			reverseSources.add(WellFiles.getReverseReads(wellDirectory, replicate));
		}

		try {
			WellFiles.concatenate(forwardSources, forward);
			WellFiles.concatenate(reverseSources, reverse);
		} catch (IOException ioe) {
			throw new AssemblyException(ioe, engineName, "Failed to pool the reads of " + well);
		}

		File workDirectory = new File(wellDirectory, engineName + "_out");

		ContigSet contigs = assembler.assemble(well, ContigSet.POOLED, forward, reverse, workDirectory, params);

		return save(contigs, WellFiles.getPooledContigs(wellDirectory));
	}

	/**
	 * Assembles the reads of one replicate and writes
	 * <code>&lt;replicate&gt;_ind_contigs.fasta</code>.
	 */

	public ContigSet assembleReplicate(Well well, File wellDirectory, String replicate) throws AssemblyException {
		File forward = WellFiles.getForwardReads(wellDirectory, replicate);
		File reverse = WellFiles.getReverseReads(wellDirectory, replicate);

		File workDirectory = new File(wellDirectory, replicate + "_" + engineName + "_out");

		ContigSet contigs = assembler.assemble(well, replicate, forward, reverse, workDirectory, params);

		return save(contigs, WellFiles.getReplicateContigs(wellDirectory, replicate));
	}

	private ContigSet save(ContigSet contigs, File target) throws AssemblyException {
		try {
			fastaWriter.writeContigs(target, contigs.getContigs());
		} catch (IOException ioe) {
			throw new AssemblyException(ioe, engineName, "Failed to write the contigs file " + target.getPath());
		}

		if (contigs.isEmpty())
			logger.fine("No contigs for " + contigs.getWell() + " (" + contigs.getTag() + ")");

		return contigs.relocate(target);
	}
}
