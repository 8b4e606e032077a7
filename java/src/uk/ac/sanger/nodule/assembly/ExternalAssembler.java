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
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.data.Contig;
import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.fasta.FastaFileException;
import uk.ac.sanger.nodule.fasta.FastaFileReader;
import uk.ac.sanger.nodule.jobrunner.ExternalToolException;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;
import uk.ac.sanger.nodule.jobrunner.SimpleJobRunnerClient;

/**
 * Runs one of the supported assembler programs as an external process and
 * reads back the contigs which it wrote.
 */

public class ExternalAssembler implements Assembler {
	private final AssemblyEngine engine;
	private final String executable;
	private final ProcessRunner runner;
	private final Logger logger;

	private final FastaFileReader fastaReader = new FastaFileReader();

	public ExternalAssembler(AssemblyEngine engine, String executable, ProcessRunner runner, Logger logger) {
		this.engine = engine;
		this.executable = executable;
		this.runner = runner;
		this.logger = logger;
	}

	public AssemblyEngine getEngine() {
		return engine;
	}

	public ContigSet assemble(Well well, String tag, File forwardReads, File reverseReads, File outputDirectory,
			List<String> params) throws AssemblyException {
		if (isEmpty(forwardReads) || isEmpty(reverseReads)) {
			logger.fine("No reads to assemble for " + well + " (" + tag + ")");
			return ContigSet.empty(well, tag, null);
		}

		try {
			prepareOutputDirectory(outputDirectory);
		} catch (IOException ioe) {
			throw new AssemblyException(ioe, engine.getName(),
					"Failed to prepare the assembler output directory " + outputDirectory.getPath());
		}

		List<String> command = engine.buildCommand(executable, forwardReads, reverseReads, outputDirectory, params);

		String stdout;

		try {
			stdout = SimpleJobRunnerClient.executeCommand(runner, engine.getName(), command, outputDirectory.getParentFile());
		} catch (ExternalToolException ete) {
			if (ete.hasExitStatus())
				throw new AssemblyException(engine.getName(), ete.getExitStatus(), ete.getStderr(),
						engine.getName() + " failed on " + well + " (" + tag + "): " + ete.getMessage());
			else
				throw new AssemblyException(ete, engine.getName(),
						engine.getName() + " could not be run on " + well + " (" + tag + ")");
		}

		File contigsFile = engine.getContigsFile(outputDirectory);

		try {
			if (engine.writesContigsToStdout())
				writeText(contigsFile, stdout);

			List<Contig> contigs = fastaReader.readContigs(contigsFile);

			if (logger.isLoggable(Level.FINE))
				logger.fine(engine.getName() + " produced " + contigs.size() + " contigs for " + well + " (" + tag + ")");

			return new ContigSet(well, tag, contigsFile, contigs);
		} catch (IOException ioe) {
			throw new AssemblyException(ioe, engine.getName(), "Failed to read the contigs file " + contigsFile.getPath());
		} catch (FastaFileException ffe) {
			throw new AssemblyException(ffe, engine.getName(), "The contigs file " + contigsFile.getPath()
					+ " is not valid FASTA");
		}
	}

	private boolean isEmpty(File file) {
		return file == null || !file.exists() || file.length() == 0;
	}

	private void prepareOutputDirectory(File directory) throws IOException {
		if (directory.exists())
			deleteRecursively(directory);

		if (!engine.createsOutputDirectory() && !directory.mkdirs())
			throw new IOException("Cannot create directory " + directory.getPath());
	}

	private void deleteRecursively(File file) throws IOException {
		File[] children = file.listFiles();

		if (children != null)
			for (File child : children)
				deleteRecursively(child);

		if (!file.delete())
			throw new IOException("Cannot delete " + file.getPath());
	}

	private void writeText(File file, String text) throws IOException {
		Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);

		try {
			writer.write(text);
		} finally {
			writer.close();
		}
	}
}
