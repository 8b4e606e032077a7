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

package uk.ac.sanger.nodule.homology;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.data.Contig;
import uk.ac.sanger.nodule.data.HomologyHit;
import uk.ac.sanger.nodule.fasta.FastaFileException;
import uk.ac.sanger.nodule.fasta.FastaFileReader;
import uk.ac.sanger.nodule.jobrunner.ExternalToolException;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;
import uk.ac.sanger.nodule.jobrunner.SimpleJobRunnerClient;

/**
 * Runs blastn on a FASTA file of contigs and annotates each hit with the file
 * and the sequence of its query.
 */

public class BlastnSearcher implements HomologySearcher {
	private static final String TOOL = "blastn";

	private final String executable;
	private final ProcessRunner runner;
	private final Logger logger;

	private final FastaFileReader fastaReader = new FastaFileReader();
	private final BlastOutputParser parser = new BlastOutputParser();

	public BlastnSearcher(String executable, ProcessRunner runner, Logger logger) {
		this.executable = executable;
		this.runner = runner;
		this.logger = logger;
	}

	public List<HomologyHit> search(File queryFasta, List<String> params) throws HomologySearchException {
		List<Contig> queries;

		try {
			queries = fastaReader.readContigs(queryFasta);
		} catch (IOException ioe) {
			throw new HomologySearchException(ioe, TOOL, "Failed to read the query file " + queryFasta.getPath());
		} catch (FastaFileException ffe) {
			throw new HomologySearchException(ffe, TOOL, "The query file " + queryFasta.getPath() + " is not valid FASTA");
		}

		List<HomologyHit> hits = new ArrayList<HomologyHit>();

		if (queries.isEmpty())
			return hits;

		Map<String, String> sequences = new HashMap<String, String>();

		for (Contig query : queries)
			sequences.put(query.getName(), query.getSequence());

		List<String> command = new ArrayList<String>();

		command.add(executable);
		command.add("-query");
		command.add(queryFasta.getPath());
		command.add("-outfmt");
		command.add("10");
		command.addAll(params);

		String stdout;

		try {
			stdout = SimpleJobRunnerClient.executeCommand(runner, TOOL, command, queryFasta.getParentFile());
		} catch (ExternalToolException ete) {
			if (ete.hasExitStatus())
				throw new HomologySearchException(TOOL, ete.getExitStatus(), ete.getStderr(), ete.getMessage());
			else
				throw new HomologySearchException(ete, TOOL, "blastn could not be run on " + queryFasta.getPath());
		}

		for (HomologyHit hit : parser.parse(stdout))
			hits.add(hit.withProvenance(queryFasta.getPath(), sequences.get(hit.getQueryName())));

		if (logger.isLoggable(Level.FINE))
			logger.fine("blastn found " + hits.size() + " hits for " + queries.size() + " queries in "
					+ queryFasta.getPath());

		return hits;
	}
}
