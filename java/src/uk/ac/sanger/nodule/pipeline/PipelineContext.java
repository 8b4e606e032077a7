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

package uk.ac.sanger.nodule.pipeline;

import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.Assembler;
import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.assembly.ExternalAssembler;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableException;
import uk.ac.sanger.nodule.barcode.BarcodeTableLoader;
import uk.ac.sanger.nodule.homology.BlastnSearcher;
import uk.ac.sanger.nodule.homology.HomologySearcher;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;

/**
 * What a stage can see while it runs: the configuration and path layout of
 * the run, the logger, the worker pool and the collaborators which do the real
 * work. The collaborators are created from the configuration when first asked
 * for, unless they have been supplied already.
 */

public class PipelineContext {
	private final PipelineConfiguration config;
	private final PathLayout layout;
	private final Logger logger;
	private final ProcessRunner runner;
	private final WellWorkerPool pool;

	private BarcodeTable barcodeTable = null;
	private Assembler assembler = null;
	private HomologySearcher homologySearcher = null;

	public PipelineContext(PipelineConfiguration config, PathLayout layout, Logger logger, ProcessRunner runner,
			WellWorkerPool pool) {
		this.config = config;
		this.layout = layout;
		this.logger = logger;
		this.runner = runner;
		this.pool = pool;
	}

	public PipelineConfiguration getConfiguration() {
		return config;
	}

	public PathLayout getLayout() {
		return layout;
	}

	public Logger getLogger() {
		return logger;
	}

	public ProcessRunner getProcessRunner() {
		return runner;
	}

	public WellWorkerPool getWorkerPool() {
		return pool;
	}

	public synchronized BarcodeTable getBarcodeTable() throws ConfigurationException, BarcodeTableException {
		if (barcodeTable == null)
			barcodeTable = new BarcodeTableLoader(logger).load(config.getFile(PipelineConfiguration.BARCODE_FILE));

		return barcodeTable;
	}

	public synchronized void setBarcodeTable(BarcodeTable barcodeTable) {
		this.barcodeTable = barcodeTable;
	}

	public synchronized Assembler getAssembler() throws ConfigurationException {
		if (assembler == null) {
			AssemblyEngine engine = config.getAssemblyEngine();
			assembler = new ExternalAssembler(engine, config.getAssemblerExecutable(engine), runner, logger);
		}

		return assembler;
	}

	public synchronized void setAssembler(Assembler assembler) {
		this.assembler = assembler;
	}

	public synchronized HomologySearcher getHomologySearcher() {
		if (homologySearcher == null)
			homologySearcher = new BlastnSearcher(config.getProperty(PipelineConfiguration.BLAST_COMMAND, "blastn"),
					runner, logger);

		return homologySearcher;
	}

	public synchronized void setHomologySearcher(HomologySearcher homologySearcher) {
		this.homologySearcher = homologySearcher;
	}

	public boolean isCancelled() {
		return pool.isCancelled() || (runner != null && runner.isCancelled());
	}

	/**
	 * @throws CancellationException
	 *             if the run has been cancelled.
	 */

	public void checkCancelled() {
		if (isCancelled())
			throw new CancellationException("The run has been cancelled");
	}
}
