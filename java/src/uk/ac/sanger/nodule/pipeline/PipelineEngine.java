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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.Assembler;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.homology.HomologySearcher;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;

/**
 * Runs the stages of the pipeline in order, starting from the cursor of the
 * run state.
 * <p>
 * Before each stage, the complete run state is written to a checkpoint tagged
 * <code>before_&lt;stage&gt;</code>. When the stage at the cursor succeeds, the
 * cursor moves past it. When a stage fails, it is recorded in the list of
 * failed stages and the cursor stays where it is, so that resuming from a
 * later checkpoint runs the failed stage again. The error policy decides
 * whether the run stops or goes on to the next stage. When every stage has
 * been visited, the state is written to a checkpoint tagged
 * <code>after_all</code>.
 */

public class PipelineEngine {
	public static final String BEFORE_PREFIX = "before_";
	public static final String AFTER_ALL = "after_all";

	private final List<Stage> stages;
	private final StageGraph graph;
	private final Logger logger;

	private PipelineListener listener = null;

	private Assembler assembler = null;
	private HomologySearcher homologySearcher = null;
	private BarcodeTable barcodeTable = null;

	private volatile boolean cancelled = false;
	private volatile ProcessRunner runner = null;
	private volatile WellWorkerPool pool = null;

	/**
	 * @throws IllegalArgumentException
	 *             if the stages are not in an order which respects their
	 *             prerequisites.
	 */

	public PipelineEngine(List<? extends Stage> stages, Logger logger) {
		this.stages = new ArrayList<Stage>(stages);
		this.graph = new StageGraph(stages);
		this.logger = logger;
	}

	public List<Stage> getStages() {
		return Collections.unmodifiableList(stages);
	}

	public StageGraph getStageGraph() {
		return graph;
	}

	public void setListener(PipelineListener listener) {
		this.listener = listener;
	}

	public void setAssembler(Assembler assembler) {
		this.assembler = assembler;
	}

	public void setHomologySearcher(HomologySearcher homologySearcher) {
		this.homologySearcher = homologySearcher;
	}

	public void setBarcodeTable(BarcodeTable barcodeTable) {
		this.barcodeTable = barcodeTable;
	}

	/**
	 * Resumes a run from a checkpoint.
	 *
	 * @param checkpoint
	 *            the checkpoint file.
	 * @param override
	 *            a configuration which replaces the one stored in the
	 *            checkpoint, or null to keep the stored one.
	 */

	public RunOutcome resume(File checkpoint, PipelineConfiguration override)
			throws CheckpointException, ConfigurationException {
		PipelineState state = CheckpointStore.read(checkpoint);

		if (state.getCursor() < 0 || state.getCursor() > stages.size())
			throw new CheckpointException("The checkpoint " + checkpoint.getPath() + " has cursor "
					+ state.getCursor() + ", which is not between 0 and " + stages.size());

		if (override != null) {
			state.applyConfiguration(override);
			logger.info("Configuration of run " + state.getRunId() + " replaced by the override settings");
		}

		logger.info("Resuming run " + state.getRunId() + " from " + checkpoint.getPath() + " at stage "
				+ (state.getCursor() < stages.size() ? stages.get(state.getCursor()).getName() : "(end)"));

		return run(state);
	}

	public RunOutcome run(PipelineState state) throws CheckpointException, ConfigurationException {
		PipelineConfiguration config = state.getPipelineConfiguration();
		PathLayout layout = state.getLayout();

		ErrorPolicy policy = config.getErrorPolicy();

		CheckpointStore store = new CheckpointStore(layout.getCheckpointDirectory(),
				config.getProperty(PipelineConfiguration.CHECKPOINT_PREFIX, "nodule"), logger);

		runner = new ProcessRunner(logger, config.getGracePeriodSeconds());
		pool = new WellWorkerPool(config.getThreads(), logger);

		if (cancelled) {
			runner.cancel();
			pool.cancel();
		}

		PipelineContext context = new PipelineContext(config, layout, logger, runner, pool);

		if (assembler != null)
			context.setAssembler(assembler);

		if (homologySearcher != null)
			context.setHomologySearcher(homologySearcher);

		if (barcodeTable != null)
			context.setBarcodeTable(barcodeTable);

		try {
			return run(state, context, store, policy);
		} finally {
			pool.shutdown();
		}
	}

	private RunOutcome run(PipelineState state, PipelineContext context, CheckpointStore store, ErrorPolicy policy)
			throws CheckpointException {
		File lastCheckpoint = null;

		notifyListener(PipelineEvent.Type.RUN_STARTED, "Run " + state.getRunId() + " starting at stage "
				+ state.getCursor() + " of " + stages.size() + " with error policy " + policy, null, -1, null, null);

		for (int i = state.getCursor(); i < stages.size(); i++) {
			Stage stage = stages.get(i);

			if (cancelled)
				return cancelledOutcome(state, stage.getName(), lastCheckpoint);

			lastCheckpoint = store.write(BEFORE_PREFIX + stage.getName(), state);

			notifyListener(PipelineEvent.Type.CHECKPOINT_WRITTEN, "Checkpoint " + lastCheckpoint.getName(),
					stage.getName(), i, lastCheckpoint, null);

			notifyListener(PipelineEvent.Type.STAGE_STARTED, "Starting stage " + stage.getName(), stage.getName(), i,
					null, null);

			long t0 = System.currentTimeMillis();

			StageException failure = null;

			try {
				stage.execute(context);
			} catch (StageException se) {
				failure = se;
			} catch (RuntimeException re) {
				failure = new StageException(stage.getName(), re, "Unexpected error in stage " + stage.getName()
						+ ": " + re);
			}

			long dt = System.currentTimeMillis() - t0;

			if (cancelled)
				return cancelledOutcome(state, stage.getName(), lastCheckpoint);

			if (failure == null) {
				if (i == state.getCursor())
					state.setCursor(i + 1);

				state.removeFailedStage(stage.getName());

				notifyListener(PipelineEvent.Type.STAGE_COMPLETED, "Stage " + stage.getName() + " completed in "
						+ dt + " ms", stage.getName(), i, null, null);

				continue;
			}

			logger.log(Level.SEVERE, "Stage " + stage.getName() + " of run " + state.getRunId() + " failed after "
					+ dt + " ms: " + failure.getMessage(), failure);

			state.addFailedStage(stage.getName());

			notifyListener(PipelineEvent.Type.STAGE_FAILED, failure.getMessage(), stage.getName(), i, null, failure);

			if (failure.isFatal() || policy == ErrorPolicy.HALT) {
				String message = "Run halted at stage " + stage.getName()
						+ (failure.isFatal() ? " after a fatal error" : "") + ". Resume from "
						+ lastCheckpoint.getPath();

				logger.warning(message);

				notifyListener(PipelineEvent.Type.RUN_HALTED, message, stage.getName(), i, lastCheckpoint, failure);

				return new RunOutcome(RunOutcome.Status.HALTED, state.getCursor(), state.getFailedStages(),
						stage.getName(), lastCheckpoint);
			}

			List<String> dependents = graph.getDependents(stage.getName());

			if (!dependents.isEmpty())
				logger.warning("Continuing after the failure of stage " + stage.getName()
						+ ", but these stages depend on it: " + dependents);
		}

		lastCheckpoint = store.write(AFTER_ALL, state);

		notifyListener(PipelineEvent.Type.CHECKPOINT_WRITTEN, "Checkpoint " + lastCheckpoint.getName(), null, -1,
				lastCheckpoint, null);

		String message = state.getFailedStages().isEmpty() ? "Run " + state.getRunId() + " completed"
				: "Run " + state.getRunId() + " completed with failed stages " + state.getFailedStages();

		logger.info(message);

		notifyListener(PipelineEvent.Type.RUN_COMPLETED, message, null, -1, lastCheckpoint, null);

		return new RunOutcome(RunOutcome.Status.COMPLETED, state.getCursor(), state.getFailedStages(), null,
				lastCheckpoint);
	}

	private RunOutcome cancelledOutcome(PipelineState state, String stageName, File lastCheckpoint) {
		String message = "Run " + state.getRunId() + " cancelled at stage " + stageName
				+ (lastCheckpoint == null ? "" : ". Resume from " + lastCheckpoint.getPath());

		logger.warning(message);

		notifyListener(PipelineEvent.Type.RUN_CANCELLED, message, stageName, -1, lastCheckpoint, null);

		return new RunOutcome(RunOutcome.Status.CANCELLED, state.getCursor(), state.getFailedStages(), stageName,
				lastCheckpoint);
	}

	/**
	 * Stops the run: no further stage or well task is started, and running
	 * external programs are terminated. May be called from any thread.
	 */

	public void cancel() {
		cancelled = true;

		WellWorkerPool currentPool = pool;

		if (currentPool != null)
			currentPool.cancel();

		ProcessRunner currentRunner = runner;

		if (currentRunner != null)
			currentRunner.cancel();
	}

	public boolean isCancelled() {
		return cancelled;
	}

	private void notifyListener(PipelineEvent.Type type, String message, String stageName, int stageIndex,
			File checkpoint, Exception exception) {
		if (listener != null)
			listener.report(new PipelineEvent(this, type, message, stageName, stageIndex, checkpoint, exception));
	}
}
