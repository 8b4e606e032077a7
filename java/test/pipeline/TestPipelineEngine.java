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

package test.pipeline;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.AbstractStage;
import uk.ac.sanger.nodule.pipeline.CheckpointException;
import uk.ac.sanger.nodule.pipeline.CheckpointStore;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.PipelineEngine;
import uk.ac.sanger.nodule.pipeline.PipelineEvent;
import uk.ac.sanger.nodule.pipeline.PipelineListener;
import uk.ac.sanger.nodule.pipeline.PipelineState;
import uk.ac.sanger.nodule.pipeline.RunOutcome;
import uk.ac.sanger.nodule.pipeline.StageException;

public class TestPipelineEngine {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Logger logger;
	private File workDirectory;

	@Before
	public void setUp() throws Exception {
		logger = Logger.getLogger("test.pipeline");
		logger.setUseParentHandlers(false);

		workDirectory = folder.newFolder("run");
	}

	private static class CountingStage extends AbstractStage {
		private int executions = 0;
		private StageException failure = null;
		private RuntimeException error = null;
		private PipelineEngine engineToCancel = null;

		CountingStage(String name, String... prerequisites) {
			super(name, prerequisites);
		}

		public void execute(PipelineContext context) throws StageException {
			executions++;

			if (engineToCancel != null)
				engineToCancel.cancel();

			if (failure != null)
				throw failure;

			if (error != null)
				throw error;
		}
	}

	private PipelineState createState(String policy) {
		Map<String, String> settings = new HashMap<String, String>();

		settings.put(PipelineConfiguration.ERROR_POLICY, policy);
		settings.put(PipelineConfiguration.THREADS, "1");
		settings.put(PipelineConfiguration.CHECKPOINT_PREFIX, "test");

		PathLayout layout = new PathLayout(workDirectory, new ArrayList<PathLayout.Replicate>());

		return PipelineState.coldStart("run-1", PipelineConfiguration.fromMap(settings), layout);
	}

	private List<CountingStage> createStages() {
		return Arrays.asList(new CountingStage("first"), new CountingStage("second", "first"),
				new CountingStage("third"));
	}

	private File checkpoint(String tag) {
		return new File(new File(workDirectory, PathLayout.CHECKPOINT_DIRECTORY), "test_" + tag
				+ CheckpointStore.SUFFIX);
	}

	@Test
	public void testRunToCompletion() throws Exception {
		List<CountingStage> stages = createStages();

		RunOutcome outcome = new PipelineEngine(stages, logger).run(createState("halt"));

		assertEquals(RunOutcome.Status.COMPLETED, outcome.getStatus());
		assertEquals(3, outcome.getCursor());
		assertFalse(outcome.hasFailures());

		for (CountingStage stage : stages)
			assertEquals(1, stage.executions);

		assertTrue(checkpoint("before_first").isFile());
		assertTrue(checkpoint("before_second").isFile());
		assertTrue(checkpoint("before_third").isFile());
		assertEquals(checkpoint("after_all"), outcome.getLastCheckpoint());

		PipelineState saved = CheckpointStore.read(checkpoint("after_all"));

		assertEquals(3, saved.getCursor());
		assertEquals("run-1", saved.getRunId());
		assertEquals(0, CheckpointStore.read(checkpoint("before_first")).getCursor());
		assertEquals(2, CheckpointStore.read(checkpoint("before_third")).getCursor());
	}

	@Test
	public void testHaltPolicyStopsAtFailedStage() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(1).failure = new StageException("second", "no luck");

		RunOutcome outcome = new PipelineEngine(stages, logger).run(createState("halt"));

		assertEquals(RunOutcome.Status.HALTED, outcome.getStatus());
		assertEquals("second", outcome.getStoppedAt());
		assertEquals(1, outcome.getCursor());
		assertEquals(Arrays.asList("second"), outcome.getFailedStages());
		assertEquals(checkpoint("before_second"), outcome.getLastCheckpoint());
		assertEquals(0, stages.get(2).executions);
		assertFalse(checkpoint("after_all").exists());
	}

	@Test
	public void testContinuePolicyRunsLaterStages() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(1).failure = new StageException("second", "no luck");

		RunOutcome outcome = new PipelineEngine(stages, logger).run(createState("continue"));

		assertEquals(RunOutcome.Status.COMPLETED, outcome.getStatus());
		assertEquals(1, stages.get(2).executions);
		assertEquals(1, outcome.getCursor());
		assertEquals(Arrays.asList("second"), outcome.getFailedStages());

		PipelineState saved = CheckpointStore.read(checkpoint("after_all"));

		assertEquals(1, saved.getCursor());
		assertEquals(Arrays.asList("second"), saved.getFailedStages());
	}

	@Test
	public void testFatalErrorHaltsUnderContinuePolicy() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(0).failure = new StageException("first", null, "broken input", true);

		RunOutcome outcome = new PipelineEngine(stages, logger).run(createState("continue"));

		assertEquals(RunOutcome.Status.HALTED, outcome.getStatus());
		assertEquals("first", outcome.getStoppedAt());
		assertEquals(0, stages.get(1).executions);
	}

	@Test
	public void testUnexpectedErrorIsAStageFailure() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(2).error = new IllegalStateException("bug");

		RunOutcome outcome = new PipelineEngine(stages, logger).run(createState("continue"));

		assertEquals(RunOutcome.Status.COMPLETED, outcome.getStatus());
		assertEquals(Arrays.asList("third"), outcome.getFailedStages());
		assertEquals(2, outcome.getCursor());
	}

	@Test
	public void testResumeSkipsCompletedStages() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(1).failure = new StageException("second", "no luck");

		RunOutcome halted = new PipelineEngine(stages, logger).run(createState("halt"));

		List<CountingStage> fresh = createStages();

		RunOutcome outcome = new PipelineEngine(fresh, logger).resume(halted.getLastCheckpoint(), null);

		assertEquals(RunOutcome.Status.COMPLETED, outcome.getStatus());
		assertEquals(0, fresh.get(0).executions);
		assertEquals(1, fresh.get(1).executions);
		assertEquals(1, fresh.get(2).executions);
		assertEquals(3, outcome.getCursor());
		assertFalse(outcome.hasFailures());
	}

	@Test
	public void testResumeWithOverrideConfiguration() throws Exception {
		new PipelineEngine(createStages(), logger).run(createState("halt"));

		Map<String, String> override = new HashMap<String, String>();
		override.put(PipelineConfiguration.ERROR_POLICY, "continue");
		override.put(PipelineConfiguration.CHECKPOINT_PREFIX, "test");
		override.put(PipelineConfiguration.BLAST_PARAMS, "-max_target_seqs 5");

		List<CountingStage> fresh = createStages();

		new PipelineEngine(fresh, logger).resume(checkpoint("before_third"), PipelineConfiguration.fromMap(override));

		assertEquals(0, fresh.get(1).executions);
		assertEquals(1, fresh.get(2).executions);

		PipelineState saved = CheckpointStore.read(checkpoint("after_all"));

		assertEquals("continue", saved.getConfiguration().get(PipelineConfiguration.ERROR_POLICY));
		assertEquals("-max_target_seqs 5", saved.getConfiguration().get(PipelineConfiguration.BLAST_PARAMS));
		assertEquals(workDirectory.getPath(), saved.getLayout().getWorkDirectory());
	}

	@Test
	public void testResumeWithPartialOverrideKeepsStoredSettings() throws Exception {
		List<CountingStage> stages = createStages();
		stages.get(1).failure = new StageException("second", "no luck");

		PipelineState state = createState("halt");
		state.applyConfiguration(state.getPipelineConfiguration().withProperty(PipelineConfiguration.ASSEMBLER_ENGINE,
				"spades"));

		RunOutcome halted = new PipelineEngine(stages, logger).run(state);

		File settings = folder.newFile("override.props");
		Files.write(settings.toPath(), "pipeline.errorpolicy=continue\n".getBytes(StandardCharsets.ISO_8859_1));

		PipelineConfiguration override = PipelineConfiguration.loadOverride(
				CheckpointStore.read(halted.getLastCheckpoint()).getPipelineConfiguration(), settings);

		new PipelineEngine(createStages(), logger).resume(halted.getLastCheckpoint(), override);

		PipelineState saved = CheckpointStore.read(checkpoint("after_all"));

		assertEquals("continue", saved.getConfiguration().get(PipelineConfiguration.ERROR_POLICY));
		assertEquals("spades", saved.getConfiguration().get(PipelineConfiguration.ASSEMBLER_ENGINE));
		assertEquals("test", saved.getConfiguration().get(PipelineConfiguration.CHECKPOINT_PREFIX));
		assertEquals("1", saved.getConfiguration().get(PipelineConfiguration.THREADS));
	}

	@Test
	public void testResumeFromFinalCheckpointRunsNothing() throws Exception {
		new PipelineEngine(createStages(), logger).run(createState("halt"));

		List<CountingStage> fresh = createStages();

		RunOutcome outcome = new PipelineEngine(fresh, logger).resume(checkpoint("after_all"), null);

		assertEquals(RunOutcome.Status.COMPLETED, outcome.getStatus());

		for (CountingStage stage : fresh)
			assertEquals(0, stage.executions);
	}

	@Test(expected = CheckpointException.class)
	public void testResumeWithCursorBeyondStages() throws Exception {
		PipelineState state = createState("halt");
		state.setCursor(7);

		File file = new CheckpointStore(folder.getRoot(), "bad", logger).write("cursor", state);

		new PipelineEngine(createStages(), logger).resume(file, null);
	}

	@Test
	public void testCancelDuringStage() throws Exception {
		List<CountingStage> stages = createStages();

		PipelineEngine engine = new PipelineEngine(stages, logger);

		stages.get(0).engineToCancel = engine;

		RunOutcome outcome = engine.run(createState("continue"));

		assertEquals(RunOutcome.Status.CANCELLED, outcome.getStatus());
		assertEquals("first", outcome.getStoppedAt());
		assertEquals(0, outcome.getCursor());
		assertEquals(checkpoint("before_first"), outcome.getLastCheckpoint());
		assertEquals(0, stages.get(1).executions);
		assertTrue(engine.isCancelled());
	}

	@Test
	public void testListenerSeesEveryStage() throws Exception {
		PipelineListener listener = mock(PipelineListener.class);

		PipelineEngine engine = new PipelineEngine(createStages(), logger);
		engine.setListener(listener);

		engine.run(createState("halt"));

		ArgumentCaptor<PipelineEvent> captor = ArgumentCaptor.forClass(PipelineEvent.class);

		verify(listener, atLeastOnce()).report(captor.capture());

		List<PipelineEvent> events = captor.getAllValues();

		assertEquals(PipelineEvent.Type.RUN_STARTED, events.get(0).getType());
		assertEquals(PipelineEvent.Type.RUN_COMPLETED, events.get(events.size() - 1).getType());
		assertTrue(events.get(events.size() - 1).isTerminal());

		int started = 0;
		int completed = 0;

		for (PipelineEvent event : events) {
			if (event.getType() == PipelineEvent.Type.STAGE_STARTED)
				started++;
			else if (event.getType() == PipelineEvent.Type.STAGE_COMPLETED)
				completed++;
		}

		assertEquals(3, started);
		assertEquals(3, completed);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testStagesOutOfOrder() {
		new PipelineEngine(Arrays.asList(new CountingStage("second", "first"), new CountingStage("first")), logger);
	}
}
