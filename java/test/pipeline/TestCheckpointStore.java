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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.CheckpointException;
import uk.ac.sanger.nodule.pipeline.CheckpointStore;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineState;

public class TestCheckpointStore {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private CheckpointStore store;
	private File workDirectory;

	@Before
	public void setUp() throws IOException {
		Logger logger = Logger.getLogger("test.pipeline");
		logger.setUseParentHandlers(false);

		workDirectory = folder.newFolder("run");

		store = new CheckpointStore(new File(workDirectory, "checkpoints"), "nodule", logger);
	}

	private PipelineState createState() {
		Map<String, String> settings = new HashMap<String, String>();
		settings.put(PipelineConfiguration.ASSEMBLER_ENGINE, "skesa");
		settings.put(PipelineConfiguration.BARCODE_FILE, "/data/barcodes.csv");

		PathLayout layout = new PathLayout(workDirectory, PathLayout.createReplicates(
				Arrays.asList(new File("/data/plateA_R1.fastq.gz"), new File("/data/plateB_R1.fastq.gz")),
				Arrays.asList(new File("/data/plateA_R2.fastq.gz"), new File("/data/plateB_R2.fastq.gz"))));

		PipelineState state = PipelineState.coldStart("20260101_120000", PipelineConfiguration.fromMap(settings),
				layout);

		state.setCursor(4);
		state.addFailedStage("quality_filter");

		return state;
	}

	private File writeText(String name, String text) throws IOException {
		File file = new File(workDirectory, name);
		Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testWriteAndRead() throws CheckpointException {
		File file = store.write("before_assemble_pooled", createState());

		assertEquals("nodule_before_assemble_pooled.checkpoint", file.getName());
		assertTrue(file.isFile());

		PipelineState state = CheckpointStore.read(file);

		assertEquals("20260101_120000", state.getRunId());
		assertEquals(4, state.getCursor());
		assertEquals(Arrays.asList("quality_filter"), state.getFailedStages());
		assertEquals(PipelineState.CURRENT_FORMAT_VERSION, state.getFormatVersion());
		assertEquals("skesa", state.getPipelineConfiguration().getProperty(PipelineConfiguration.ASSEMBLER_ENGINE));
		assertEquals(workDirectory.getPath(), state.getLayout().getWorkDirectory());
		assertEquals(Arrays.asList("plateA", "plateB"), state.getLayout().getReplicateNames());
		assertEquals(new File("/data/plateB_R2.fastq.gz"), state.getLayout().getReplicates().get(1).getReverseFile());

		assertEquals(1, new File(workDirectory, "checkpoints").listFiles().length);
	}

	@Test
	public void testOverwriteKeepsOneFile() throws CheckpointException {
		PipelineState state = createState();

		store.write("after_all", state);

		state.setCursor(7);

		File file = store.write("after_all", state);

		assertEquals(7, CheckpointStore.read(file).getCursor());
		assertEquals(1, store.getDirectory().listFiles().length);
	}

	@Test
	public void testUnknownPropertiesAreIgnored() throws Exception {
		File file = writeText("extra.checkpoint", "{ \"formatVersion\" : 1, \"runId\" : \"r\", \"cursor\" : 2,"
				+ " \"comment\" : \"added by hand\","
				+ " \"layout\" : { \"workDirectory\" : \"/tmp/run\", \"replicates\" : [], \"colour\" : \"blue\" } }");

		PipelineState state = CheckpointStore.read(file);

		assertEquals(2, state.getCursor());
		assertTrue(state.getFailedStages().isEmpty());
	}

	@Test(expected = CheckpointException.class)
	public void testCorruptCheckpoint() throws Exception {
		CheckpointStore.read(writeText("corrupt.checkpoint", "{ \"formatVersion\" : 1, \"cursor\" : "));
	}

	@Test(expected = CheckpointException.class)
	public void testNewerFormatVersion() throws Exception {
		CheckpointStore.read(writeText("newer.checkpoint", "{ \"formatVersion\" : 99, \"cursor\" : 0,"
				+ " \"layout\" : { \"workDirectory\" : \"/tmp/run\" } }"));
	}

	@Test(expected = CheckpointException.class)
	public void testMissingLayout() throws Exception {
		CheckpointStore.read(writeText("nolayout.checkpoint", "{ \"formatVersion\" : 1, \"cursor\" : 0 }"));
	}

	@Test(expected = CheckpointException.class)
	public void testMissingFile() throws Exception {
		CheckpointStore.read(new File(workDirectory, "nonexistent.checkpoint"));
	}
}
