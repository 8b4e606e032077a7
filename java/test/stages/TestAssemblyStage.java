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

package test.stages;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.Assembler;
import uk.ac.sanger.nodule.assembly.AssemblyException;
import uk.ac.sanger.nodule.assembly.AssemblyMode;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.data.BarcodePair;
import uk.ac.sanger.nodule.data.Contig;
import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.demultiplex.WellFiles;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;
import uk.ac.sanger.nodule.pipeline.WellWorkerPool;
import uk.ac.sanger.nodule.stages.AssemblyStage;

public class TestAssemblyStage {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Mock
	private Assembler assembler;

	private WellWorkerPool pool;
	private PathLayout layout;
	private PipelineContext context;

	private final Well good = Well.parse("1B01");
	private final Well bad = Well.parse("1B02");

	@Before
	public void setUp() throws IOException {
		MockitoAnnotations.initMocks(this);

		Logger logger = Logger.getLogger("test.stages");
		logger.setUseParentHandlers(false);

		pool = new WellWorkerPool(2, logger);

		layout = new PathLayout(folder.newFolder("run"), PathLayout.createReplicates(
				Arrays.asList(new File("r1_R1.fastq"), new File("r2_R1.fastq")),
				Arrays.asList(new File("r1_R2.fastq"), new File("r2_R2.fastq"))));

		BarcodeTable table = new BarcodeTable();
		table.addWell(good, Arrays.asList(new BarcodePair("F1", "R1")));
		table.addWell(bad, Arrays.asList(new BarcodePair("F2", "R1")));

		for (Well well : table.getWells())
			layout.getWellDirectory(well).mkdirs();

		Map<String, String> settings = new HashMap<String, String>();
		settings.put(PipelineConfiguration.ASSEMBLER_ENGINE, "spades");
		settings.put("assembler.spades.params", "--careful");

		context = new PipelineContext(PipelineConfiguration.fromMap(settings), layout, logger,
				new ProcessRunner(logger, 1), pool);

		context.setBarcodeTable(table);
		context.setAssembler(assembler);
	}

	@After
	public void tearDown() {
		pool.shutdown();
	}

	private static ContigSet contigs(Well well, String tag) {
		List<Contig> list = Arrays.asList(new Contig("NODE_1_length_6_cov_3.0", "ACGTAC"));
		return new ContigSet(well, tag, null, list);
	}

	@Test
	public void testPooledAssemblyCarriesOnPastAFailedWell() throws Exception {
		final List<String> params = Arrays.asList("--careful");

		when(assembler.assemble(eq(good), eq(ContigSet.POOLED), any(File.class), any(File.class), any(File.class),
				eq(params))).thenReturn(contigs(good, ContigSet.POOLED));
		when(assembler.assemble(eq(bad), eq(ContigSet.POOLED), any(File.class), any(File.class), any(File.class),
				eq(params))).thenThrow(new AssemblyException("spades", 255, "", "spades crashed"));

		try {
			new AssemblyStage(AssemblyMode.POOLED).execute(context);
			fail("Expected a StageException");
		} catch (StageException se) {
			assertFalse(se.isFatal());
			assertTrue(se.getMessage().contains("1B02"));
		}

		File goodContigs = WellFiles.getPooledContigs(layout.getWellDirectory(good));

		assertTrue(goodContigs.isFile());
		assertTrue(goodContigs.length() > 0);
		assertFalse(WellFiles.getPooledContigs(layout.getWellDirectory(bad)).exists());

		verify(assembler).assemble(good, ContigSet.POOLED, WellFiles.getPooledForwardReads(layout.getWellDirectory(good)),
				WellFiles.getPooledReverseReads(layout.getWellDirectory(good)),
				new File(layout.getWellDirectory(good), "spades_out"), params);
	}

	@Test
	public void testPerReplicateAssembly() throws Exception {
		when(assembler.assemble(any(Well.class), anyString(), any(File.class), any(File.class), any(File.class),
				anyList())).thenReturn(contigs(good, "r1"));

		new AssemblyStage(AssemblyMode.PER_REPLICATE).execute(context);

		for (Well well : Arrays.asList(good, bad)) {
			assertTrue(WellFiles.getReplicateContigs(layout.getWellDirectory(well), "r1").isFile());
			assertTrue(WellFiles.getReplicateContigs(layout.getWellDirectory(well), "r2").isFile());
		}

		verify(assembler, times(4)).assemble(any(Well.class), anyString(), any(File.class), any(File.class),
				any(File.class), anyList());
	}

	@Test
	public void testUnknownEngineIsFatal() {
		PipelineContext misconfigured = new PipelineContext(PipelineConfiguration.fromMap(
				new HashMap<String, String>()).withProperty(PipelineConfiguration.ASSEMBLER_ENGINE, "velvet"), layout,
				Logger.getLogger("test.stages"), new ProcessRunner(Logger.getLogger("test.stages"), 1), pool);

		try {
			new AssemblyStage(AssemblyMode.POOLED).execute(misconfigured);
			fail("Expected a StageException");
		} catch (StageException se) {
			assertTrue(se.isFatal());
		}
	}
}
