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

package test.assembly;

import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.assembly.AssemblyException;
import uk.ac.sanger.nodule.assembly.ExternalAssembler;
import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.jobrunner.ProcessRunner;

/**
 * Drives the assembler with small shell scripts which stand in for the real
 * assembler programs.
 */

public class TestExternalAssembler {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Logger logger;
	private ProcessRunner runner;

	private final Well well = Well.parse("1A01");

	private File forward;
	private File reverse;

	@Before
	public void setUp() throws IOException {
		assumeTrue(new File("/bin/sh").canExecute());

		logger = Logger.getLogger("test.assembly");
		logger.setUseParentHandlers(false);

		runner = new ProcessRunner(logger, 1);

		forward = write(folder.newFile("rep1_R1.fastq"), "@r1\nACGT\n+\nIIII\n");
		reverse = write(folder.newFile("rep1_R2.fastq"), "@r1\nTTTT\n+\nIIII\n");
	}

	private static File write(File file, String text) throws IOException {
		Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private File script(String name, String body) throws IOException {
		File file = write(new File(folder.getRoot(), name), "#!/bin/sh\n" + body);
		file.setExecutable(true);
		return file;
	}

	@Test
	public void testContigsFromOutputDirectory() throws Exception {
		// Arguments are -1 forward -2 reverse -o directory.
		File megahit = script("megahit", "mkdir \"$6\"\nprintf '>k141_0 flag=1 multi=2.0\\nACGTAC\\nGT\\n' > \"$6/final.contigs.fa\"\n");

		File output = new File(folder.getRoot(), "megahit_out");
		output.mkdir();

		ExternalAssembler assembler = new ExternalAssembler(AssemblyEngine.MEGAHIT, megahit.getPath(), runner, logger);

		ContigSet contigs = assembler.assemble(well, ContigSet.POOLED, forward, reverse, output,
				new ArrayList<String>());

		assertEquals(1, contigs.size());
		assertEquals("k141_0", contigs.getContigs().get(0).getName());
		assertEquals("ACGTACGT", contigs.getContigs().get(0).getSequence());
		assertEquals(new File(output, "final.contigs.fa"), contigs.getFile());
	}

	@Test
	public void testContigsFromStandardOutput() throws Exception {
		File skesa = script("skesa", "printf '>Contig_1_12.5\\nGGGGCCCC\\n>Contig_2_3.1\\nAAAT\\n'\n");

		File output = new File(folder.getRoot(), "skesa_out");

		ExternalAssembler assembler = new ExternalAssembler(AssemblyEngine.SKESA, skesa.getPath(), runner, logger);

		ContigSet contigs = assembler.assemble(well, "rep1", forward, reverse, output, Arrays.asList("--cores", "1"));

		assertEquals(2, contigs.size());
		assertEquals("Contig_2_3.1", contigs.getContigs().get(1).getName());
		assertTrue(new File(output, "contigs.fasta").isFile());
	}

	@Test
	public void testFailingAssembler() throws IOException {
		File spades = script("spades.py", "echo 'not enough memory' >&2\nexit 3\n");

		ExternalAssembler assembler = new ExternalAssembler(AssemblyEngine.SPADES, spades.getPath(), runner, logger);

		try {
			assembler.assemble(well, "rep1", forward, reverse, new File(folder.getRoot(), "spades_out"),
					new ArrayList<String>());
			fail("Expected an AssemblyException");
		} catch (AssemblyException ae) {
			assertEquals(3, ae.getExitStatus());
			assertEquals("spades", ae.getTool());
			assertTrue(ae.getStderr().contains("not enough memory"));
		}
	}

	@Test
	public void testNoReadsMeansNoContigs() throws Exception {
		File empty = folder.newFile("empty_R1.fastq");

		ExternalAssembler assembler = new ExternalAssembler(AssemblyEngine.MEGAHIT, "/nonexistent/megahit", runner,
				logger);

		ContigSet contigs = assembler.assemble(well, "empty", empty, reverse, new File(folder.getRoot(), "out"),
				new ArrayList<String>());

		assertTrue(contigs.isEmpty());
	}

	@Test
	public void testEngineCommandLines() {
		File output = new File("out");
		List<String> params = Arrays.asList("--k-list", "21,29");

		assertEquals(Arrays.asList("megahit", "-1", "f.fq", "-2", "r.fq", "-o", "out", "--k-list", "21,29"),
				AssemblyEngine.MEGAHIT.buildCommand("megahit", new File("f.fq"), new File("r.fq"), output, params));

		assertEquals(Arrays.asList("skesa", "--reads", "f.fq,r.fq"),
				AssemblyEngine.SKESA.buildCommand("skesa", new File("f.fq"), new File("r.fq"), output,
						new ArrayList<String>()));

		assertEquals(AssemblyEngine.SPADES, AssemblyEngine.forName(" SPAdes "));
		assertNull(AssemblyEngine.forName("velvet"));
		assertEquals(new File(output, "contigs.fasta"), AssemblyEngine.SPADES.getContigsFile(output));
	}
}
