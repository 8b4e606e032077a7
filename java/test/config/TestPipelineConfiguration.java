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

package test.config;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.pipeline.ErrorPolicy;

public class TestPipelineConfiguration {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testDefaults() throws ConfigurationException {
		PipelineConfiguration config = PipelineConfiguration.loadDefaults();

		assertEquals(AssemblyEngine.MEGAHIT, config.getAssemblyEngine());
		assertEquals(ErrorPolicy.CONTINUE, config.getErrorPolicy());
		assertEquals("spades.py", config.getAssemblerExecutable(AssemblyEngine.SPADES));
		assertTrue(config.getAssemblerParameters(AssemblyEngine.SPADES).isEmpty());
		assertEquals(Arrays.asList("-3", "-q", "30", "-n", "5", "-A"), config.getList(PipelineConfiguration.FASTP_PARAMS));
		assertEquals(30, config.getGracePeriodSeconds());
		assertTrue(config.getThreads() > 0);
		assertNull(config.getProperty(PipelineConfiguration.REPORT_FILTER, null));
	}

	@Test
	public void testSettingsFileOverridesDefaults() throws Exception {
		File settings = folder.newFile("run.props");

		Files.write(settings.toPath(), ("assembler.engine = skesa\npipeline.threads=3\nblast.params=-db nt -evalue 1e-5\n")
				.getBytes(StandardCharsets.ISO_8859_1));

		PipelineConfiguration config = PipelineConfiguration.load(settings);

		assertEquals(AssemblyEngine.SKESA, config.getAssemblyEngine());
		assertEquals(3, config.getThreads());
		assertEquals(Arrays.asList("-db", "nt", "-evalue", "1e-5"), config.getList(PipelineConfiguration.BLAST_PARAMS));
		assertEquals("fastp", config.getProperty(PipelineConfiguration.FASTP_COMMAND));
	}

	@Test(expected = ConfigurationException.class)
	public void testMissingSettingsFile() throws ConfigurationException {
		PipelineConfiguration.load(new File(folder.getRoot(), "absent.props"));
	}

	@Test
	public void testMapRoundTripKeepsEveryProperty() throws ConfigurationException {
		PipelineConfiguration config = PipelineConfiguration.loadDefaults().withProperty(
				PipelineConfiguration.ERROR_POLICY, "halt");

		PipelineConfiguration copy = PipelineConfiguration.fromMap(config.toMap());

		assertEquals(config.toMap(), copy.toMap());
		assertEquals(ErrorPolicy.HALT, copy.getErrorPolicy());
	}

	@Test
	public void testInvalidValues() {
		Map<String, String> map = new HashMap<String, String>();
		map.put(PipelineConfiguration.ASSEMBLER_ENGINE, "velvet");
		map.put(PipelineConfiguration.ERROR_POLICY, "panic");
		map.put(PipelineConfiguration.THREADS, "many");

		PipelineConfiguration config = PipelineConfiguration.fromMap(map);

		try {
			config.getAssemblyEngine();
			fail("Expected a ConfigurationException for the assembler");
		} catch (ConfigurationException ce) {
			assertTrue(ce.getMessage().contains("velvet"));
		}

		try {
			config.getErrorPolicy();
			fail("Expected a ConfigurationException for the error policy");
		} catch (ConfigurationException ce) {
			assertTrue(ce.getMessage().contains("panic"));
		}

		try {
			config.getThreads();
			fail("Expected a ConfigurationException for the thread count");
		} catch (ConfigurationException ce) {
			assertTrue(ce.getCause() instanceof NumberFormatException);
		}
	}

	@Test(expected = ConfigurationException.class)
	public void testRequiredPropertyMissing() throws ConfigurationException {
		PipelineConfiguration.fromMap(null).getFile(PipelineConfiguration.BARCODE_FILE);
	}

	@Test
	public void testOverrideOnlyChangesNamedProperties() throws Exception {
		Map<String, String> map = new HashMap<String, String>();
		map.put(PipelineConfiguration.ASSEMBLER_ENGINE, "spades");
		map.put(PipelineConfiguration.DESTINATION, "/data/plates");
		map.put(PipelineConfiguration.ERROR_POLICY, "continue");

		PipelineConfiguration stored = PipelineConfiguration.fromMap(map);

		File settings = folder.newFile("override.props");

		Files.write(settings.toPath(), "pipeline.errorpolicy=halt\n".getBytes(StandardCharsets.ISO_8859_1));

		PipelineConfiguration config = PipelineConfiguration.loadOverride(stored, settings);

		assertEquals(ErrorPolicy.HALT, config.getErrorPolicy());
		assertEquals(AssemblyEngine.SPADES, config.getAssemblyEngine());
		assertEquals("/data/plates", config.getProperty(PipelineConfiguration.DESTINATION));
		assertEquals(3, config.toMap().size());

		assertEquals(ErrorPolicy.CONTINUE, stored.getErrorPolicy());
	}

	@Test(expected = ConfigurationException.class)
	public void testMissingOverrideFile() throws ConfigurationException {
		PipelineConfiguration.loadOverride(PipelineConfiguration.fromMap(null), new File(folder.getRoot(), "absent.props"));
	}
}
