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

package uk.ac.sanger.nodule;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.pipeline.ErrorPolicy;

/**
 * The run configuration. Properties are layered: the defaults shipped in the
 * JAR file, then the user's private <code>~/.nodule/nodule.props</code> if it
 * exists, then the settings file named on the command line.
 */

public class PipelineConfiguration {
	public static final String DEFAULTS_RESOURCE = "/resources/nodule.props";

	public static final String DESTINATION = "nodule.destination";
	public static final String DATETIME_FORMAT = "nodule.datetime.format";

	public static final String BARCODE_FILE = "barcode.file";

	public static final String TAG_FORWARD = "tag.forward";
	public static final String TAG_REVERSE = "tag.reverse";
	public static final String PRIMER_FORWARD = "primer.forward";
	public static final String PRIMER_REVERSE = "primer.reverse";

	public static final String CUTADAPT_COMMAND = "cutadapt.command";
	public static final String FASTP_COMMAND = "fastp.command";
	public static final String FASTP_PARAMS = "fastp.params";

	public static final String ASSEMBLER_ENGINE = "assembler.engine";

	public static final String BLAST_COMMAND = "blast.command";
	public static final String BLAST_PARAMS = "blast.params";
	public static final String HOMOLOGY_MODE = "homology.mode";

	public static final String ERROR_POLICY = "pipeline.errorpolicy";
	public static final String THREADS = "pipeline.threads";
	public static final String GRACE_PERIOD = "process.graceperiod.seconds";

	public static final String CHECKPOINT_PREFIX = "checkpoint.prefix";

	public static final String REPORT_FILENAME = "report.filename";
	public static final String REPORT_FILTER = "report.filter";

	public static final String LOGGING_DIRECTORY = "logging.directory";
	public static final String LOGGING_FILENAME = "logging.filename";
	public static final String LOGGING_CONSOLE_LEVEL = "logging.console.level";
	public static final String LOGGING_FILE_LEVEL = "logging.file.level";

	protected Properties props;

	public PipelineConfiguration(Properties props) {
		this.props = props;
	}

	public static PipelineConfiguration loadDefaults() throws ConfigurationException {
		Properties props = new Properties();

		InputStream is = PipelineConfiguration.class.getResourceAsStream(DEFAULTS_RESOURCE);

		if (is == null)
			throw new ConfigurationException("Unable to find the default properties resource " + DEFAULTS_RESOURCE);

		try {
			props.load(is);
			is.close();
		} catch (IOException ioe) {
			throw new ConfigurationException(ioe, "Failed to read the default properties resource " + DEFAULTS_RESOURCE);
		}

		return new PipelineConfiguration(props);
	}

	/**
	 * Loads the layered configuration.
	 *
	 * @param settings
	 *            the settings file given by the user, or null if there is none.
	 *            A settings file which is named but cannot be read is an error.
	 */

	public static PipelineConfiguration load(File settings) throws ConfigurationException {
		PipelineConfiguration config = loadDefaults();

		File userhome = new File(System.getProperty("user.home"));
		File privateprops = new File(new File(userhome, ".nodule"), "nodule.props");

		if (privateprops.isFile() && privateprops.canRead())
			config.overlay(privateprops);

		if (settings != null)
			config.overlaySettings(settings);

		return config;
	}

	/**
	 * Loads the settings which override the configuration of a resumed run.
	 * Only the properties named in the settings file are changed; everything
	 * else keeps the value stored with the run.
	 */

	public static PipelineConfiguration loadOverride(PipelineConfiguration stored, File settings)
			throws ConfigurationException {
		Properties copy = new Properties();
		copy.putAll(stored.props);

		PipelineConfiguration config = new PipelineConfiguration(copy);

		config.overlaySettings(settings);

		return config;
	}

	private void overlaySettings(File settings) throws ConfigurationException {
		if (!settings.isFile() || !settings.canRead())
			throw new ConfigurationException("Cannot read the settings file " + settings.getPath());

		overlay(settings);
	}

	public static PipelineConfiguration fromMap(Map<String, String> map) {
		Properties props = new Properties();

		if (map != null)
			props.putAll(map);

		return new PipelineConfiguration(props);
	}

	protected void overlay(File file) throws ConfigurationException {
		try {
			FileInputStream fis = new FileInputStream(file);
			props.load(fis);
			fis.close();
		} catch (IOException ioe) {
			throw new ConfigurationException(ioe, "Failed to read the properties file " + file.getPath());
		}
	}

	public Map<String, String> toMap() {
		Map<String, String> map = new TreeMap<String, String>();

		for (String key : props.stringPropertyNames())
			map.put(key, props.getProperty(key));

		return map;
	}

	public PipelineConfiguration withProperty(String key, String value) {
		Properties copy = new Properties();
		copy.putAll(props);
		copy.setProperty(key, value);
		return new PipelineConfiguration(copy);
	}

	public String getProperty(String key) {
		String value = props.getProperty(key);

		return value == null ? null : value.trim();
	}

	public String getProperty(String key, String defaultValue) {
		String value = getProperty(key);

		return value == null || value.isEmpty() ? defaultValue : value;
	}

	public String getRequiredProperty(String key) throws ConfigurationException {
		String value = getProperty(key);

		if (value == null || value.isEmpty())
			throw new ConfigurationException("The configuration property " + key + " is not defined");

		return value;
	}

	public int getInt(String key, int defaultValue) throws ConfigurationException {
		String value = getProperty(key);

		if (value == null || value.isEmpty())
			return defaultValue;

		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException nfe) {
			throw new ConfigurationException(nfe, "The configuration property " + key + " is not an integer: \"" + value + "\"");
		}
	}

	/**
	 * Returns a whitespace-separated property as a list of words, for
	 * parameters which are passed on to an external program.
	 */

	public List<String> getList(String key) {
		String value = getProperty(key);

		if (value == null || value.isEmpty())
			return Collections.emptyList();

		return new ArrayList<String>(Arrays.asList(value.split("\\s+")));
	}

	public File getFile(String key) throws ConfigurationException {
		return new File(getRequiredProperty(key));
	}

	public AssemblyEngine getAssemblyEngine() throws ConfigurationException {
		String name = getProperty(ASSEMBLER_ENGINE, "megahit");

		AssemblyEngine engine = AssemblyEngine.forName(name);

		if (engine == null)
			throw new ConfigurationException("Unknown assembler \"" + name + "\": expected one of megahit, skesa, spades");

		return engine;
	}

	public String getAssemblerExecutable(AssemblyEngine engine) {
		return getProperty("assembler." + engine.getName() + ".executable", engine.getDefaultExecutable());
	}

	public List<String> getAssemblerParameters(AssemblyEngine engine) {
		return getList("assembler." + engine.getName() + ".params");
	}

	public ErrorPolicy getErrorPolicy() throws ConfigurationException {
		String name = getProperty(ERROR_POLICY, "continue");

		ErrorPolicy policy = ErrorPolicy.forName(name);

		if (policy == null)
			throw new ConfigurationException("Unknown error policy \"" + name + "\": expected halt or continue");

		return policy;
	}

	public int getThreads() throws ConfigurationException {
		int threads = getInt(THREADS, 0);

		return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
	}

	public int getGracePeriodSeconds() throws ConfigurationException {
		return getInt(GRACE_PERIOD, 30);
	}

	public String toString() {
		return "PipelineConfiguration" + toMap();
	}
}
