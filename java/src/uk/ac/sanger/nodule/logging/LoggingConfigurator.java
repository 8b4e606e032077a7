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

package uk.ac.sanger.nodule.logging;

import java.io.File;
import java.io.IOException;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;

/**
 * Builds the pipeline's logger from the run configuration: a console handler
 * with short messages and, if a log directory is configured, a file handler
 * with long messages.
 */

public class LoggingConfigurator {
	public static final String LOGGER_NAME = "uk.ac.sanger.nodule";

	private final PipelineConfiguration config;

	public LoggingConfigurator(PipelineConfiguration config) {
		this.config = config;
	}

	public Logger configure() throws ConfigurationException {
		Logger logger = Logger.getLogger(LOGGER_NAME);

		logger.setUseParentHandlers(false);

		for (Handler handler : logger.getHandlers()) {
			logger.removeHandler(handler);
			handler.close();
		}

		Level consoleLevel = parseLevel(PipelineConfiguration.LOGGING_CONSOLE_LEVEL, Level.INFO);
		Level fileLevel = parseLevel(PipelineConfiguration.LOGGING_FILE_LEVEL, Level.FINE);

		Handler consoleHandler = new ConsoleHandler();
		consoleHandler.setFormatter(new ShortMessageFormatter());
		consoleHandler.setLevel(consoleLevel);
		logger.addHandler(consoleHandler);

		Level loggerLevel = consoleLevel;

		String directory = config.getProperty(PipelineConfiguration.LOGGING_DIRECTORY);

		if (directory != null && !directory.isEmpty()) {
			File logDirectory = new File(directory);

			if (!logDirectory.isDirectory() && !logDirectory.mkdirs())
				throw new ConfigurationException("Cannot create the log directory " + logDirectory.getPath());

			File logFile = new File(logDirectory,
					config.getProperty(PipelineConfiguration.LOGGING_FILENAME, "nodule.log"));

			try {
				Handler fileHandler = new FileHandler(logFile.getPath(), true);
				fileHandler.setFormatter(new LongMessageFormatter());
				fileHandler.setLevel(fileLevel);
				logger.addHandler(fileHandler);
			} catch (IOException ioe) {
				throw new ConfigurationException(ioe, "Cannot open the log file " + logFile.getPath());
			}

			if (fileLevel.intValue() < loggerLevel.intValue())
				loggerLevel = fileLevel;
		}

		logger.setLevel(loggerLevel);

		return logger;
	}

	private Level parseLevel(String key, Level defaultLevel) throws ConfigurationException {
		String value = config.getProperty(key);

		if (value == null || value.isEmpty())
			return defaultLevel;

		value = value.toUpperCase();

		// Accept the level names which most other logging systems use.
		if (value.equals("DEBUG"))
			return Level.FINE;
		else if (value.equals("WARN"))
			return Level.WARNING;
		else if (value.equals("ERROR"))
			return Level.SEVERE;

		try {
			return Level.parse(value);
		} catch (IllegalArgumentException iae) {
			throw new ConfigurationException(iae, "The configuration property " + key + " is not a logging level: \""
					+ value + "\"");
		}
	}
}
