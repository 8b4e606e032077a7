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

package uk.ac.sanger.nodule.apps;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.NoduleException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableLoader;
import uk.ac.sanger.nodule.demultiplex.ReadPairFileReader;
import uk.ac.sanger.nodule.logging.LoggingConfigurator;
import uk.ac.sanger.nodule.pipeline.CheckpointStore;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineEngine;
import uk.ac.sanger.nodule.pipeline.PipelineState;
import uk.ac.sanger.nodule.pipeline.RunOutcome;
import uk.ac.sanger.nodule.stages.StageFactory;

public class NodulePipeline {
	public static final int EXIT_OK = 0;
	public static final int EXIT_BAD_ARGUMENTS = 1;
	public static final int EXIT_FATAL = 2;
	public static final int EXIT_HALTED = 3;
	public static final int EXIT_CANCELLED = 4;

	public static void main(String[] args) {
		List<File> forwardFiles = new ArrayList<File>();
		List<File> reverseFiles = new ArrayList<File>();
		String assembler = null;
		File settings = null;
		File destination = null;
		File checkpoint = null;

		for (int i = 0; i < args.length; i++) {
			if (args[i].equalsIgnoreCase("-help") || args[i].equalsIgnoreCase("-h")) {
				showUsage(System.out);
				System.exit(EXIT_OK);
			}

			if (i + 1 >= args.length) {
				System.err.println("Missing value for parameter " + args[i]);
				showUsage(System.err);
				System.exit(EXIT_BAD_ARGUMENTS);
			}

			if (args[i].equalsIgnoreCase("-r1"))
				forwardFiles.add(new File(args[++i]));
			else if (args[i].equalsIgnoreCase("-r2"))
				reverseFiles.add(new File(args[++i]));
			else if (args[i].equalsIgnoreCase("-assembler"))
				assembler = args[++i];
			else if (args[i].equalsIgnoreCase("-settings"))
				settings = new File(args[++i]);
			else if (args[i].equalsIgnoreCase("-out"))
				destination = new File(args[++i]);
			else if (args[i].equalsIgnoreCase("-resume"))
				checkpoint = new File(args[++i]);
			else {
				System.err.println("Invalid parameter " + args[i]);
				showUsage(System.err);
				System.exit(EXIT_BAD_ARGUMENTS);
			}
		}

		String problem = checkArguments(forwardFiles, reverseFiles, assembler, destination, checkpoint);

		if (problem != null) {
			System.err.println(problem);
			showUsage(System.err);
			System.exit(EXIT_BAD_ARGUMENTS);
		}

		int rc = checkpoint == null ? coldStart(forwardFiles, reverseFiles, assembler, settings, destination)
				: resume(checkpoint, settings);

		System.exit(rc);
	}

	/**
	 * Returns a description of what is wrong with the arguments, or null if
	 * they are acceptable.
	 */

	public static String checkArguments(List<File> forwardFiles, List<File> reverseFiles, String assembler,
			File destination, File checkpoint) {
		if (checkpoint != null) {
			if (!forwardFiles.isEmpty() || !reverseFiles.isEmpty() || assembler != null || destination != null)
				return "-resume cannot be combined with -r1, -r2, -assembler or -out";

			return null;
		}

		if (forwardFiles.isEmpty())
			return "At least one pair of read files must be given with -r1 and -r2";

		if (forwardFiles.size() != reverseFiles.size())
			return "Every -r1 file needs a matching -r2 file";

		if (assembler != null && AssemblyEngine.forName(assembler) == null)
			return "Unknown assembler \"" + assembler + "\": expected megahit, skesa or spades";

		return null;
	}

	private static int coldStart(List<File> forwardFiles, List<File> reverseFiles, String assembler, File settings,
			File destination) {
		PipelineConfiguration config;
		Logger logger;

		try {
			config = PipelineConfiguration.load(settings);

			if (assembler != null)
				config = config.withProperty(PipelineConfiguration.ASSEMBLER_ENGINE, assembler);

			if (destination != null)
				config = config.withProperty(PipelineConfiguration.DESTINATION, destination.getPath());

			logger = new LoggingConfigurator(config).configure();
		} catch (ConfigurationException ce) {
			System.err.println("Failed to load the configuration: " + ce.getMessage());
			return EXIT_FATAL;
		}

		PipelineState state;
		BarcodeTable table;

		try {
			table = new BarcodeTableLoader(logger).load(config.getFile(PipelineConfiguration.BARCODE_FILE));

			ReadPairFileReader reader = new ReadPairFileReader();

			for (int i = 0; i < forwardFiles.size(); i++) {
				long pairs = reader.verifyPairedCounts(forwardFiles.get(i), reverseFiles.get(i));
				logger.info(forwardFiles.get(i).getName() + " and " + reverseFiles.get(i).getName() + " hold "
						+ pairs + " read pairs");
			}

			File workDirectory = createWorkDirectory(config);

			List<PathLayout.Replicate> replicates = PathLayout.createReplicates(forwardFiles, reverseFiles);

			state = PipelineState.coldStart(workDirectory.getName(), config, new PathLayout(workDirectory, replicates));
		} catch (NoduleException ne) {
			logger.log(Level.SEVERE, "Cannot start the run: " + ne.getMessage(), ne);
			return EXIT_FATAL;
		} catch (IOException ioe) {
			logger.log(Level.SEVERE, "Cannot start the run: " + ioe.getMessage(), ioe);
			return EXIT_FATAL;
		}

		logger.info("Starting run " + state.getRunId() + " in " + state.getLayout().getWorkDirectory());

		PipelineEngine engine = createEngine(logger);
		engine.setBarcodeTable(table);

		return execute(engine, state, null, null, logger);
	}

	private static int resume(File checkpoint, File settings) {
		PipelineState state;
		PipelineConfiguration override = null;
		Logger logger;

		try {
			state = CheckpointStore.read(checkpoint);

			if (settings != null)
				override = PipelineConfiguration.loadOverride(state.getPipelineConfiguration(), settings);

			logger = new LoggingConfigurator(override != null ? override : state.getPipelineConfiguration()).configure();
		} catch (NoduleException ne) {
			System.err.println("Cannot resume from " + checkpoint.getPath() + ": " + ne.getMessage());
			return EXIT_FATAL;
		}

		return execute(createEngine(logger), null, checkpoint, override, logger);
	}

	private static PipelineEngine createEngine(Logger logger) {
		PipelineEngine engine = new PipelineEngine(StageFactory.createStages(), logger);

		engine.setListener(new ConsoleProgressListener(System.out, engine.getStages().size()));

		return engine;
	}

	private static int execute(final PipelineEngine engine, PipelineState state, File checkpoint,
			PipelineConfiguration override, Logger logger) {
		final CountDownLatch finished = new CountDownLatch(1);

		Thread hook = new Thread(new Runnable() {
			public void run() {
				engine.cancel();

				try {
					finished.await(60, TimeUnit.SECONDS);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
				}
			}
		}, "nodule-shutdown");

		Runtime.getRuntime().addShutdownHook(hook);

		RunOutcome outcome;

		try {
			outcome = checkpoint == null ? engine.run(state) : engine.resume(checkpoint, override);
		} catch (NoduleException ne) {
			logger.log(Level.SEVERE, "The run could not continue: " + ne.getMessage(), ne);
			finished.countDown();
			return EXIT_FATAL;
		}

		finished.countDown();

		logger.info(outcome.toString());

		switch (outcome.getStatus()) {
			case COMPLETED:
				return EXIT_OK;

			case HALTED:
				return EXIT_HALTED;

			default:
				return EXIT_CANCELLED;
		}
	}

	private static File createWorkDirectory(PipelineConfiguration config) throws ConfigurationException {
		String format = config.getProperty(PipelineConfiguration.DATETIME_FORMAT, "yyyy_MMdd_HHmm");

		String timestamp;

		try {
			timestamp = new SimpleDateFormat(format).format(new Date());
		} catch (IllegalArgumentException iae) {
			throw new ConfigurationException(iae, "Invalid date-time format \"" + format + "\"");
		}

		File workDirectory = new File(config.getProperty(PipelineConfiguration.DESTINATION, "data"), timestamp);

		if (workDirectory.exists())
			throw new ConfigurationException("The work directory " + workDirectory.getPath()
					+ " already exists. Wait a minute or choose another destination with -out.");

		if (!workDirectory.mkdirs())
			throw new ConfigurationException("Cannot create the work directory " + workDirectory.getPath());

		return workDirectory;
	}

	public static void showUsage(PrintStream ps) {
		ps.println("Invalid or missing input parameters");
		ps.println();
		ps.println("TO START A RUN:");
		ps.println("\t-r1\t\tForward read file of a replicate (repeatable)");
		ps.println("\t-r2\t\tReverse read file of the same replicate (repeatable)");
		ps.println();
		ps.println("TO RESUME A RUN:");
		ps.println("\t-resume\t\tCheckpoint file to resume from");
		ps.println();
		ps.println("OPTIONAL PARAMETERS:");
		ps.println("\t-assembler\tmegahit, skesa or spades [default: megahit]");
		ps.println("\t-settings\tProperties file overriding the defaults, or the stored settings of a resumed run");
		ps.println("\t-out\t\tDirectory in which the run directory is created [default: data]");
		ps.println();
		ps.println("EXIT STATUS:");
		ps.println("\t0 completed, 1 invalid parameters, 2 fatal error, 3 halted on a failed stage, 4 cancelled");
	}
}
