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

package uk.ac.sanger.nodule.jobrunner;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs external programs on the local host and feeds their output to a
 * {@link JobRunnerClient}. Several programs may run at once, one per worker
 * thread. After {@link #cancel()}, no new program is started and the running
 * ones are asked to terminate, then killed if they are still alive at the end
 * of the grace period.
 */

public class ProcessRunner {
	private final Logger logger;
	private final long gracePeriodSeconds;

	private final Set<Process> running = new HashSet<Process>();

	private volatile boolean cancelled = false;

	public ProcessRunner(Logger logger, long gracePeriodSeconds) {
		this.logger = logger;
		this.gracePeriodSeconds = gracePeriodSeconds;
	}

	/**
	 * Runs a command and waits for it to finish.
	 *
	 * @return the exit status of the command.
	 *
	 * @throws CancellationException
	 *             if the runner has been cancelled before the command started.
	 */

	public int run(List<String> command, File workingDirectory, JobRunnerClient client)
			throws IOException, InterruptedException {
		if (cancelled)
			throw new CancellationException("The process runner has been cancelled: not starting " + command);

		if (logger.isLoggable(Level.FINE))
			logger.fine("Executing " + command + (workingDirectory == null ? "" : " in " + workingDirectory));

		ProcessBuilder pb = new ProcessBuilder(command);

		if (workingDirectory != null)
			pb.directory(workingDirectory);

		Process process;

		synchronized (running) {
			if (cancelled)
				throw new CancellationException("The process runner has been cancelled: not starting " + command);

			process = pb.start();
			running.add(process);
		}

		try {
			process.getOutputStream().close();

			Thread stdoutPump = startPump(process.getInputStream(), JobOutput.STDOUT, client);
			Thread stderrPump = startPump(process.getErrorStream(), JobOutput.STDERR, client);

			int rc = process.waitFor();

			joinPump(stdoutPump);
			joinPump(stderrPump);

			client.done(rc);

			if (logger.isLoggable(Level.FINE))
				logger.fine(command.get(0) + " returned " + rc);

			return rc;
		} finally {
			synchronized (running) {
				running.remove(process);
			}
		}
	}

	// A terminated program may leave children which hold its output open.
	private void joinPump(Thread pump) throws InterruptedException {
		if (cancelled)
			pump.join(TimeUnit.SECONDS.toMillis(gracePeriodSeconds) + 1000L);
		else
			pump.join();
	}

	private Thread startPump(final InputStream is, final int type, final JobRunnerClient client) {
		Thread thread = new Thread(new Runnable() {
			public void run() {
				BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));

				try {
					String line;

					while ((line = br.readLine()) != null)
						new JobOutput(type, line + "\n").deliverTo(client);
				} catch (IOException ioe) {
					logger.log(Level.WARNING, "Error whilst reading the output of an external process", ioe);
				} finally {
					try {
						br.close();
					} catch (IOException ioe) {
						logger.log(Level.FINE, "Error whilst closing the output of an external process", ioe);
					}
				}
			}
		});

		thread.setDaemon(true);
		thread.start();

		return thread;
	}

	public void cancel() {
		cancelled = true;

		List<Process> snapshot;

		synchronized (running) {
			snapshot = new ArrayList<Process>(running);
		}

		if (snapshot.isEmpty())
			return;

		logger.warning("Terminating " + snapshot.size() + " external process(es), grace period " + gracePeriodSeconds + "s");

		for (Process process : snapshot)
			process.destroy();

		for (Process process : snapshot) {
			try {
				if (!process.waitFor(gracePeriodSeconds, TimeUnit.SECONDS)) {
					logger.warning("External process did not terminate within the grace period: killing it");
					process.destroyForcibly();
				}
			} catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
				process.destroyForcibly();
			}
		}
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public int getRunningCount() {
		synchronized (running) {
			return running.size();
		}
	}
}
