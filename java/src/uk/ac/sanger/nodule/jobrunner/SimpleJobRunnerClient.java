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

import java.io.File;
import java.io.IOException;
import java.util.List;

public class SimpleJobRunnerClient implements JobRunnerClient {
	private final StringBuffer stdout = new StringBuffer();
	private final StringBuffer stderr = new StringBuffer();
	private String status = "";
	private int returnCode = -1;

	public String getStdout() {
		return stdout.toString();
	}

	public String getStderr() {
		return stderr.toString();
	}

	public synchronized String getStatus() {
		return status;
	}

	public synchronized int getReturnCode() {
		return returnCode;
	}

	public void appendToStdout(String text) {
		stdout.append(text);
	}

	public void appendToStderr(String text) {
		stderr.append(text);
	}

	public synchronized void setStatus(String text) {
		status = text;
	}

	public synchronized void done(int returnCode) {
		this.returnCode = returnCode;
	}

	/**
	 * Short way to run a command and get its standard output. A non-zero exit
	 * status is reported as an exception which carries the standard error.
	 */

	public static String executeCommand(ProcessRunner runner, String tool, List<String> command, File workingDirectory)
			throws ExternalToolException {
		SimpleJobRunnerClient client = new SimpleJobRunnerClient();

		int rc;

		try {
			rc = runner.run(command, workingDirectory, client);
		} catch (IOException ioe) {
			throw new ExternalToolException(ioe, tool, "Failed to start " + tool + " with command " + command);
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new ExternalToolException(ie, tool, "Interrupted whilst running " + tool + " with command " + command);
		}

		if (rc != 0)
			throw new ExternalToolException(tool, rc, client.getStderr(),
					tool + " returned " + rc + " for command " + command);

		return client.getStdout();
	}
}
