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

import uk.ac.sanger.nodule.NoduleException;

/**
 * An external program could not be started, or finished with a non-zero exit
 * status. Such failures may be transient, so they are marked retryable unless
 * a subclass says otherwise; nothing in the pipeline retries them
 * automatically.
 */

public class ExternalToolException extends NoduleException {
	public static final int NO_EXIT_STATUS = Integer.MIN_VALUE;

	private final String tool;
	private final int exitStatus;
	private final String stderr;

	public ExternalToolException(String tool, int exitStatus, String stderr, String message) {
		super(message);
		this.tool = tool;
		this.exitStatus = exitStatus;
		this.stderr = stderr;
	}

	public ExternalToolException(Throwable cause, String tool, String message) {
		super(cause, message);
		this.tool = tool;
		this.exitStatus = NO_EXIT_STATUS;
		this.stderr = null;
	}

	public String getTool() {
		return tool;
	}

	public int getExitStatus() {
		return exitStatus;
	}

	public boolean hasExitStatus() {
		return exitStatus != NO_EXIT_STATUS;
	}

	public String getStderr() {
		return stderr;
	}

	public boolean isRetryable() {
		return true;
	}
}
