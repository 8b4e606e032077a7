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

package uk.ac.sanger.nodule.pipeline;

import uk.ac.sanger.nodule.NoduleException;
import uk.ac.sanger.nodule.jobrunner.ExternalToolException;

/**
 * A stage could not complete. A fatal failure stops the run whatever the
 * error policy says, because the later stages could only produce wrong
 * results.
 */

public class StageException extends NoduleException {
	private final String stageName;
	private final boolean fatal;

	public StageException(String stageName, Throwable cause, String message, boolean fatal) {
		super(cause, message);
		this.stageName = stageName;
		this.fatal = fatal;
	}

	public StageException(String stageName, Throwable cause, String message) {
		this(stageName, cause, message, false);
	}

	public StageException(String stageName, String message) {
		this(stageName, null, message, false);
	}

	public String getStageName() {
		return stageName;
	}

	public boolean isFatal() {
		return fatal;
	}

	public boolean isRetryable() {
		Throwable cause = getCause();

		return !fatal && cause instanceof ExternalToolException && ((ExternalToolException) cause).isRetryable();
	}
}
