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

import java.util.logging.Formatter;

import uk.ac.sanger.nodule.jobrunner.ExternalToolException;
import uk.ac.sanger.nodule.pipeline.StageException;

public abstract class AbstractFormatter extends Formatter {
	protected void displayThrowable(Throwable thrown, StringBuffer sb) {
		StackTraceElement ste[] = thrown.getStackTrace();

		sb.append("\n" + thrown.getClass().getName());

		String message = thrown.getMessage();

		if (message != null)
			sb.append(": " + message);

		sb.append("\n");

		if (thrown instanceof ExternalToolException) {
			ExternalToolException ete = (ExternalToolException) thrown;

			sb.append("\nTool : " + ete.getTool() + "\n");

			if (ete.hasExitStatus())
				sb.append("Exit status : " + ete.getExitStatus() + "\n");

			String stderr = ete.getStderr();

			if (stderr != null && !stderr.isEmpty())
				sb.append("Standard error :\n" + stderr + "\n");
		}

		sb.append("\nSTACK TRACE:\n\n");

		for (int i = 0; i < ste.length; i++)
			sb.append(i + ": " + ste[i].getClassName() + " " +
					ste[i].getMethodName() + " line " + ste[i].getLineNumber() + "\n");
	}

	/**
	 * A stage failure is only a wrapper: the interesting exception is the one
	 * which made the stage fail.
	 */

	protected Throwable getUnderlyingException(Throwable thrown) {
		if (thrown == null)
			return null;

		return (thrown instanceof StageException && thrown.getCause() != null) ? thrown.getCause() : thrown;
	}
}
