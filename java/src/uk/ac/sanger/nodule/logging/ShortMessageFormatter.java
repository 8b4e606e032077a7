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

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.logging.LogRecord;

/**
 * One line per message for the console. Exceptions get their message and the
 * part of the stack trace which lies in the pipeline's own code.
 */

public class ShortMessageFormatter extends AbstractFormatter {
	private static final String PACKAGE_PREFIX = "uk.ac.sanger.nodule";

	private final SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy/MM/dd HH:mm:ss");

	public synchronized String format(LogRecord record) {
		StringBuffer sb = new StringBuffer();

		sb.append(dateFormat.format(new Date(record.getMillis())));
		sb.append(" ");
		sb.append(record.getLevel());
		sb.append(" : ");
		sb.append(formatMessage(record));
		sb.append("\n");

		if (record.getThrown() != null)
			formatForException(sb, record);

		return sb.toString();
	}

	private void formatForException(StringBuffer sb, LogRecord record) {
		Throwable throwable = getUnderlyingException(record.getThrown());

		sb.append(throwable.getClass().getName() + ": "
				+ throwable.getMessage() + "\n");

		StackTraceElement[] ste = throwable.getStackTrace();

		boolean showAll = ste.length <= 10;

		for (int i = 0; i < ste.length; i++)
			if (showAll || ste[i].getClassName().startsWith(PACKAGE_PREFIX))
				sb.append("  [" + i + "]: " + ste[i] + "\n");

		Throwable cause = throwable.getCause();

		if (cause != null) {
			sb.append("CAUSE: " + cause.getClass().getName() + " : " + cause.getMessage() + "\n");

			ste = cause.getStackTrace();

			for (int i = 0; i < ste.length; i++)
				if (ste[i].getClassName().startsWith(PACKAGE_PREFIX))
					sb.append("  [" + i + "]: " + ste[i] + "\n");
		}
	}
}
