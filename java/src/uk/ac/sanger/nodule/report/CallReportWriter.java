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

package uk.ac.sanger.nodule.report;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes the final call report as CSV, one row per well which received a
 * call, ordered by plate and then by well.
 */

public class CallReportWriter {
	private final Logger logger;

	public CallReportWriter(Logger logger) {
		this.logger = logger;
	}

	/**
	 * @param filter
	 *            the rows to keep, or null to keep every row.
	 *
	 * @return the number of rows written.
	 */

	public int write(File file, List<CallReportRow> rows, Predicate<CallReportRow> filter) throws IOException {
		Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);

		try {
			return write(writer, rows, filter);
		} finally {
			writer.close();
		}
	}

	public int write(Appendable out, List<CallReportRow> rows, Predicate<CallReportRow> filter) throws IOException {
		List<CallReportRow> sorted = new ArrayList<CallReportRow>(rows);

		Collections.sort(sorted);

		CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(CallReportRow.COLUMNS).build());

		int written = 0;

		for (CallReportRow row : sorted) {
			if (filter != null && !filter.test(row))
				continue;

			printer.printRecord(row.getValues());
			written++;
		}

		printer.flush();

		logger.info("Wrote " + written + " of " + rows.size() + " calls to the report"
				+ (filter == null ? "" : " after filtering with " + filter));

		return written;
	}
}
