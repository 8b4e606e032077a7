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

package uk.ac.sanger.nodule.homology;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import uk.ac.sanger.nodule.data.HomologyHit;

/**
 * Parses the comma-separated output of blastn run with
 * <code>-outfmt 10</code>, whose columns are
 *
 * <pre>
 * qaccver saccver pident length mismatch gapopen qstart qend sstart send evalue bitscore
 * </pre>
 */

public class BlastOutputParser {
	public static final String[] COLUMNS = { "qaccver", "saccver", "pident", "length", "mismatch", "gapopen",
			"qstart", "qend", "sstart", "send", "evalue", "bitscore" };

	private static final String TOOL = "blastn";

	public List<HomologyHit> parse(String text) throws HomologySearchException {
		try {
			return parse(new StringReader(text));
		} catch (IOException ioe) {
			throw new HomologySearchException(ioe, TOOL, "Failed to read the blastn output");
		}
	}

	public List<HomologyHit> parse(Reader reader) throws IOException, HomologySearchException {
		List<HomologyHit> hits = new ArrayList<HomologyHit>();

		CSVParser parser = CSVFormat.DEFAULT.parse(reader);

		try {
			for (CSVRecord record : parser) {
				if (record.size() == 1 && record.get(0).trim().isEmpty())
					continue;

				hits.add(parseRecord(record));
			}
		} finally {
			parser.close();
		}

		return hits;
	}

	private HomologyHit parseRecord(CSVRecord record) throws HomologySearchException {
		if (record.size() != COLUMNS.length)
			throw new HomologySearchException(TOOL, "Line " + record.getRecordNumber() + " of the blastn output has "
					+ record.size() + " columns, expected " + COLUMNS.length);

		try {
			return new HomologyHit(record.get(0).trim(), record.get(1).trim(),
					Double.parseDouble(record.get(2).trim()),
					Integer.parseInt(record.get(3).trim()),
					Integer.parseInt(record.get(4).trim()),
					Integer.parseInt(record.get(5).trim()),
					Integer.parseInt(record.get(6).trim()),
					Integer.parseInt(record.get(7).trim()),
					Integer.parseInt(record.get(8).trim()),
					Integer.parseInt(record.get(9).trim()),
					Double.parseDouble(record.get(10).trim()),
					Double.parseDouble(record.get(11).trim()));
		} catch (NumberFormatException nfe) {
			throw new HomologySearchException(nfe, TOOL, "Line " + record.getRecordNumber()
					+ " of the blastn output has a malformed number: " + record);
		}
	}
}
