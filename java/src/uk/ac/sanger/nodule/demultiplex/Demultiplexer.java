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

package uk.ac.sanger.nodule.demultiplex;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.data.ReadPair;
import uk.ac.sanger.nodule.data.Well;

/**
 * Assigns read pairs to wells by the barcode suffixes which tag trimming left
 * at the end of each read header. Matching is exact: a read pair belongs to
 * the well whose barcode table entry contains its (forward, reverse) suffix
 * pair, and is discarded if there is no such well.
 */

public class Demultiplexer {
	private final BarcodeTable table;
	private final Logger logger;

	private final ReadPairFileReader reader = new ReadPairFileReader();

	public Demultiplexer(BarcodeTable table, Logger logger) {
		this.table = table;
		this.logger = logger;
	}

	public DemultiplexResult demultiplex(List<ReadPair> pairs) {
		DemultiplexResult result = new DemultiplexResult(table.getWells());

		for (ReadPair pair : pairs) {
			Well well = table.lookup(pair.getBarcodePair());

			if (well == null)
				result.discard();
			else
				result.assign(well, pair);
		}

		if (logger.isLoggable(Level.FINE))
			logger.fine("Demultiplexed " + result.getTotalCount() + " read pairs: " + result.getAssignedCount()
					+ " assigned, " + result.getDiscardedCount() + " discarded");

		return result;
	}

	public DemultiplexResult demultiplex(File forward, File reverse) throws IOException, ReadPairCountMismatchException {
		List<ReadPair> pairs = reader.read(forward, reverse);

		logger.info("Read " + pairs.size() + " read pairs from " + forward.getName() + " and " + reverse.getName());

		return demultiplex(pairs);
	}

	public BarcodeTable getBarcodeTable() {
		return table;
	}
}
