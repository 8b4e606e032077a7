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

package test.demultiplex;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import htsjdk.samtools.fastq.FastqRecord;

import org.junit.Before;
import org.junit.Test;

import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.data.BarcodePair;
import uk.ac.sanger.nodule.data.ReadPair;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.demultiplex.DemultiplexResult;
import uk.ac.sanger.nodule.demultiplex.Demultiplexer;

public class TestDemultiplexer {
	private Logger logger;

	@Before
	public void setUp() {
		logger = Logger.getLogger("test.demultiplex");
		logger.setUseParentHandlers(false);
	}

	private static ReadPair pair(String name, String forwardSuffix, String reverseSuffix) {
		FastqRecord forward = new FastqRecord(name + " 1:N:0 " + forwardSuffix, "ACGTACGT", "", "IIIIIIII");
		FastqRecord reverse = new FastqRecord(name + " 2:N:0 " + reverseSuffix, "TTGCAACG", "", "IIIIIIII");

		return new ReadPair(forward, reverse);
	}

	@Test
	public void testSingleWellExample() {
		BarcodeTable table = new BarcodeTable();
		table.addWell(Well.parse("1A01"), Arrays.asList(new BarcodePair("BC1", "BC2")));

		List<ReadPair> pairs = new ArrayList<ReadPair>();
		pairs.add(pair("read1", "BC1", "BC2"));
		pairs.add(pair("read2", "BC9", "BC9"));

		DemultiplexResult result = new Demultiplexer(table, logger).demultiplex(pairs);

		assertEquals(1, result.getCount(Well.parse("1A01")));
		assertEquals(1, result.getDiscardedCount());
		assertEquals(2, result.getTotalCount());
		assertEquals("read1 1:N:0 BC1", result.getReadPairs(Well.parse("1A01")).get(0).getForward().getReadName());
	}

	@Test
	public void testEveryPairIsAssignedOnceOrDiscarded() {
		BarcodeTable table = new BarcodeTable();
		table.addWell(Well.parse("1A01"), Arrays.asList(new BarcodePair("F1", "R1")));
		table.addWell(Well.parse("1A02"), Arrays.asList(new BarcodePair("F2", "R1"), new BarcodePair("F2", "R2")));
		table.addWell(Well.parse("1B01"), Arrays.asList(new BarcodePair("F3", "R3")));

		List<ReadPair> pairs = new ArrayList<ReadPair>();
		String[][] suffixes = { { "F1", "R1" }, { "F2", "R2" }, { "F2", "R1" }, { "F1", "R2" }, { "F3", "R3" },
				{ "R1", "F1" }, { "F2", "R2" } };

		for (int i = 0; i < suffixes.length; i++)
			pairs.add(pair("read" + i, suffixes[i][0], suffixes[i][1]));

		DemultiplexResult result = new Demultiplexer(table, logger).demultiplex(pairs);

		assertEquals(1, result.getCount(Well.parse("1A01")));
		assertEquals(3, result.getCount(Well.parse("1A02")));
		assertEquals(1, result.getCount(Well.parse("1B01")));
		assertEquals(2, result.getDiscardedCount());
		assertEquals(pairs.size(), result.getAssignedCount() + result.getDiscardedCount());

		for (Well well : result.getWells())
			for (ReadPair assigned : result.getReadPairs(well))
				assertTrue(table.accepts(well, assigned.getBarcodePair()));
	}

	@Test
	public void testOverlappingPairGoesToFirstWell() {
		BarcodeTable table = new BarcodeTable();
		table.addWell(Well.parse("1A05"), Arrays.asList(new BarcodePair("X", "Y")));
		table.addWell(Well.parse("1A01"), Arrays.asList(new BarcodePair("X", "Y")));

		DemultiplexResult result = new Demultiplexer(table, logger).demultiplex(Arrays.asList(pair("r", "X", "Y")));

		assertEquals(1, result.getCount(Well.parse("1A05")));
		assertEquals(0, result.getCount(Well.parse("1A01")));
		assertEquals(1, table.findOverlaps().size());
	}

	@Test
	public void testEmptyWellsAreStillReported() {
		BarcodeTable table = new BarcodeTable();
		table.addWell(Well.parse("1A01"), Arrays.asList(new BarcodePair("F1", "R1")));
		table.addWell(Well.parse("1A02"), Arrays.asList(new BarcodePair("F2", "R2")));

		DemultiplexResult result = new Demultiplexer(table, logger).demultiplex(Arrays.asList(pair("r", "F1", "R1")));

		assertEquals(2, result.getWells().size());
		assertEquals(Arrays.asList(Well.parse("1A02")), result.getEmptyWells());
	}

	@Test
	public void testTrailingTokenOfHeader() {
		assertEquals("BC7", ReadPair.getTrailingToken("M00123:1:000:1:1101:15589:1331 1:N:0:1 BC7"));
		assertEquals("BC7", ReadPair.getTrailingToken("read\tBC7  "));
		assertEquals("lonely", ReadPair.getTrailingToken("lonely"));
	}
}
