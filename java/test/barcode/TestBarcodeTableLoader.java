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

package test.barcode;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableException;
import uk.ac.sanger.nodule.barcode.BarcodeTableLoader;
import uk.ac.sanger.nodule.data.BarcodePair;
import uk.ac.sanger.nodule.data.Well;

public class TestBarcodeTableLoader {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private BarcodeTableLoader loader;

	@Before
	public void setUp() {
		Logger logger = Logger.getLogger("test.barcode");
		logger.setUseParentHandlers(false);

		loader = new BarcodeTableLoader(logger);
	}

	private InputStream json(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	public void testLoadKeepsDescriptorOrder() throws BarcodeTableException {
		BarcodeTable table = loader.load(json("{ \"1A02\": [[\"F02\", \"R01\"], [\"F02\", \"R13\"]],"
				+ " \"1A01\": [[\"F01\", \"R01\"]] }"), "inline");

		assertEquals(2, table.size());

		List<Well> wells = table.getWells();

		assertEquals("1A02", wells.get(0).getCode());
		assertEquals("1A01", wells.get(1).getCode());

		assertEquals(2, table.getBarcodePairs(Well.parse("1A02")).size());
		assertEquals(Well.parse("1A02"), table.lookup(new BarcodePair("F02", "R13")));
		assertNull(table.lookup(new BarcodePair("R01", "F01")));
	}

	@Test
	public void testLoadFromFile() throws BarcodeTableException, IOException {
		File file = folder.newFile("cells.json");

		FileOutputStream fos = new FileOutputStream(file);
		fos.write("{ \"2H12\": [[\"BC1\", \"BC2\"]] }".getBytes(StandardCharsets.UTF_8));
		fos.close();

		BarcodeTable table = loader.load(file);

		assertEquals(1, table.size());
		assertEquals(2, table.getPlates().first().intValue());
	}

	@Test(expected = BarcodeTableException.class)
	public void testMissingFile() throws BarcodeTableException {
		loader.load(new File(folder.getRoot(), "no-such-file.json"));
	}

	@Test(expected = BarcodeTableException.class)
	public void testMalformedJson() throws BarcodeTableException {
		loader.load(json("{ \"1A01\": [[\"BC1\", \"BC2\"] "), "inline");
	}

	@Test(expected = BarcodeTableException.class)
	public void testNotAnObject() throws BarcodeTableException {
		loader.load(json("[[\"BC1\", \"BC2\"]]"), "inline");
	}

	@Test(expected = BarcodeTableException.class)
	public void testInvalidWellCode() throws BarcodeTableException {
		loader.load(json("{ \"1Z01\": [[\"BC1\", \"BC2\"]] }"), "inline");
	}

	@Test(expected = BarcodeTableException.class)
	public void testDuplicateWellCode() throws BarcodeTableException {
		loader.load(json("{ \"1A01\": [[\"BC1\", \"BC2\"]], \"1A01\": [[\"BC3\", \"BC4\"]] }"), "inline");
	}

	@Test(expected = BarcodeTableException.class)
	public void testPairWithThreeElements() throws BarcodeTableException {
		loader.load(json("{ \"1A01\": [[\"BC1\", \"BC2\", \"BC3\"]] }"), "inline");
	}

	@Test(expected = BarcodeTableException.class)
	public void testEmptyDescriptor() throws BarcodeTableException {
		loader.load(json("{}"), "inline");
	}

	@Test
	public void testOverlapIsReportedAndFirstWellWins() throws BarcodeTableException {
		BarcodeTable table = loader.load(json("{ \"1A01\": [[\"BC1\", \"BC2\"]], \"1A02\": [[\"BC1\", \"BC2\"]],"
				+ " \"1A03\": [[\"BC3\", \"BC4\"]] }"), "inline");

		Map<BarcodePair, List<Well>> overlaps = table.findOverlaps();

		assertEquals(1, overlaps.size());

		List<Well> owners = overlaps.get(new BarcodePair("BC1", "BC2"));

		assertEquals(2, owners.size());
		assertEquals(Well.parse("1A01"), owners.get(0));
		assertEquals(Well.parse("1A02"), owners.get(1));

		assertEquals(Well.parse("1A01"), table.lookup(new BarcodePair("BC1", "BC2")));
		assertTrue(table.accepts(Well.parse("1A02"), new BarcodePair("BC1", "BC2")));
	}
}
