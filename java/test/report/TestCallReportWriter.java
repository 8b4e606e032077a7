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

package test.report;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.nodule.data.ConsensusCall;
import uk.ac.sanger.nodule.data.HomologyHit;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.report.CallReportRow;
import uk.ac.sanger.nodule.report.CallReportWriter;
import uk.ac.sanger.nodule.report.ReportFilter;

public class TestCallReportWriter {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private CallReportWriter writer;

	@Before
	public void setUp() {
		Logger logger = Logger.getLogger("test.report");
		logger.setUseParentHandlers(false);

		writer = new CallReportWriter(logger);
	}

	private static CallReportRow row(String well, double pident, String... accessions) {
		List<HomologyHit> hits = new ArrayList<HomologyHit>();

		for (String accession : accessions)
			hits.add(new HomologyHit("k141_7", accession, pident, 420, 0, 0, 1, 420, 11, 430, 1e-100, 776.0));

		ConsensusCall call = new ConsensusCall(hits, true, "rep1:rep2", "k141_7:k99_2", "ACGT:ACGA");

		return new CallReportRow(Well.parse(well), call, 250, 2);
	}

	private static String[] lines(String csv) {
		return csv.split("\r\n");
	}

	@Test
	public void testHeaderAndOrder() throws IOException {
		StringBuilder sb = new StringBuilder();

		int written = writer.write(sb, Arrays.asList(row("2A01", 99.0, "Z"), row("1B02", 98.0, "Y"),
				row("1A10", 97.0, "X", "W", "V")), null);

		assertEquals(3, written);

		String[] lines = lines(sb.toString());

		assertEquals(4, lines.length);
		assertEquals("plate,well,candidate,percent_identity,length,evalue,bitscore,query_seq,query_file,"
				+ "query_name,from_intersection,raw_count,query_count,other_candidates", lines[0]);

		assertTrue(lines[1].startsWith("1,A10,X,97.0,420,"));
		assertTrue(lines[1].endsWith(",ACGT:ACGA,rep1:rep2,k141_7:k99_2,true,250,2,W;V"));
		assertTrue(lines[2].startsWith("1,B02,Y,"));
		assertTrue(lines[3].startsWith("2,A01,Z,"));
	}

	@Test
	public void testFilterDropsRows() throws IOException {
		File file = new File(folder.getRoot(), "calls.csv");

		int written = writer.write(file, Arrays.asList(row("1A01", 99.0, "X"), row("1A02", 90.0, "Y")),
				ReportFilter.parse("percent_identity > 95"));

		assertEquals(1, written);

		List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);

		assertEquals(2, lines.size());
		assertTrue(lines.get(1).startsWith("1,A01,X,"));
	}

	@Test
	public void testEmptyReportHasHeader() throws IOException {
		StringBuilder sb = new StringBuilder();

		assertEquals(0, writer.write(sb, new ArrayList<CallReportRow>(), null));
		assertTrue(sb.toString().startsWith("plate,well,candidate,"));
	}
}
