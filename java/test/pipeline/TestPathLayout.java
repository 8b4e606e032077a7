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

package test.pipeline;

import static org.junit.Assert.*;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.pipeline.PathLayout;

public class TestPathLayout {
	@Test
	public void testReplicateNames() {
		assertEquals("plate1", PathLayout.deriveReplicateName(new File("/data/plate1_R1.fastq.gz")));
		assertEquals("plate1", PathLayout.deriveReplicateName(new File("plate1.R1.fq")));
		assertEquals("lane_3", PathLayout.deriveReplicateName(new File("lane_3_1.fastq")));
		assertEquals("odd_name", PathLayout.deriveReplicateName(new File("odd name.fastq")));
	}

	@Test
	public void testClashingNamesAreNumbered() {
		List<PathLayout.Replicate> replicates = PathLayout.createReplicates(
				Arrays.asList(new File("a/reads_R1.fastq"), new File("b/reads_R1.fastq"), new File("_R1.fastq")),
				Arrays.asList(new File("a/reads_R2.fastq"), new File("b/reads_R2.fastq"), new File("_R2.fastq")));

		assertEquals("reads", replicates.get(0).getName());
		assertEquals("rep2", replicates.get(1).getName());
		assertEquals("rep3", replicates.get(2).getName());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnpairedFiles() {
		PathLayout.createReplicates(Arrays.asList(new File("a_R1.fastq")), Arrays.<File> asList());
	}

	@Test
	public void testPaths() {
		File work = new File("/work/20260101_120000");

		PathLayout layout = new PathLayout(work, PathLayout.createReplicates(Arrays.asList(new File("p1_R1.fastq")),
				Arrays.asList(new File("p1_R2.fastq"))));

		PathLayout.Replicate replicate = layout.getReplicates().get(0);

		assertEquals(new File(work, "trim_tag/p1_R1.fastq"), layout.getTagTrimmedReads(replicate, true));
		assertEquals(new File(work, "trim_primer/p1_R2.fastq"), layout.getPrimerTrimmedReads(replicate, false));
		assertEquals(new File(work, "fastp/p1_R1.fastq"), layout.getFilteredReads(replicate, true));
		assertEquals(new File(work, "cells/2H07"), layout.getWellDirectory(Well.parse("2H07")));
		assertEquals(new File(work, "checkpoints"), layout.getCheckpointDirectory());
		assertEquals(new File(work, "calls.csv"), layout.getReportFile("calls.csv"));
	}
}
