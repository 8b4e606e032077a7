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

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import uk.ac.sanger.nodule.data.Well;

/**
 * Where a run keeps its files. Everything lives below the work directory:
 *
 * <pre>
 * &lt;work&gt;/trim_tag/&lt;replicate&gt;_R1.fastq    reads with the tags removed
 * &lt;work&gt;/trim_primer/&lt;replicate&gt;_R1.fastq reads with the primers removed
 * &lt;work&gt;/fastp/&lt;replicate&gt;_R1.fastq       reads which passed the quality filter
 * &lt;work&gt;/fastp_report/                  the quality filter's reports
 * &lt;work&gt;/cells/&lt;well&gt;/                    one directory per well
 * &lt;work&gt;/checkpoints/                   the checkpoint files
 * </pre>
 */

@JsonIgnoreProperties(ignoreUnknown = true)
public class PathLayout {
	public static final String TAG_TRIM_DIRECTORY = "trim_tag";
	public static final String PRIMER_TRIM_DIRECTORY = "trim_primer";
	public static final String QUALITY_FILTER_DIRECTORY = "fastp";
	public static final String FASTP_REPORT_DIRECTORY = "fastp_report";
	public static final String CELLS_DIRECTORY = "cells";
	public static final String CHECKPOINT_DIRECTORY = "checkpoints";

	private String workDirectory;
	private List<Replicate> replicates = new ArrayList<Replicate>();

	public PathLayout() {
	}

	public PathLayout(File workDirectory, List<Replicate> replicates) {
		this.workDirectory = workDirectory.getPath();
		this.replicates = new ArrayList<Replicate>(replicates);
	}

	/**
	 * Names the replicates after their forward read files, dropping the
	 * extensions and a trailing <code>_R1</code> or <code>_1</code>. A name
	 * which is empty or already taken is replaced by <code>rep&lt;N&gt;</code>.
	 */

	public static List<Replicate> createReplicates(List<File> forwardFiles, List<File> reverseFiles) {
		if (forwardFiles.size() != reverseFiles.size())
			throw new IllegalArgumentException("There are " + forwardFiles.size() + " forward read files but "
					+ reverseFiles.size() + " reverse read files");

		List<Replicate> replicates = new ArrayList<Replicate>();
		Set<String> names = new HashSet<String>();

		for (int i = 0; i < forwardFiles.size(); i++) {
			String name = deriveReplicateName(forwardFiles.get(i));

			if (name.isEmpty() || names.contains(name)) {
				int n = i + 1;

				do {
					name = "rep" + n++;
				} while (names.contains(name));
			}

			names.add(name);

			replicates.add(new Replicate(name, forwardFiles.get(i).getPath(), reverseFiles.get(i).getPath()));
		}

		return replicates;
	}

	public static String deriveReplicateName(File forwardFile) {
		String name = forwardFile.getName();

		if (name.endsWith(".gz"))
			name = name.substring(0, name.length() - 3);

		if (name.endsWith(".fastq"))
			name = name.substring(0, name.length() - 6);
		else if (name.endsWith(".fq"))
			name = name.substring(0, name.length() - 3);

		if (name.endsWith("_R1") || name.endsWith(".R1"))
			name = name.substring(0, name.length() - 3);
		else if (name.endsWith("_1"))
			name = name.substring(0, name.length() - 2);

		return name.replaceAll("[^A-Za-z0-9_.\\-]", "_");
	}

	public String getWorkDirectory() {
		return workDirectory;
	}

	public void setWorkDirectory(String workDirectory) {
		this.workDirectory = workDirectory;
	}

	public List<Replicate> getReplicates() {
		return replicates;
	}

	public void setReplicates(List<Replicate> replicates) {
		this.replicates = replicates;
	}

	@JsonIgnore
	public List<String> getReplicateNames() {
		List<String> names = new ArrayList<String>();

		for (Replicate replicate : replicates)
			names.add(replicate.getName());

		return names;
	}

	private File getDirectory(String name) {
		return new File(workDirectory, name);
	}

	@JsonIgnore
	public File getWorkDirectoryFile() {
		return new File(workDirectory);
	}

	@JsonIgnore
	public File getTagTrimDirectory() {
		return getDirectory(TAG_TRIM_DIRECTORY);
	}

	@JsonIgnore
	public File getPrimerTrimDirectory() {
		return getDirectory(PRIMER_TRIM_DIRECTORY);
	}

	@JsonIgnore
	public File getQualityFilterDirectory() {
		return getDirectory(QUALITY_FILTER_DIRECTORY);
	}

	@JsonIgnore
	public File getFastpReportDirectory() {
		return getDirectory(FASTP_REPORT_DIRECTORY);
	}

	@JsonIgnore
	public File getCellsDirectory() {
		return getDirectory(CELLS_DIRECTORY);
	}

	@JsonIgnore
	public File getCheckpointDirectory() {
		return getDirectory(CHECKPOINT_DIRECTORY);
	}

	private File getReads(File directory, Replicate replicate, boolean forward) {
		return new File(directory, replicate.getName() + (forward ? "_R1.fastq" : "_R2.fastq"));
	}

	public File getTagTrimmedReads(Replicate replicate, boolean forward) {
		return getReads(getTagTrimDirectory(), replicate, forward);
	}

	public File getPrimerTrimmedReads(Replicate replicate, boolean forward) {
		return getReads(getPrimerTrimDirectory(), replicate, forward);
	}

	public File getFilteredReads(Replicate replicate, boolean forward) {
		return getReads(getQualityFilterDirectory(), replicate, forward);
	}

	public File getFastpReport(Replicate replicate, String extension) {
		return new File(getFastpReportDirectory(), replicate.getName() + "_report." + extension);
	}

	public File getOccupancyReport(Replicate replicate) {
		return new File(workDirectory, replicate.getName() + "_occupancy.txt");
	}

	public File getWellDirectory(Well well) {
		return new File(getCellsDirectory(), well.getCode());
	}

	public File getReportFile(String filename) {
		return new File(workDirectory, filename);
	}

	public String toString() {
		return "PathLayout[workDirectory=" + workDirectory + ", replicates=" + getReplicateNames() + "]";
	}

	/**
	 * One pair of raw read files given to the pipeline.
	 */

	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Replicate {
		private String name;
		private String forward;
		private String reverse;

		public Replicate() {
		}

		public Replicate(String name, String forward, String reverse) {
			this.name = name;
			this.forward = forward;
			this.reverse = reverse;
		}

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public String getForward() {
			return forward;
		}

		public void setForward(String forward) {
			this.forward = forward;
		}

		public String getReverse() {
			return reverse;
		}

		public void setReverse(String reverse) {
			this.reverse = reverse;
		}

		@JsonIgnore
		public File getForwardFile() {
			return new File(forward);
		}

		@JsonIgnore
		public File getReverseFile() {
			return new File(reverse);
		}

		public String toString() {
			return "Replicate[" + name + ": " + forward + ", " + reverse + "]";
		}
	}
}
