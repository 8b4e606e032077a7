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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import uk.ac.sanger.nodule.PipelineConfiguration;

/**
 * Everything needed to continue a run: the configuration, the path layout,
 * the index of the next stage to run and the names of the stages which have
 * failed. This is what a checkpoint file holds.
 */

@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineState {
	public static final int CURRENT_FORMAT_VERSION = 1;

	private int formatVersion = CURRENT_FORMAT_VERSION;
	private String runId;
	private Map<String, String> configuration = new TreeMap<String, String>();
	private PathLayout layout;
	private int cursor = 0;
	private List<String> failedStages = new ArrayList<String>();

	public PipelineState() {
	}

	public static PipelineState coldStart(String runId, PipelineConfiguration config, PathLayout layout) {
		PipelineState state = new PipelineState();

		state.runId = runId;
		state.configuration = config.toMap();
		state.layout = layout;

		return state;
	}

	public int getFormatVersion() {
		return formatVersion;
	}

	public void setFormatVersion(int formatVersion) {
		this.formatVersion = formatVersion;
	}

	public String getRunId() {
		return runId;
	}

	public void setRunId(String runId) {
		this.runId = runId;
	}

	public Map<String, String> getConfiguration() {
		return configuration;
	}

	public void setConfiguration(Map<String, String> configuration) {
		this.configuration = new TreeMap<String, String>(configuration);
	}

	@JsonIgnore
	public PipelineConfiguration getPipelineConfiguration() {
		return PipelineConfiguration.fromMap(configuration);
	}

	/**
	 * Replaces the configuration, as when a run is resumed with different
	 * settings. The path layout and the cursor are kept.
	 */

	public void applyConfiguration(PipelineConfiguration config) {
		this.configuration = config.toMap();
	}

	public PathLayout getLayout() {
		return layout;
	}

	public void setLayout(PathLayout layout) {
		this.layout = layout;
	}

	public int getCursor() {
		return cursor;
	}

	public void setCursor(int cursor) {
		this.cursor = cursor;
	}

	public List<String> getFailedStages() {
		return failedStages;
	}

	public void setFailedStages(List<String> failedStages) {
		this.failedStages = new ArrayList<String>(failedStages);
	}

	public void addFailedStage(String name) {
		if (!failedStages.contains(name))
			failedStages.add(name);
	}

	public void removeFailedStage(String name) {
		failedStages.remove(name);
	}

	public String toString() {
		return "PipelineState[runId=" + runId + ", cursor=" + cursor + ", failed=" + failedStages
				+ ", layout=" + layout + "]";
	}
}
