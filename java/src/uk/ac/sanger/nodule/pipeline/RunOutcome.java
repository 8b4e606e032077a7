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
import java.util.Collections;
import java.util.List;

public class RunOutcome {
	public enum Status {
		COMPLETED, HALTED, CANCELLED
	}

	private final Status status;
	private final int cursor;
	private final List<String> failedStages;
	private final String stoppedAt;
	private final File lastCheckpoint;

	public RunOutcome(Status status, int cursor, List<String> failedStages, String stoppedAt, File lastCheckpoint) {
		this.status = status;
		this.cursor = cursor;
		this.failedStages = new ArrayList<String>(failedStages);
		this.stoppedAt = stoppedAt;
		this.lastCheckpoint = lastCheckpoint;
	}

	public Status getStatus() {
		return status;
	}

	public int getCursor() {
		return cursor;
	}

	public List<String> getFailedStages() {
		return Collections.unmodifiableList(failedStages);
	}

	public boolean hasFailures() {
		return !failedStages.isEmpty();
	}

	/**
	 * Returns the name of the stage at which a halted or cancelled run
	 * stopped, or null if the run completed.
	 */

	public String getStoppedAt() {
		return stoppedAt;
	}

	/**
	 * Returns the checkpoint from which the run can be resumed.
	 */

	public File getLastCheckpoint() {
		return lastCheckpoint;
	}

	public String toString() {
		return "RunOutcome[status=" + status + ", cursor=" + cursor + ", failed=" + failedStages
				+ (stoppedAt == null ? "" : ", stoppedAt=" + stoppedAt)
				+ (lastCheckpoint == null ? "" : ", checkpoint=" + lastCheckpoint.getPath()) + "]";
	}
}
