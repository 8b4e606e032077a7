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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.sanger.nodule.data.Well;

/**
 * The outcome of running a batch of well tasks: a result for each well which
 * succeeded, an exception for each well which failed, and the wells which
 * were never started because the run was cancelled.
 */

public class WellBatchResult<T> {
	private final SortedMap<Well, T> results = new TreeMap<Well, T>();
	private final SortedMap<Well, Exception> failures = new TreeMap<Well, Exception>();
	private final List<Well> skipped = new ArrayList<Well>();

	protected synchronized void addResult(Well well, T result) {
		results.put(well, result);
	}

	protected synchronized void addFailure(Well well, Exception exception) {
		failures.put(well, exception);
	}

	protected synchronized void addSkipped(Well well) {
		skipped.add(well);
	}

	public synchronized Map<Well, T> getResults() {
		return Collections.unmodifiableMap(results);
	}

	public synchronized Map<Well, Exception> getFailures() {
		return Collections.unmodifiableMap(failures);
	}

	public synchronized List<Well> getSkipped() {
		return Collections.unmodifiableList(skipped);
	}

	public synchronized boolean hasFailures() {
		return !failures.isEmpty();
	}

	public synchronized boolean isIncomplete() {
		return !skipped.isEmpty();
	}

	/**
	 * Throws a stage exception describing the failed wells, with the first
	 * failure as its cause, if any well failed.
	 */

	public synchronized void checkFailures(String stageName) throws StageException {
		if (failures.isEmpty())
			return;

		Map.Entry<Well, Exception> first = failures.entrySet().iterator().next();

		throw new StageException(stageName, first.getValue(), failures.size() + " well(s) failed in stage "
				+ stageName + ": " + failures.keySet() + ". First failure in " + first.getKey() + ": "
				+ first.getValue().getMessage());
	}

	public synchronized String toString() {
		return "WellBatchResult[succeeded=" + results.size() + ", failed=" + failures.size() + ", skipped="
				+ skipped.size() + "]";
	}
}
