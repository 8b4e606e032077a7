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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import uk.ac.sanger.nodule.data.ReadPair;
import uk.ac.sanger.nodule.data.Well;

/**
 * The read pairs assigned to each well of the barcode table, in table order,
 * and the number of read pairs which matched no well.
 */

public class DemultiplexResult {
	private final Map<Well, List<ReadPair>> assignments = new LinkedHashMap<Well, List<ReadPair>>();

	private long discarded = 0;

	public DemultiplexResult(List<Well> wells) {
		for (Well well : wells)
			assignments.put(well, new ArrayList<ReadPair>());
	}

	protected void assign(Well well, ReadPair pair) {
		assignments.get(well).add(pair);
	}

	protected void discard() {
		discarded++;
	}

	public List<Well> getWells() {
		return new ArrayList<Well>(assignments.keySet());
	}

	public List<ReadPair> getReadPairs(Well well) {
		List<ReadPair> pairs = assignments.get(well);

		return pairs == null ? Collections.<ReadPair>emptyList() : Collections.unmodifiableList(pairs);
	}

	public int getCount(Well well) {
		List<ReadPair> pairs = assignments.get(well);

		return pairs == null ? 0 : pairs.size();
	}

	public Map<Well, Integer> getCounts() {
		Map<Well, Integer> counts = new LinkedHashMap<Well, Integer>();

		for (Map.Entry<Well, List<ReadPair>> entry : assignments.entrySet())
			counts.put(entry.getKey(), entry.getValue().size());

		return counts;
	}

	public long getAssignedCount() {
		long total = 0;

		for (List<ReadPair> pairs : assignments.values())
			total += pairs.size();

		return total;
	}

	public long getDiscardedCount() {
		return discarded;
	}

	public long getTotalCount() {
		return getAssignedCount() + discarded;
	}

	public List<Well> getEmptyWells() {
		List<Well> empty = new ArrayList<Well>();

		for (Map.Entry<Well, List<ReadPair>> entry : assignments.entrySet())
			if (entry.getValue().isEmpty())
				empty.add(entry.getKey());

		return empty;
	}
}
