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
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.sanger.nodule.data.Well;

/**
 * The number of read pairs in each well, laid out as one 8 by 12 grid per
 * plate, with the list of empty wells and the number of read pairs which
 * matched no well.
 */

public class OccupancyReport {
	private final SortedMap<Integer, int[][]> plates = new TreeMap<Integer, int[][]>();
	private final List<Well> emptyWells = new ArrayList<Well>();
	private final long discarded;
	private final long assigned;

	public OccupancyReport(DemultiplexResult result) {
		for (Map.Entry<Well, Integer> entry : result.getCounts().entrySet()) {
			Well well = entry.getKey();
			int count = entry.getValue();

			getOrCreateGrid(well.getPlate())[well.getRowIndex()][well.getColumn() - 1] = count;

			if (count == 0)
				emptyWells.add(well);
		}

		Collections.sort(emptyWells);

		discarded = result.getDiscardedCount();
		assigned = result.getAssignedCount();
	}

	private int[][] getOrCreateGrid(int plate) {
		int[][] grid = plates.get(plate);

		if (grid == null) {
			grid = new int[Well.ROWS][Well.COLUMNS];
			plates.put(plate, grid);
		}

		return grid;
	}

	public List<Integer> getPlates() {
		return new ArrayList<Integer>(plates.keySet());
	}

	public int getCount(Well well) {
		int[][] grid = plates.get(well.getPlate());

		return grid == null ? 0 : grid[well.getRowIndex()][well.getColumn() - 1];
	}

	/**
	 * Returns a copy of the grid of counts for a plate, indexed by row and then
	 * by column, both zero-based. Positions which are not in the barcode table
	 * have a count of zero.
	 */

	public int[][] getGrid(int plate) {
		int[][] grid = plates.get(plate);
		int[][] copy = new int[Well.ROWS][Well.COLUMNS];

		if (grid != null) {
			for (int row = 0; row < Well.ROWS; row++)
				System.arraycopy(grid[row], 0, copy[row], 0, Well.COLUMNS);
		}

		return copy;
	}

	public List<Well> getEmptyWells() {
		return Collections.unmodifiableList(emptyWells);
	}

	public long getDiscardedCount() {
		return discarded;
	}

	public long getAssignedCount() {
		return assigned;
	}

	public String format() {
		StringBuilder sb = new StringBuilder();

		for (Map.Entry<Integer, int[][]> entry : plates.entrySet()) {
			int[][] grid = entry.getValue();

			sb.append("\t==== Reads in plate No. " + entry.getKey() + " ====\n");

			sb.append(" ");

			for (int col = 1; col <= Well.COLUMNS; col++)
				sb.append(String.format(" %6s", (col < 10 ? "0" : "") + col));

			sb.append("\n");

			for (int row = 0; row < Well.ROWS; row++) {
				sb.append(Well.ROW_LETTERS.charAt(row));

				for (int col = 0; col < Well.COLUMNS; col++)
					sb.append(String.format(" %6d", grid[row][col]));

				sb.append("\n");
			}
		}

		sb.append("Empty wells : " + emptyWells + "\n");
		sb.append("Assigned read pairs : " + assigned + "\n");
		sb.append("Discarded read pairs : " + discarded + "\n");

		return sb.toString();
	}

	public String toString() {
		return "OccupancyReport[plates=" + plates.keySet() + ", empty=" + emptyWells.size()
				+ ", assigned=" + assigned + ", discarded=" + discarded + "]";
	}
}
