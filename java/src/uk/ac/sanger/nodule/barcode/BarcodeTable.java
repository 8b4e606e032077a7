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

package uk.ac.sanger.nodule.barcode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.sanger.nodule.data.BarcodePair;
import uk.ac.sanger.nodule.data.Well;

/**
 * Maps each well to the barcode pairs which identify its reads. Wells are kept
 * in the order in which they were added.
 * <p>
 * A barcode pair should belong to exactly one well. If it is listed under more
 * than one, {@link #lookup(BarcodePair)} returns the first of them and
 * {@link #findOverlaps()} reports the conflict.
 */

public class BarcodeTable {
	private final Map<Well, Set<BarcodePair>> wells = new LinkedHashMap<Well, Set<BarcodePair>>();

	private final Map<BarcodePair, Well> index = new HashMap<BarcodePair, Well>();

	public void addWell(Well well, List<BarcodePair> pairs) {
		if (wells.containsKey(well))
			throw new IllegalArgumentException("Well " + well + " is already in the barcode table");

		Set<BarcodePair> set = new LinkedHashSet<BarcodePair>(pairs);

		wells.put(well, set);

		for (BarcodePair pair : set) {
			if (!index.containsKey(pair))
				index.put(pair, well);
		}
	}

	/**
	 * Returns the well to which a read pair with these barcodes belongs, or
	 * null if no well accepts them.
	 */

	public Well lookup(BarcodePair pair) {
		return index.get(pair);
	}

	public boolean accepts(Well well, BarcodePair pair) {
		Set<BarcodePair> set = wells.get(well);

		return set != null && set.contains(pair);
	}

	public List<Well> getWells() {
		return new ArrayList<Well>(wells.keySet());
	}

	public Set<BarcodePair> getBarcodePairs(Well well) {
		Set<BarcodePair> set = wells.get(well);

		return set == null ? Collections.<BarcodePair>emptySet() : Collections.unmodifiableSet(set);
	}

	public SortedSet<Integer> getPlates() {
		SortedSet<Integer> plates = new TreeSet<Integer>();

		for (Well well : wells.keySet())
			plates.add(well.getPlate());

		return plates;
	}

	public int size() {
		return wells.size();
	}

	/**
	 * Finds barcode pairs which are listed under more than one well.
	 *
	 * @return a map from each such pair to the wells which list it, in table
	 *         order. The map is empty if the table is unambiguous.
	 */

	public Map<BarcodePair, List<Well>> findOverlaps() {
		Map<BarcodePair, List<Well>> owners = new LinkedHashMap<BarcodePair, List<Well>>();

		for (Map.Entry<Well, Set<BarcodePair>> entry : wells.entrySet()) {
			for (BarcodePair pair : entry.getValue()) {
				List<Well> list = owners.get(pair);

				if (list == null) {
					list = new ArrayList<Well>();
					owners.put(pair, list);
				}

				list.add(entry.getKey());
			}
		}

		Map<BarcodePair, List<Well>> overlaps = new LinkedHashMap<BarcodePair, List<Well>>();

		for (Map.Entry<BarcodePair, List<Well>> entry : owners.entrySet())
			if (entry.getValue().size() > 1)
				overlaps.put(entry.getKey(), entry.getValue());

		return overlaps;
	}

	public String toString() {
		return "BarcodeTable[wells=" + wells.size() + ", barcodePairs=" + index.size() + "]";
	}
}
