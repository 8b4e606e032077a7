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

package uk.ac.sanger.nodule.data;

public class Contig {
	private final String name;
	private final String sequence;

	public Contig(String name, String sequence) {
		this.name = name;
		this.sequence = sequence;
	}

	public String getName() {
		return name;
	}

	public String getSequence() {
		return sequence;
	}

	public int getLength() {
		return sequence == null ? 0 : sequence.length();
	}

	public String toString() {
		return "Contig[name=\"" + name + "\", length=" + getLength() + "]";
	}
}
