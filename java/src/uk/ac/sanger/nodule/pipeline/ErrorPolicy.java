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

/**
 * What the engine does after a stage fails: stop the run, or go on to the
 * next stage.
 */

public enum ErrorPolicy {
	HALT("halt"), CONTINUE("continue");

	private final String name;

	private ErrorPolicy(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public static ErrorPolicy forName(String name) {
		if (name == null)
			return null;

		for (ErrorPolicy policy : values())
			if (policy.name.equalsIgnoreCase(name.trim()))
				return policy;

		return null;
	}

	public String toString() {
		return name;
	}
}
