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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public abstract class AbstractStage implements Stage {
	protected final String name;
	protected final List<String> prerequisites;

	protected AbstractStage(String name, String... prerequisites) {
		this.name = name;
		this.prerequisites = Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(prerequisites)));
	}

	public String getName() {
		return name;
	}

	public List<String> getPrerequisites() {
		return prerequisites;
	}

	public String toString() {
		return getClass().getSimpleName() + "[" + name + "]";
	}
}
