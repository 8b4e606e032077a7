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

import uk.ac.sanger.nodule.data.Well;

/**
 * A unit of work on one well. Only one task at a time works on a given well's
 * directory.
 */

public abstract class WellTask<T> {
	protected final Well well;

	protected WellTask(Well well) {
		this.well = well;
	}

	public Well getWell() {
		return well;
	}

	public abstract T run() throws Exception;
}
