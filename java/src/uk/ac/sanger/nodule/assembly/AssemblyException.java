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

package uk.ac.sanger.nodule.assembly;

import uk.ac.sanger.nodule.jobrunner.ExternalToolException;

public class AssemblyException extends ExternalToolException {
	public AssemblyException(String tool, int exitStatus, String stderr, String message) {
		super(tool, exitStatus, stderr, message);
	}

	public AssemblyException(Throwable cause, String tool, String message) {
		super(cause, tool, message);
	}
}
