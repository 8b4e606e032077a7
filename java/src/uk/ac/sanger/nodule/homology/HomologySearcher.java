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

package uk.ac.sanger.nodule.homology;

import java.io.File;
import java.util.List;

import uk.ac.sanger.nodule.data.HomologyHit;

public interface HomologySearcher {
	/**
	 * Searches every sequence in a FASTA file against the reference database.
	 *
	 * @return the hits, annotated with the query file and query sequence. An
	 *         empty list is a valid result.
	 */

	public List<HomologyHit> search(File queryFasta, List<String> params) throws HomologySearchException;
}
