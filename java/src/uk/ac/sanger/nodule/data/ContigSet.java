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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The contigs assembled from the reads of one well, either from all of its
 * replicates pooled together or from a single replicate.
 */

public class ContigSet {
	public static final String POOLED = "pooled";

	private final Well well;
	private final String tag;
	private final File file;
	private final List<Contig> contigs;

	/**
	 * @param well
	 *            the well whose reads were assembled.
	 * @param tag
	 *            {@link #POOLED} for a pooled assembly, otherwise the name of
	 *            the replicate.
	 * @param file
	 *            the FASTA file holding the contigs, which may be null if no
	 *            file was written.
	 * @param contigs
	 *            the contigs, possibly none.
	 */

	public ContigSet(Well well, String tag, File file, List<Contig> contigs) {
		this.well = well;
		this.tag = tag;
		this.file = file;
		this.contigs = contigs == null ? new ArrayList<Contig>() : new ArrayList<Contig>(contigs);
	}

	public static ContigSet empty(Well well, String tag, File file) {
		return new ContigSet(well, tag, file, null);
	}

	public Well getWell() {
		return well;
	}

	public String getTag() {
		return tag;
	}

	public boolean isPooled() {
		return POOLED.equals(tag);
	}

	public File getFile() {
		return file;
	}

	public List<Contig> getContigs() {
		return Collections.unmodifiableList(contigs);
	}

	public boolean isEmpty() {
		return contigs.isEmpty();
	}

	public int size() {
		return contigs.size();
	}

	public ContigSet relocate(File newFile) {
		return new ContigSet(well, tag, newFile, contigs);
	}

	public String toString() {
		return "ContigSet[well=" + well + ", tag=" + tag + ", contigs=" + contigs.size()
				+ (file == null ? "" : ", file=" + file.getPath()) + "]";
	}
}
