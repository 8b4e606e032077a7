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

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * The assembler programs which the pipeline knows how to drive. Each engine
 * builds its own command line and knows where its contigs end up.
 */

public enum AssemblyEngine {
	MEGAHIT("megahit", "megahit") {
		public List<String> buildCommand(String executable, File forward, File reverse, File outputDirectory,
				List<String> params) {
			List<String> command = new ArrayList<String>();

			command.add(executable);
			command.add("-1");
			command.add(forward.getPath());
			command.add("-2");
			command.add(reverse.getPath());
			command.add("-o");
			command.add(outputDirectory.getPath());
			command.addAll(params);

			return command;
		}

		public File getContigsFile(File outputDirectory) {
			return new File(outputDirectory, "final.contigs.fa");
		}

		// MEGAHIT refuses to write into a directory which already exists.
		public boolean createsOutputDirectory() {
			return true;
		}
	},

	SKESA("skesa", "skesa") {
		public List<String> buildCommand(String executable, File forward, File reverse, File outputDirectory,
				List<String> params) {
			List<String> command = new ArrayList<String>();

			command.add(executable);
			command.add("--reads");
			command.add(forward.getPath() + "," + reverse.getPath());
			command.addAll(params);

			return command;
		}

		public File getContigsFile(File outputDirectory) {
			return new File(outputDirectory, "contigs.fasta");
		}

		public boolean writesContigsToStdout() {
			return true;
		}
	},

	SPADES("spades", "spades.py") {
		public List<String> buildCommand(String executable, File forward, File reverse, File outputDirectory,
				List<String> params) {
			List<String> command = new ArrayList<String>();

			command.add(executable);
			command.add("-1");
			command.add(forward.getPath());
			command.add("-2");
			command.add(reverse.getPath());
			command.add("-o");
			command.add(outputDirectory.getPath());
			command.addAll(params);

			return command;
		}

		public File getContigsFile(File outputDirectory) {
			return new File(outputDirectory, "contigs.fasta");
		}
	};

	private final String name;
	private final String defaultExecutable;

	private AssemblyEngine(String name, String defaultExecutable) {
		this.name = name;
		this.defaultExecutable = defaultExecutable;
	}

	public String getName() {
		return name;
	}

	public String getDefaultExecutable() {
		return defaultExecutable;
	}

	public abstract List<String> buildCommand(String executable, File forward, File reverse, File outputDirectory,
			List<String> params);

	public abstract File getContigsFile(File outputDirectory);

	public boolean createsOutputDirectory() {
		return false;
	}

	public boolean writesContigsToStdout() {
		return false;
	}

	public static AssemblyEngine forName(String name) {
		if (name == null)
			return null;

		for (AssemblyEngine engine : values())
			if (engine.name.equalsIgnoreCase(name.trim()))
				return engine;

		return null;
	}

	public String toString() {
		return name;
	}
}
