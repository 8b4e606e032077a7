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

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes checkpoint files, which are named
 * <code>&lt;prefix&gt;_&lt;tag&gt;.checkpoint</code> and hold a
 * {@link PipelineState} as JSON. A checkpoint is written to a temporary file
 * first and then moved into place, so an existing checkpoint is never left
 * half-written.
 */

public class CheckpointStore {
	public static final String SUFFIX = ".checkpoint";

	private static final ObjectMapper mapper = new ObjectMapper();

	static {
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
	}

	private final File directory;
	private final String prefix;
	private final Logger logger;

	public CheckpointStore(File directory, String prefix, Logger logger) {
		this.directory = directory;
		this.prefix = prefix;
		this.logger = logger;
	}

	public File getDirectory() {
		return directory;
	}

	public File getCheckpointFile(String tag) {
		return new File(directory, prefix + "_" + tag + SUFFIX);
	}

	public File write(String tag, PipelineState state) throws CheckpointException {
		if (!directory.isDirectory() && !directory.mkdirs())
			throw new CheckpointException("Cannot create the checkpoint directory " + directory.getPath());

		File target = getCheckpointFile(tag);
		File temp = new File(directory, "." + target.getName() + ".tmp");

		try {
			mapper.writeValue(temp, state);

			try {
				Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING,
						StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException amnse) {
				Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException ioe) {
			throw new CheckpointException(ioe, "Failed to write the checkpoint " + target.getPath());
		}

		logger.fine("Wrote checkpoint " + target.getPath() + " with cursor " + state.getCursor());

		return target;
	}

	/**
	 * Reads a checkpoint file.
	 *
	 * @throws CheckpointException
	 *             if the file cannot be read, is corrupt, or was written by a
	 *             newer version of the pipeline.
	 */

	public static PipelineState read(File file) throws CheckpointException {
		if (!file.isFile() || !file.canRead())
			throw new CheckpointException("Cannot read the checkpoint " + file.getPath());

		PipelineState state;

		try {
			state = mapper.readValue(file, PipelineState.class);
		} catch (JsonProcessingException jpe) {
			throw new CheckpointException(jpe, "The checkpoint " + file.getPath()
					+ " is corrupt. Try resuming from an earlier checkpoint.");
		} catch (IOException ioe) {
			throw new CheckpointException(ioe, "Failed to read the checkpoint " + file.getPath());
		}

		if (state == null)
			throw new CheckpointException("The checkpoint " + file.getPath()
					+ " is empty. Try resuming from an earlier checkpoint.");

		if (state.getFormatVersion() > PipelineState.CURRENT_FORMAT_VERSION)
			throw new CheckpointException("The checkpoint " + file.getPath() + " has format version "
					+ state.getFormatVersion() + " but this program can only read version "
					+ PipelineState.CURRENT_FORMAT_VERSION + " or older. Try resuming from an earlier checkpoint.");

		if (state.getLayout() == null || state.getLayout().getWorkDirectory() == null)
			throw new CheckpointException("The checkpoint " + file.getPath()
					+ " does not describe a work directory. Try resuming from an earlier checkpoint.");

		return state;
	}
}
