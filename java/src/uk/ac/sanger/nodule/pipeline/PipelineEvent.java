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

public class PipelineEvent {
	public enum Type {
		RUN_STARTED, STAGE_STARTED, STAGE_COMPLETED, STAGE_FAILED, CHECKPOINT_WRITTEN, RUN_COMPLETED, RUN_HALTED,
		RUN_CANCELLED
	}
	/*
	 * RUN_COMPLETED, RUN_HALTED and RUN_CANCELLED are terminal: no further
	 * events follow them.
	 */

	private final PipelineEngine source;
	private final Type type;
	private final String message;
	private final String stageName;
	private final int stageIndex;
	private final File checkpoint;
	private final Exception exception;

	public PipelineEvent(PipelineEngine source, Type type, String message, String stageName, int stageIndex,
			File checkpoint, Exception exception) {
		this.source = source;
		this.type = type;
		this.message = message;
		this.stageName = stageName;
		this.stageIndex = stageIndex;
		this.checkpoint = checkpoint;
		this.exception = exception;
	}

	public PipelineEngine getSource() {
		return source;
	}

	public Type getType() {
		return type;
	}

	public String getMessage() {
		return message;
	}

	public String getStageName() {
		return stageName;
	}

	public int getStageIndex() {
		return stageIndex;
	}

	public File getCheckpoint() {
		return checkpoint;
	}

	public Exception getException() {
		return exception;
	}

	public boolean isTerminal() {
		return type == Type.RUN_COMPLETED || type == Type.RUN_HALTED || type == Type.RUN_CANCELLED;
	}

	public String toString() {
		return "PipelineEvent[type=" + type + (stageName == null ? "" : ", stage=" + stageName)
				+ (message == null ? "" : ", message=\"" + message + "\"") + "]";
	}
}
