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

package uk.ac.sanger.nodule.apps;

import java.io.PrintStream;

import uk.ac.sanger.nodule.pipeline.PipelineEvent;
import uk.ac.sanger.nodule.pipeline.PipelineListener;

/**
 * Prints a line of progress for each stage of the run.
 */

public class ConsoleProgressListener implements PipelineListener {
	private final PrintStream ps;
	private final int stageCount;

	public ConsoleProgressListener(PrintStream ps, int stageCount) {
		this.ps = ps;
		this.stageCount = stageCount;
	}

	public void report(PipelineEvent event) {
		switch (event.getType()) {
			case RUN_STARTED:
				ps.println(event.getMessage());
				break;

			case STAGE_STARTED:
				ps.println("[" + (event.getStageIndex() + 1) + "/" + stageCount + "] " + event.getStageName() + " ...");
				break;

			case STAGE_COMPLETED:
				ps.println("[" + (event.getStageIndex() + 1) + "/" + stageCount + "] " + event.getStageName() + " done. "
						+ event.getMessage());
				break;

			case STAGE_FAILED:
				ps.println("[" + (event.getStageIndex() + 1) + "/" + stageCount + "] " + event.getStageName()
						+ " FAILED: " + event.getMessage());
				break;

			case CHECKPOINT_WRITTEN:
				break;

			default:
				ps.println(event.getMessage());
				break;
		}

		ps.flush();
	}
}
