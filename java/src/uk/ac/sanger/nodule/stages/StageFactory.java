package uk.ac.sanger.nodule.stages;

import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.assembly.AssemblyMode;
import uk.ac.sanger.nodule.pipeline.Stage;

public class StageFactory {
	/**
	 * Returns the stages of the pipeline in the order in which they run.
	 */

	public static List<Stage> createStages() {
		List<Stage> stages = new ArrayList<Stage>();

		stages.add(new TrimTagStage());
		stages.add(new TrimPrimerStage());
		stages.add(new QualityFilterStage());
		stages.add(new DemultiplexStage());
		stages.add(new AssemblyStage(AssemblyMode.POOLED));
		stages.add(new AssemblyStage(AssemblyMode.PER_REPLICATE));
		stages.add(new HomologySearchStage());

		return stages;
	}
}
