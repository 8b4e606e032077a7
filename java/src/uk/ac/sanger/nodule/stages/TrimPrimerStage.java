package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.PathLayout;

public class TrimPrimerStage extends CutadaptStage {
	public static final String NAME = "trim_primer";

	public TrimPrimerStage() {
		super(NAME, TrimTagStage.NAME);
	}

	protected List<String> getOptions(PipelineConfiguration config) {
		List<String> options = new ArrayList<String>();

		options.add("--discard-untrimmed");

		return options;
	}

	protected String getForwardAdapterKey() {
		return PipelineConfiguration.PRIMER_FORWARD;
	}

	protected String getReverseAdapterKey() {
		return PipelineConfiguration.PRIMER_REVERSE;
	}

	protected File getInput(PathLayout layout, PathLayout.Replicate replicate, boolean forward) {
		return layout.getTagTrimmedReads(replicate, forward);
	}

	protected File getOutput(PathLayout layout, PathLayout.Replicate replicate, boolean forward) {
		return layout.getPrimerTrimmedReads(replicate, forward);
	}
}
