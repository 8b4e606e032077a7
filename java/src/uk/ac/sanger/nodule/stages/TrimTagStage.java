package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.PathLayout;

/**
 * Removes the well barcode tags. The name of the matching tag is appended to
 * each read header, where the demultiplexer looks for it.
 */

public class TrimTagStage extends CutadaptStage {
	public static final String NAME = "trim_tag";

	public TrimTagStage() {
		super(NAME);
	}

	protected List<String> getOptions(PipelineConfiguration config) {
		List<String> options = new ArrayList<String>();

		options.add("--no-indels");
		options.add("--discard-untrimmed");
		options.add("-y");
		options.add(" {name}");

		return options;
	}

	protected String getForwardAdapterKey() {
		return PipelineConfiguration.TAG_FORWARD;
	}

	protected String getReverseAdapterKey() {
		return PipelineConfiguration.TAG_REVERSE;
	}

	protected File getInput(PathLayout layout, PathLayout.Replicate replicate, boolean forward) {
		return forward ? replicate.getForwardFile() : replicate.getReverseFile();
	}

	protected File getOutput(PathLayout layout, PathLayout.Replicate replicate, boolean forward) {
		return layout.getTagTrimmedReads(replicate, forward);
	}
}
