package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;

/**
 * Trims adapter sequences from both reads of each pair with cutadapt, keeping
 * only pairs in which the adapters were found.
 */

public abstract class CutadaptStage extends ExternalToolStage {
	protected CutadaptStage(String name, String... prerequisites) {
		super(name, prerequisites);
	}

	protected String getTool() {
		return "cutadapt";
	}

	protected List<String> buildCommand(PipelineContext context, PathLayout.Replicate replicate)
			throws ConfigurationException, StageException {
		PipelineConfiguration config = context.getConfiguration();

		File forwardOut = getOutput(context.getLayout(), replicate, true);
		File reverseOut = getOutput(context.getLayout(), replicate, false);

		createDirectory(forwardOut.getParentFile());

		List<String> command = new ArrayList<String>();

		command.add(config.getProperty(PipelineConfiguration.CUTADAPT_COMMAND, "cutadapt"));
		command.addAll(getOptions(config));
		command.add("-g");
		command.add("file:" + config.getRequiredProperty(getForwardAdapterKey()));
		command.add("-G");
		command.add("file:" + config.getRequiredProperty(getReverseAdapterKey()));
		command.add("-o");
		command.add(forwardOut.getPath());
		command.add("-p");
		command.add(reverseOut.getPath());
		command.add(getInput(context.getLayout(), replicate, true).getPath());
		command.add(getInput(context.getLayout(), replicate, false).getPath());

		return command;
	}

	protected abstract List<String> getOptions(PipelineConfiguration config);

	protected abstract String getForwardAdapterKey();

	protected abstract String getReverseAdapterKey();

	protected abstract File getInput(PathLayout layout, PathLayout.Replicate replicate, boolean forward);

	protected abstract File getOutput(PathLayout layout, PathLayout.Replicate replicate, boolean forward);
}
