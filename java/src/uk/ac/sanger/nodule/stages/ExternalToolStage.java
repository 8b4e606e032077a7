package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.util.List;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.jobrunner.ExternalToolException;
import uk.ac.sanger.nodule.jobrunner.SimpleJobRunnerClient;
import uk.ac.sanger.nodule.pipeline.AbstractStage;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;

/**
 * A stage which runs an external program once for each replicate.
 */

public abstract class ExternalToolStage extends AbstractStage {
	protected ExternalToolStage(String name, String... prerequisites) {
		super(name, prerequisites);
	}

	public void execute(PipelineContext context) throws StageException {
		List<String> command;

		for (PathLayout.Replicate replicate : context.getLayout().getReplicates()) {
			context.checkCancelled();

			try {
				command = buildCommand(context, replicate);
			} catch (ConfigurationException ce) {
				throw new StageException(name, ce, "Stage " + name + " is not configured properly: " + ce.getMessage());
			}

			context.getLogger().info("Stage " + name + ": processing replicate " + replicate.getName());

			try {
				SimpleJobRunnerClient.executeCommand(context.getProcessRunner(), getTool(), command,
						context.getLayout().getWorkDirectoryFile());
			} catch (ExternalToolException ete) {
				throw new StageException(name, ete, getTool() + " failed on replicate " + replicate.getName()
						+ ": " + ete.getMessage());
			}
		}
	}

	protected void createDirectory(File directory) throws StageException {
		if (!directory.isDirectory() && !directory.mkdirs())
			throw new StageException(name, "Cannot create directory " + directory.getPath());
	}

	protected abstract String getTool();

	protected abstract List<String> buildCommand(PipelineContext context, PathLayout.Replicate replicate)
			throws ConfigurationException, StageException;
}
