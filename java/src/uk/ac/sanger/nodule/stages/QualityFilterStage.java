package uk.ac.sanger.nodule.stages;

import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;

/**
 * Filters the primer-trimmed reads on quality with fastp, which also writes
 * an HTML and a JSON report for each replicate.
 */

public class QualityFilterStage extends ExternalToolStage {
	public static final String NAME = "quality_filter";

	public QualityFilterStage() {
		super(NAME, TrimPrimerStage.NAME);
	}

	protected String getTool() {
		return "fastp";
	}

	protected List<String> buildCommand(PipelineContext context, PathLayout.Replicate replicate)
			throws StageException {
		PipelineConfiguration config = context.getConfiguration();
		PathLayout layout = context.getLayout();

		createDirectory(layout.getQualityFilterDirectory());
		createDirectory(layout.getFastpReportDirectory());

		List<String> command = new ArrayList<String>();

		command.add(config.getProperty(PipelineConfiguration.FASTP_COMMAND, "fastp"));
		command.add("-i");
		command.add(layout.getPrimerTrimmedReads(replicate, true).getPath());
		command.add("-I");
		command.add(layout.getPrimerTrimmedReads(replicate, false).getPath());
		command.add("-o");
		command.add(layout.getFilteredReads(replicate, true).getPath());
		command.add("-O");
		command.add(layout.getFilteredReads(replicate, false).getPath());
		command.add("-h");
		command.add(layout.getFastpReport(replicate, "html").getPath());
		command.add("-j");
		command.add(layout.getFastpReport(replicate, "json").getPath());
		command.addAll(config.getList(PipelineConfiguration.FASTP_PARAMS));

		return command;
	}
}
