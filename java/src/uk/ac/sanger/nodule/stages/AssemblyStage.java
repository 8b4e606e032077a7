package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.assembly.AssemblyEngine;
import uk.ac.sanger.nodule.assembly.AssemblyMode;
import uk.ac.sanger.nodule.assembly.WellAssembler;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableException;
import uk.ac.sanger.nodule.data.ContigSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.pipeline.AbstractStage;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;
import uk.ac.sanger.nodule.pipeline.WellBatchResult;
import uk.ac.sanger.nodule.pipeline.WellTask;

/**
 * Assembles every well, either once from the reads of all replicates pooled
 * together, or once for each replicate. Wells are assembled in parallel and a
 * failure in one well does not stop the others.
 */

public class AssemblyStage extends AbstractStage {
	public static final String POOLED_NAME = "assemble_pooled";
	public static final String PER_REPLICATE_NAME = "assemble_per_replicate";

	private final AssemblyMode mode;

	public AssemblyStage(AssemblyMode mode) {
		super(mode == AssemblyMode.POOLED ? POOLED_NAME : PER_REPLICATE_NAME, DemultiplexStage.NAME);
		this.mode = mode;
	}

	public AssemblyMode getMode() {
		return mode;
	}

	public void execute(PipelineContext context) throws StageException {
		PipelineConfiguration config = context.getConfiguration();
		final PathLayout layout = context.getLayout();

		final WellAssembler assembler;
		BarcodeTable table;

		try {
			AssemblyEngine engine = config.getAssemblyEngine();

			assembler = new WellAssembler(context.getAssembler(), engine.getName(),
					config.getAssemblerParameters(engine), context.getLogger());

			table = context.getBarcodeTable();
		} catch (ConfigurationException ce) {
			throw new StageException(name, ce, "Stage " + name + " is not configured properly: " + ce.getMessage(),
					true);
		} catch (BarcodeTableException bte) {
			throw new StageException(name, bte, "Cannot load the barcode descriptor: " + bte.getMessage(), true);
		}

		final List<String> replicates = layout.getReplicateNames();

		List<WellTask<Integer>> tasks = new ArrayList<WellTask<Integer>>();

		for (Well well : table.getWells()) {
			tasks.add(new WellTask<Integer>(well) {
				public Integer run() throws Exception {
					File wellDirectory = layout.getWellDirectory(well);

					if (mode == AssemblyMode.POOLED) {
						ContigSet contigs = assembler.assemblePooled(well, wellDirectory, replicates);
						return contigs.size();
					}

					int total = 0;

					for (String replicate : replicates)
						total += assembler.assembleReplicate(well, wellDirectory, replicate).size();

					return total;
				}
			});
		}

		context.getLogger().info("Stage " + name + ": assembling " + tasks.size() + " wells with "
				+ context.getWorkerPool().getThreads() + " workers");

		WellBatchResult<Integer> batch = context.getWorkerPool().run(tasks);

		context.checkCancelled();

		int contigs = 0;

		for (Integer count : batch.getResults().values())
			contigs += count;

		context.getLogger().info("Stage " + name + ": " + contigs + " contigs from " + batch.getResults().size()
				+ " wells");

		batch.checkFailures(name);
	}
}
