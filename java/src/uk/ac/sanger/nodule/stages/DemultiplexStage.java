package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableException;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.demultiplex.DemultiplexResult;
import uk.ac.sanger.nodule.demultiplex.Demultiplexer;
import uk.ac.sanger.nodule.demultiplex.OccupancyReport;
import uk.ac.sanger.nodule.demultiplex.ReadPairCountMismatchException;
import uk.ac.sanger.nodule.demultiplex.WellFileWriter;
import uk.ac.sanger.nodule.pipeline.AbstractStage;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;
import uk.ac.sanger.nodule.pipeline.WellBatchResult;
import uk.ac.sanger.nodule.pipeline.WellTask;

/**
 * Splits the filtered reads of each replicate into the well directories and
 * reports how many read pairs each well received.
 */

public class DemultiplexStage extends AbstractStage {
	public static final String NAME = "demultiplex";

	private final WellFileWriter writer = new WellFileWriter();

	public DemultiplexStage() {
		super(NAME, QualityFilterStage.NAME);
	}

	public void execute(PipelineContext context) throws StageException {
		Logger logger = context.getLogger();
		PathLayout layout = context.getLayout();

		BarcodeTable table;

		try {
			table = context.getBarcodeTable();
		} catch (ConfigurationException ce) {
			throw new StageException(name, ce, "The barcode descriptor is not configured: " + ce.getMessage(), true);
		} catch (BarcodeTableException bte) {
			throw new StageException(name, bte, "Cannot load the barcode descriptor: " + bte.getMessage(), true);
		}

		Demultiplexer demultiplexer = new Demultiplexer(table, logger);

		for (PathLayout.Replicate replicate : layout.getReplicates()) {
			context.checkCancelled();

			File forward = layout.getFilteredReads(replicate, true);
			File reverse = layout.getFilteredReads(replicate, false);

			DemultiplexResult result;

			try {
				result = demultiplexer.demultiplex(forward, reverse);
			} catch (ReadPairCountMismatchException rpcme) {
				throw new StageException(name, rpcme, rpcme.getMessage(), true);
			} catch (IOException ioe) {
				throw new StageException(name, ioe, "Failed to read the filtered reads of replicate "
						+ replicate.getName() + ": " + ioe.getMessage());
			}

			OccupancyReport report = new OccupancyReport(result);

			String text = report.format();

			logger.info("Occupancy of replicate " + replicate.getName() + ":\n" + text);

			try {
				writeText(layout.getOccupancyReport(replicate), text);
			} catch (IOException ioe) {
				throw new StageException(name, ioe, "Failed to write the occupancy report of replicate "
						+ replicate.getName());
			}

			writeWells(context, replicate.getName(), result);
		}
	}

	private void writeWells(PipelineContext context, final String replicate, final DemultiplexResult result)
			throws StageException {
		final PathLayout layout = context.getLayout();

		List<WellTask<Integer>> tasks = new ArrayList<WellTask<Integer>>();

		for (Well well : result.getWells()) {
			tasks.add(new WellTask<Integer>(well) {
				public Integer run() throws IOException {
					writer.write(layout.getWellDirectory(well), replicate, result.getReadPairs(well));
					return result.getCount(well);
				}
			});
		}

		WellBatchResult<Integer> batch = context.getWorkerPool().run(tasks);

		context.checkCancelled();

		batch.checkFailures(name);
	}

	private void writeText(File file, String text) throws IOException {
		Writer w = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);

		try {
			w.write(text);
		} finally {
			w.close();
		}
	}
}
