package uk.ac.sanger.nodule.stages;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

import uk.ac.sanger.nodule.ConfigurationException;
import uk.ac.sanger.nodule.PipelineConfiguration;
import uk.ac.sanger.nodule.barcode.BarcodeTable;
import uk.ac.sanger.nodule.barcode.BarcodeTableException;
import uk.ac.sanger.nodule.data.Contig;
import uk.ac.sanger.nodule.data.ConsensusCall;
import uk.ac.sanger.nodule.data.HomologyHit;
import uk.ac.sanger.nodule.data.HomologyResultSet;
import uk.ac.sanger.nodule.data.Well;
import uk.ac.sanger.nodule.demultiplex.WellFiles;
import uk.ac.sanger.nodule.fasta.FastaFileReader;
import uk.ac.sanger.nodule.homology.ConsensusResolver;
import uk.ac.sanger.nodule.homology.HomologySearcher;
import uk.ac.sanger.nodule.pipeline.AbstractStage;
import uk.ac.sanger.nodule.pipeline.PathLayout;
import uk.ac.sanger.nodule.pipeline.PipelineContext;
import uk.ac.sanger.nodule.pipeline.StageException;
import uk.ac.sanger.nodule.pipeline.WellBatchResult;
import uk.ac.sanger.nodule.pipeline.WellTask;
import uk.ac.sanger.nodule.report.CallReportRow;
import uk.ac.sanger.nodule.report.CallReportWriter;
import uk.ac.sanger.nodule.report.ReportFilter;

/**
 * Searches the contigs of every well against the reference database, makes a
 * call for each well and writes the call report.
 * <p>
 * In <code>auto</code> mode, a run with more than one replicate uses the
 * per-replicate contigs and calls by agreement between the replicates, and a
 * run with a single replicate uses the pooled contigs.
 */

public class HomologySearchStage extends AbstractStage {
	public static final String NAME = "homology_search";

	public static final String MODE_AUTO = "auto";
	public static final String MODE_POOLED = "pooled";
	public static final String MODE_PER_REPLICATE = "per_replicate";

	public HomologySearchStage() {
		super(NAME, AssemblyStage.POOLED_NAME, AssemblyStage.PER_REPLICATE_NAME);
	}

	public void execute(PipelineContext context) throws StageException {
		PipelineConfiguration config = context.getConfiguration();
		final PathLayout layout = context.getLayout();
		Logger logger = context.getLogger();

		final boolean perReplicate = usePerReplicateContigs(config, layout);
		final List<String> params = config.getList(PipelineConfiguration.BLAST_PARAMS);
		final HomologySearcher searcher = context.getHomologySearcher();
		final ConsensusResolver resolver = new ConsensusResolver(logger);

		Predicate<CallReportRow> filter = getFilter(config);

		BarcodeTable table;

		try {
			table = context.getBarcodeTable();
		} catch (ConfigurationException ce) {
			throw new StageException(name, ce, "The barcode descriptor is not configured: " + ce.getMessage(), true);
		} catch (BarcodeTableException bte) {
			throw new StageException(name, bte, "Cannot load the barcode descriptor: " + bte.getMessage(), true);
		}

		logger.info("Stage " + name + ": searching " + (perReplicate ? "per-replicate" : "pooled") + " contigs of "
				+ table.size() + " wells");

		List<WellTask<Optional<CallReportRow>>> tasks = new ArrayList<WellTask<Optional<CallReportRow>>>();

		for (Well well : table.getWells()) {
			tasks.add(new WellTask<Optional<CallReportRow>>(well) {
				public Optional<CallReportRow> run() throws Exception {
					return searchWell(well, layout, perReplicate, searcher, params, resolver);
				}
			});
		}

		WellBatchResult<Optional<CallReportRow>> batch = context.getWorkerPool().run(tasks);

		context.checkCancelled();

		List<CallReportRow> rows = new ArrayList<CallReportRow>();

		for (Optional<CallReportRow> row : batch.getResults().values())
			if (row.isPresent())
				rows.add(row.get());

		logger.info("Stage " + name + ": " + rows.size() + " of " + table.size() + " wells received a call");

		File reportFile = layout.getReportFile(config.getProperty(PipelineConfiguration.REPORT_FILENAME, "result.csv"));

		try {
			new CallReportWriter(logger).write(reportFile, rows, filter);
		} catch (IOException ioe) {
			throw new StageException(name, ioe, "Failed to write the call report " + reportFile.getPath());
		}

		batch.checkFailures(name);
	}

	protected boolean usePerReplicateContigs(PipelineConfiguration config, PathLayout layout) throws StageException {
		String mode = config.getProperty(PipelineConfiguration.HOMOLOGY_MODE, MODE_AUTO);

		if (mode.equalsIgnoreCase(MODE_AUTO))
			return layout.getReplicates().size() > 1;
		else if (mode.equalsIgnoreCase(MODE_POOLED))
			return false;
		else if (mode.equalsIgnoreCase(MODE_PER_REPLICATE))
			return true;
		else
			throw new StageException(name, null, "Unknown homology mode \"" + mode + "\": expected " + MODE_AUTO + ", "
					+ MODE_POOLED + " or " + MODE_PER_REPLICATE, true);
	}

	private Predicate<CallReportRow> getFilter(PipelineConfiguration config) throws StageException {
		String expression = config.getProperty(PipelineConfiguration.REPORT_FILTER);

		if (expression == null || expression.isEmpty())
			return null;

		try {
			return ReportFilter.parse(expression);
		} catch (IllegalArgumentException iae) {
			throw new StageException(name, iae, "Invalid report filter: " + iae.getMessage(), true);
		}
	}

	protected Optional<CallReportRow> searchWell(Well well, PathLayout layout, boolean perReplicate,
			HomologySearcher searcher, List<String> params, ConsensusResolver resolver) throws Exception {
		File wellDirectory = layout.getWellDirectory(well);

		List<File> queryFiles = new ArrayList<File>();

		if (perReplicate) {
			for (String replicate : layout.getReplicateNames())
				queryFiles.add(WellFiles.getReplicateContigs(wellDirectory, replicate));
		} else
			queryFiles.add(WellFiles.getPooledContigs(wellDirectory));

		FastaFileReader reader = new FastaFileReader();

		List<HomologyResultSet> resultSets = new ArrayList<HomologyResultSet>();
		Map<String, Integer> queryCounts = new HashMap<String, Integer>();

		for (File queryFile : queryFiles) {
			// An empty file means the assembler found nothing; a missing one means it never ran.
			if (!queryFile.isFile())
				throw new FileNotFoundException("Well " + well.getCode() + " has no contigs file " + queryFile.getPath());

			List<Contig> contigs = reader.readContigs(queryFile);

			queryCounts.put(queryFile.getPath(), contigs.size());

			List<HomologyHit> hits = contigs.isEmpty() ? new ArrayList<HomologyHit>() : searcher.search(queryFile, params);

			resultSets.add(HomologyResultSet.fromHits(queryFile.getPath(), contigs, hits));
		}

		Optional<ConsensusCall> call = perReplicate ? resolver.resolveMulti(resultSets)
				: resolver.resolveSingle(resultSets.get(0));

		if (!call.isPresent())
			return Optional.empty();

		int queryCount = 0;

		for (String file : call.get().getQueryFiles()) {
			Integer count = queryCounts.get(file);

			if (count != null)
				queryCount += count;
		}

		return Optional.of(new CallReportRow(well, call.get(), countReads(wellDirectory, layout), queryCount));
	}

	private long countReads(File wellDirectory, PathLayout layout) throws IOException {
		File pooled = WellFiles.getPooledForwardReads(wellDirectory);

		if (pooled.exists())
			return WellFiles.countFastqRecords(pooled);

		long count = 0;

		for (String replicate : layout.getReplicateNames())
			count += WellFiles.countFastqRecords(WellFiles.getForwardReads(wellDirectory, replicate));

		return count;
	}
}
