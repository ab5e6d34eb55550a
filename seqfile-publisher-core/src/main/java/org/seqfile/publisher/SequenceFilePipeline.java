package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole distribution for one step: load the step and its inputs, locate and
 * decompose the archives, match and aggregate, build one archive per project, publish,
 * and optionally notify each project's researcher.
 *
 * <p>
 * Only a step that cannot be read aborts the run, with a {@link StepRetrievalException}.
 * Every other failure is recorded in the {@link ProcessingResult} and the run carries on
 * with whatever is left.
 */
public class SequenceFilePipeline {

	private static final Logger logger = LoggerFactory.getLogger(SequenceFilePipeline.class);

	private final LimsService limsService;

	private final ArchiveLocator archiveLocator;

	private final ArchiveDecomposer decomposer;

	private final MatchAggregator aggregator;

	private final BundleBuilder bundleBuilder;

	private final BundlePublisher publisher;

	private final @Nullable NotificationService notificationService;

	public SequenceFilePipeline(LimsService limsService, ArchiveLocator archiveLocator, ArchiveDecomposer decomposer,
			MatchAggregator aggregator, BundleBuilder bundleBuilder, BundlePublisher publisher,
			@Nullable NotificationService notificationService) {
		this.limsService = limsService;
		this.archiveLocator = archiveLocator;
		this.decomposer = decomposer;
		this.aggregator = aggregator;
		this.bundleBuilder = bundleBuilder;
		this.publisher = publisher;
		this.notificationService = notificationService;
	}

	/**
	 * Run the pipeline.
	 * @param request step and options
	 * @return matches, published bundles and the merged result
	 * @throws StepRetrievalException if the step or its input artifacts cannot be read
	 */
	public PipelineResult run(PipelineRequest request) {
		String stepUri = request.stepUri();
		logger.info("Processing step {}{}", stepUri, request.dryRun() ? " (dry run)" : "");

		StepDetails step = loadStep(stepUri);
		List<UnitOfWork> units = loadUnits(step);
		logger.info("Step has {} input-output maps for {} unique inputs", step.mappings().size(), units.size());

		ArchiveLocator.ArchiveSearch search = archiveLocator.locate(step, request.zipArtifactId());
		ProcessingResult result = new ProcessingResult(0, 0, 0, search.errors(), List.of());
		if (search.archives().isEmpty()) {
			if (search.errors().isEmpty()) {
				logger.warn("No archive found for step {}; nothing to do", stepUri);
			}
			else {
				result = result.withUnitsConsidered(units.size());
			}
			return finish(new PipelineResult(stepUri, List.of(), List.of(), result));
		}

		List<Map<String, FileGroup>> decomposed = new ArrayList<>();
		for (LocatedArchive archive : search.archives()) {
			try {
				decomposed.add(decomposer.decompose(archive.data()));
			}
			catch (ArchiveException e) {
				logger.error("Skipping unreadable archive {}: {}", archive.name(), e.getMessage());
				result = result.withError("Archive " + archive.name() + " (" + archive.fileId() + ") is unreadable: "
						+ e.getMessage());
			}
		}
		Map<String, FileGroup> groups = ArchiveDecomposer.merge(decomposed);

		AggregationResult aggregation = aggregator.aggregate(units, groups);
		ProcessingResult aggregated = aggregation.result();
		if (groups.isEmpty() && result.errorCount() == 0) {
			// an archive without sequencing files leaves nothing to process
			logger.warn("Archive for step {} holds no sequencing files; nothing to do", stepUri);
			aggregated = aggregated.withUnitsConsidered(0);
		}
		// files count once delivered, or once archived in a dry run
		result = result.merge(aggregated.withFilesAttached(0));

		List<BundleArchive> archives = new ArrayList<>();
		for (Bundle bundle : aggregation.bundles()) {
			try {
				BundleArchive archive = bundleBuilder.build(bundle);
				archives.add(archive);
				for (String duplicate : archive.duplicateNames()) {
					result = result.withWarning("File name " + duplicate + " occurs more than once in "
							+ archive.filename());
				}
			}
			catch (ArchiveException e) {
				logger.error("Could not build bundle for project {}: {}", bundle.owner().name(), e.getMessage());
				result = result.withError("Bundle for project " + bundle.owner().name() + " (" + bundle.owner().id()
						+ ") could not be written: " + e.getMessage());
			}
		}

		PublishReport report = publisher.publish(archives, request.dryRun());
		result = result.merge(report.result());
		if (request.dryRun()) {
			int archived = archives.stream().mapToInt(BundleArchive::fileCount).sum();
			result = result.withFilesAttached(result.filesAttached() + archived);
		}

		if (request.sendEmails()) {
			if (request.dryRun()) {
				logger.info("DRY RUN: email notifications skipped");
			}
			else {
				result = notifyResearchers(report.published(), archives, result);
			}
		}

		return finish(new PipelineResult(stepUri, aggregation.matches(), report.published(), result));
	}

	private ProcessingResult notifyResearchers(List<PublishedBundle> published, List<BundleArchive> archives,
			ProcessingResult result) {
		if (notificationService == null) {
			logger.warn("Email notifications requested but no notification service is configured");
			return result.withWarning("Email notifications requested but no notification service is configured");
		}

		Map<String, List<String>> fileNamesByOwner = new HashMap<>();
		for (BundleArchive archive : archives) {
			fileNamesByOwner.put(archive.owner().id(), archive.fileNames());
		}

		int sent = 0;
		for (PublishedBundle bundle : published) {
			try {
				notificationService.notifyPublished(bundle,
						fileNamesByOwner.getOrDefault(bundle.owner().id(), List.of()));
				sent++;
			}
			catch (NotificationException e) {
				logger.error("Could not notify researcher of project {}: {}", bundle.owner().name(), e.getMessage());
				result = result.withError("Notification for " + bundle.filename() + " (project " + bundle.owner().id()
						+ ") failed: " + e.getMessage());
			}
		}
		logger.info("Email notifications sent: {}/{}", sent, published.size());
		return result;
	}

	private StepDetails loadStep(String stepUri) {
		try {
			return limsService.getStepDetails(stepUri);
		}
		catch (ClarityApiException | RecordParseException e) {
			throw new StepRetrievalException(stepUri, "Could not read step " + stepUri + ": " + e.getMessage(), e);
		}
	}

	private List<UnitOfWork> loadUnits(StepDetails step) {
		List<UnitOfWork> units = new ArrayList<>();
		for (Map.Entry<String, String> input : step.distinctInputs().entrySet()) {
			try {
				ArtifactRecord artifact = limsService.getArtifact(input.getValue());
				units.add(new UnitOfWork(input.getKey(), artifact.name(), input.getValue()));
			}
			catch (ClarityApiException | RecordParseException e) {
				throw new StepRetrievalException(step.stepUri(),
						"Could not read input artifact " + input.getKey() + ": " + e.getMessage(), e);
			}
		}
		return units;
	}

	private PipelineResult finish(PipelineResult pipelineResult) {
		ProcessingResult result = pipelineResult.result();
		logger.info("");
		logger.info("=== SUMMARY ===");
		logger.info("Step: {}", pipelineResult.stepUri());
		logger.info("Units considered: {}", result.unitsConsidered());
		logger.info("Groups matched: {}", result.groupsMatched());
		logger.info("Files attached: {}", result.filesAttached());
		logger.info("Bundles published: {}", pipelineResult.bundles().size());
		for (String warning : result.warnings()) {
			logger.warn("  warning: {}", warning);
		}
		if (result.errors().isEmpty()) {
			logger.info("Errors: none");
		}
		else {
			logger.error("Errors ({}):", result.errorCount());
			for (String error : result.errors()) {
				logger.error("  - {}", error);
			}
		}
		logger.info("Status: {}", result.success() ? "SUCCESS" : "FAILED");
		return pipelineResult;
	}

}
