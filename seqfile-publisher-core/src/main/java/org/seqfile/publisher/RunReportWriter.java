package org.seqfile.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes a JSON summary of a pipeline run: counters, per-unit outcome, published bundles,
 * errors and warnings. File contents are never included.
 */
public class RunReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

	private final ObjectMapper objectMapper;

	public RunReportWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Report layout as serialized.
	 */
	public record RunReport(String stepUri, Instant generatedAt, boolean dryRun, boolean success, int unitsConsidered,
			int groupsMatched, int filesAttached, List<UnitReport> units, List<BundleReport> bundles,
			List<String> errors, List<String> warnings) {
	}

	public record UnitReport(String id, String name, @Nullable String fileGroup, int fileCount,
			@Nullable String project, String ownerStatus, @Nullable String ownerReason) {
	}

	public record BundleReport(String project, String projectId, String filename, String fileId, int fileCount) {
	}

	public RunReport toReport(PipelineResult result, boolean dryRun) {
		List<UnitReport> units = result.matches().stream().map(RunReportWriter::toUnitReport).toList();
		List<BundleReport> bundles = result.bundles()
			.stream()
			.map(b -> new BundleReport(b.owner().name(), b.owner().id(), b.filename(), b.fileId(), b.fileCount()))
			.toList();
		ProcessingResult counts = result.result();
		return new RunReport(result.stepUri(), Instant.now(), dryRun, counts.success(), counts.unitsConsidered(),
				counts.groupsMatched(), counts.filesAttached(), units, bundles, counts.errors(), counts.warnings());
	}

	/**
	 * Write the report for a run.
	 * @param result pipeline result
	 * @param dryRun whether the run was a dry run
	 * @param target report file; parent directories are created
	 * @throws IOException if the file cannot be written
	 */
	public void write(PipelineResult result, boolean dryRun, Path target) throws IOException {
		Path parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		objectMapper.writeValue(target.toFile(), toReport(result, dryRun));
		logger.info("Wrote run report to {}", target);
	}

	private static UnitReport toUnitReport(Match match) {
		FileGroup group = match.group();
		Owner owner = match.owner();
		OwnerResolution resolution = match.resolution();
		return new UnitReport(match.unit().id(), match.unit().name(), group != null ? group.identifier() : null,
				group != null ? group.fileCount() : 0, owner != null ? owner.name() : null,
				resolution.status().name(), resolution.reason());
	}

}
