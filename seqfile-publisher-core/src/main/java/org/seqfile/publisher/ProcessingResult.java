package org.seqfile.publisher;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters and messages for a run or a stage of a run.
 *
 * <p>
 * Each stage returns its own result and the orchestrator combines them with
 * {@link #merge(ProcessingResult)}.
 *
 * @param unitsConsidered units of work examined
 * @param groupsMatched matches that had both a file group and an owner
 * @param filesAttached files queued for, or delivered in, published bundles
 * @param errors no-match, resolution, archive and upload failures
 * @param warnings conditions worth reporting that do not count as failures
 */
public record ProcessingResult(int unitsConsidered, int groupsMatched, int filesAttached, List<String> errors,
		List<String> warnings) {

	public ProcessingResult {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	public static ProcessingResult empty() {
		return new ProcessingResult(0, 0, 0, List.of(), List.of());
	}

	/**
	 * A run succeeds when it attached at least one file or had nothing to process.
	 */
	public boolean success() {
		return filesAttached > 0 || unitsConsidered == 0;
	}

	public int errorCount() {
		return errors.size();
	}

	public ProcessingResult merge(ProcessingResult other) {
		return new ProcessingResult(unitsConsidered + other.unitsConsidered, groupsMatched + other.groupsMatched,
				filesAttached + other.filesAttached, concat(errors, other.errors), concat(warnings, other.warnings));
	}

	public ProcessingResult withUnitsConsidered(int units) {
		return new ProcessingResult(units, groupsMatched, filesAttached, errors, warnings);
	}

	public ProcessingResult withFilesAttached(int files) {
		return new ProcessingResult(unitsConsidered, groupsMatched, files, errors, warnings);
	}

	public ProcessingResult withError(String error) {
		return new ProcessingResult(unitsConsidered, groupsMatched, filesAttached, concat(errors, List.of(error)),
				warnings);
	}

	public ProcessingResult withWarning(String warning) {
		return new ProcessingResult(unitsConsidered, groupsMatched, filesAttached, errors,
				concat(warnings, List.of(warning)));
	}

	private static List<String> concat(List<String> first, List<String> second) {
		List<String> all = new ArrayList<>(first.size() + second.size());
		all.addAll(first);
		all.addAll(second);
		return all;
	}

}
