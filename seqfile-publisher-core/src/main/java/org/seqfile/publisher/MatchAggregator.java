package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Matches every unit of work to a file group and an owner, and folds the contributing
 * matches into one {@link Bundle} per owner.
 *
 * <p>
 * Matching and ownership resolution are independent per unit, so they run on a bounded
 * pool of {@code parallelism} threads. Results are joined in unit order and folded in a
 * single pass, which keeps bundle order and contents identical to a sequential run.
 *
 * <p>
 * Every unit yields exactly one {@link Match}, whatever its outcome. Resolution failures
 * never abort aggregation: they are recorded as errors and the unit is left out of every
 * bundle. Against an empty group pool no unit can match, so no no-match errors are
 * recorded; deciding whether that run had anything to do is left to the caller.
 */
public class MatchAggregator {

	private static final Logger logger = LoggerFactory.getLogger(MatchAggregator.class);

	private final OwnershipResolver resolver;

	private final NameMatcher matcher;

	private final int parallelism;

	public MatchAggregator(OwnershipResolver resolver, NameMatcher matcher) {
		this(resolver, matcher, 1);
	}

	public MatchAggregator(OwnershipResolver resolver, NameMatcher matcher, int parallelism) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1 (got: " + parallelism + ")");
		}
		this.resolver = resolver;
		this.matcher = matcher;
		this.parallelism = parallelism;
	}

	/**
	 * Match units against file groups and build per-owner bundles.
	 * @param units units of work in step order
	 * @param groups file groups in first-occurrence order
	 * @return matches, bundles and counters
	 */
	public AggregationResult aggregate(List<UnitOfWork> units, Map<String, FileGroup> groups) {
		if (groups.isEmpty()) {
			logger.info("No file groups to match; resolving owners of {} units only", units.size());
		}
		else {
			logger.info("Matching {} units against {} file groups", units.size(), groups.size());
		}
		List<Match> matches = evaluateAll(units, groups);
		return fold(units.size(), matches, groups);
	}

	private List<Match> evaluateAll(List<UnitOfWork> units, Map<String, FileGroup> groups) {
		if (parallelism == 1 || units.size() <= 1) {
			List<Match> matches = new ArrayList<>(units.size());
			for (UnitOfWork unit : units) {
				matches.add(evaluate(unit, groups));
			}
			return matches;
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, units.size()),
				new ResolverThreadFactory());
		try {
			List<CompletableFuture<Match>> futures = units.stream()
				.map(unit -> CompletableFuture.supplyAsync(() -> evaluate(unit, groups), executor))
				.toList();
			List<Match> matches = new ArrayList<>(units.size());
			for (CompletableFuture<Match> future : futures) {
				matches.add(join(future));
			}
			return matches;
		}
		finally {
			executor.shutdownNow();
		}
	}

	private Match evaluate(UnitOfWork unit, Map<String, FileGroup> groups) {
		Optional<String> identifier = matcher.match(unit.name(), groups.keySet());
		FileGroup group = identifier.map(groups::get).orElse(null);

		// resolution runs even without a group so that ownership problems are reported
		OwnerResolution resolution;
		try {
			resolution = resolver.resolve(unit);
		}
		catch (ResolutionException e) {
			logger.error("Owner resolution failed for {} ({}): {}", unit.name(), unit.id(), e.getMessage());
			resolution = OwnerResolution.failed(e.getMessage());
		}

		return new Match(unit, group, resolution);
	}

	private AggregationResult fold(int unitCount, List<Match> matches, Map<String, FileGroup> groups) {
		Map<String, Owner> owners = new LinkedHashMap<>();
		Map<String, List<ArchiveMember>> filesByOwner = new LinkedHashMap<>();
		Set<String> matchedIdentifiers = new LinkedHashSet<>();
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		int contributing = 0;

		for (Match match : matches) {
			UnitOfWork unit = match.unit();
			FileGroup group = match.group();
			OwnerResolution resolution = match.resolution();

			if (group == null && groups.isEmpty()) {
				logger.debug("{} -> no file groups", unit.name());
			}
			else if (group == null) {
				logger.error("{} -> NO MATCH", unit.name());
				errors.add("No file group matches unit " + unit.name() + " (" + unit.id() + ")");
			}
			else {
				matchedIdentifiers.add(group.identifier());
				logger.info("{} -> {} ({} files: {})", unit.name(), group.identifier(), group.fileCount(),
						group.extensions());
			}

			if (resolution.isFailed()) {
				errors.add("Owner resolution failed for unit " + unit.name() + " (" + unit.id() + "): "
						+ resolution.reason());
			}
			else if (!resolution.isFound()) {
				warnings.add("No owner for unit " + unit.name() + " (" + unit.id() + "): " + resolution.reason());
			}

			if (match.contributes()) {
				Owner owner = resolution.owner();
				contributing++;
				owners.putIfAbsent(owner.id(), owner);
				filesByOwner.computeIfAbsent(owner.id(), id -> new ArrayList<>()).addAll(group.members());
			}
		}

		List<String> unmatched = new ArrayList<>();
		for (String identifier : groups.keySet()) {
			if (!matchedIdentifiers.contains(identifier)) {
				unmatched.add(identifier);
				warnings.add("File group " + identifier + " was not matched by any unit");
			}
		}
		if (!unmatched.isEmpty()) {
			logger.warn("Unmatched file groups: {}", unmatched);
		}

		List<Bundle> bundles = new ArrayList<>();
		int queued = 0;
		for (Map.Entry<String, Owner> entry : owners.entrySet()) {
			Bundle bundle = new Bundle(entry.getValue(), filesByOwner.get(entry.getKey()));
			queued += bundle.fileCount();
			bundles.add(bundle);
			logger.info("Project {} ({}): {} files queued", bundle.owner().name(), bundle.owner().id(),
					bundle.fileCount());
		}

		ProcessingResult result = new ProcessingResult(unitCount, contributing, queued, errors, warnings);
		return new AggregationResult(matches, bundles, unmatched, result);
	}

	private static Match join(CompletableFuture<Match> future) {
		try {
			return future.join();
		}
		catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException cause) {
				throw cause;
			}
			throw e;
		}
	}

	private static final class ResolverThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "owner-resolver-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
