package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a unit of work to the project that owns it by following artifact, sample,
 * project.
 *
 * <p>
 * An incomplete chain (no sample, no project, or a record the LIMS reports as not found)
 * is a normal outcome and yields {@link OwnerResolution#notFound(String)}. Any other
 * failure means the answer is unknown and is raised as a {@link ResolutionException}.
 * Each call performs fresh lookups and has no side effects.
 */
public class OwnershipResolver {

	private static final Logger logger = LoggerFactory.getLogger(OwnershipResolver.class);

	private final LimsService limsService;

	public OwnershipResolver(LimsService limsService) {
		this.limsService = limsService;
	}

	/**
	 * Resolve the owner of a unit of work.
	 * @param unit the unit to resolve
	 * @return the owner, or a not-found resolution with the reason
	 * @throws ResolutionException if a lookup fails for any reason other than not found
	 */
	public OwnerResolution resolve(UnitOfWork unit) {
		String stage = "artifact";
		String uri = unit.uri();
		try {
			ArtifactRecord artifact = limsService.getArtifact(uri);
			if (artifact.sample() == null) {
				logger.warn("No sample found for artifact {} ({})", unit.name(), unit.id());
				return OwnerResolution.notFound("no sample");
			}

			stage = "sample";
			uri = artifact.sample().uri();
			SampleRecord sample = limsService.getSample(uri);
			if (sample.project() == null) {
				logger.warn("No project found for sample {} of artifact {}", sample.id(), unit.name());
				return OwnerResolution.notFound("no project");
			}

			stage = "project";
			uri = sample.project().uri();
			ProjectRecord project = limsService.getProject(uri);
			Owner owner = project.toOwner();
			logger.debug("Artifact {} ({}) belongs to project {} ({})", unit.name(), unit.id(), owner.name(),
					owner.id());
			return OwnerResolution.found(owner);
		}
		catch (ClarityApiException e) {
			if (e.isNotFound()) {
				logger.warn("{} not found while resolving {}: {}", stage, unit.name(), uri);
				return OwnerResolution.notFound(stage + " not found: " + uri);
			}
			throw new ResolutionException(unit.id(),
					"Could not read " + stage + " " + uri + " for " + unit.name() + ": " + e.getMessage(), e);
		}
		catch (RecordParseException e) {
			throw new ResolutionException(unit.id(),
					"Unreadable " + stage + " " + uri + " for " + unit.name() + ": " + e.getMessage(), e);
		}
	}

}
