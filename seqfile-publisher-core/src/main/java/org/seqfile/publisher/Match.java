package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Matching and ownership outcome for one unit of work.
 *
 * @param unit the unit
 * @param group the file group its name matched, if any
 * @param resolution the owner resolution
 */
public record Match(UnitOfWork unit, @Nullable FileGroup group, OwnerResolution resolution) {

	public Match {
		Objects.requireNonNull(unit, "unit");
		Objects.requireNonNull(resolution, "resolution");
	}

	public @Nullable Owner owner() {
		return resolution.owner();
	}

	/**
	 * Whether this match puts files into a bundle: it has both a file group and an owner.
	 */
	public boolean contributes() {
		return group != null && resolution.isFound();
	}

}
