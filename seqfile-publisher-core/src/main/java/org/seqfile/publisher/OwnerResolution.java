package org.seqfile.publisher;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of resolving a unit of work to its owning project.
 *
 * <p>
 * {@link Status#NOT_FOUND} means the LIMS answered but the chain artifact, sample,
 * project is incomplete; {@link Status#FAILED} means a lookup failed and the answer is
 * unknown.
 */
public record OwnerResolution(Status status, @Nullable Owner owner, @Nullable String reason) {

	public enum Status {

		FOUND, NOT_FOUND, FAILED

	}

	public OwnerResolution {
		Objects.requireNonNull(status, "status");
		if (status == Status.FOUND && owner == null) {
			throw new IllegalArgumentException("A found resolution requires an owner");
		}
		if (status != Status.FOUND && owner != null) {
			throw new IllegalArgumentException("Only a found resolution carries an owner");
		}
	}

	public static OwnerResolution found(Owner owner) {
		return new OwnerResolution(Status.FOUND, owner, null);
	}

	public static OwnerResolution notFound(String reason) {
		return new OwnerResolution(Status.NOT_FOUND, null, reason);
	}

	public static OwnerResolution failed(String reason) {
		return new OwnerResolution(Status.FAILED, null, reason);
	}

	public boolean isFound() {
		return status == Status.FOUND;
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

}
