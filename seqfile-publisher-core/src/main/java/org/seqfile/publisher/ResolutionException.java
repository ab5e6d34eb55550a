package org.seqfile.publisher;

/**
 * Thrown when a unit's owning project could not be determined because a lookup failed
 * for a reason other than the record not existing (authentication, server error,
 * unreadable record).
 */
public class ResolutionException extends RuntimeException {

	private final String unitId;

	public ResolutionException(String unitId, String message, Throwable cause) {
		super(message, cause);
		this.unitId = unitId;
	}

	public String getUnitId() {
		return unitId;
	}

}
