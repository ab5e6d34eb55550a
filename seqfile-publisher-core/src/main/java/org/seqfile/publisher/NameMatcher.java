package org.seqfile.publisher;

import java.util.Collection;
import java.util.Optional;

/**
 * Two-tier, case-insensitive name matching between a unit name and file group
 * identifiers.
 *
 * <p>
 * The exact tier is tried first over all identifiers; only if it finds nothing does the
 * partial tier run, which accepts an identifier when either folded string contains the
 * other. Within a tier the first identifier in iteration order wins. Matching never
 * reserves an identifier, so several candidates may match the same one.
 */
public class NameMatcher {

	/**
	 * Match a candidate name against identifiers.
	 * @param candidate unit name
	 * @param identifiers file group identifiers in iteration order
	 * @return the matching identifier as given, or empty if none matches or the candidate
	 * is blank
	 */
	public Optional<String> match(String candidate, Collection<String> identifiers) {
		if (candidate.isBlank()) {
			return Optional.empty();
		}
		String folded = FileNames.fold(candidate);

		for (String identifier : identifiers) {
			if (FileNames.fold(identifier).equals(folded)) {
				return Optional.of(identifier);
			}
		}

		for (String identifier : identifiers) {
			String foldedIdentifier = FileNames.fold(identifier);
			if (foldedIdentifier.isEmpty()) {
				continue;
			}
			if (foldedIdentifier.contains(folded) || folded.contains(foldedIdentifier)) {
				return Optional.of(identifier);
			}
		}

		return Optional.empty();
	}

}
