package org.seqfile.publisher;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * All files from a sequencing archive that share one base name, e.g. {@code S1.ab1} and
 * {@code S1.seq}. The identifier keeps the case of the first file seen; every member's
 * base name equals it after {@link FileNames#fold(String) case folding}.
 */
public record FileGroup(String identifier, List<ArchiveMember> members) {

	public FileGroup {
		Objects.requireNonNull(identifier, "identifier");
		members = List.copyOf(members);
		String key = FileNames.fold(identifier);
		for (ArchiveMember member : members) {
			if (!FileNames.fold(FileNames.baseName(member.filename())).equals(key)) {
				throw new IllegalArgumentException(
						"Member '" + member.filename() + "' does not belong to file group '" + identifier + "'");
			}
		}
	}

	public int fileCount() {
		return members.size();
	}

	/**
	 * Comma separated extensions of the members in archive order, for log output.
	 */
	public String extensions() {
		return members.stream()
			.map(m -> FileNames.extension(m.filename()))
			.map(ext -> ext.isEmpty() ? "(none)" : ext)
			.collect(Collectors.joining(", "));
	}

}
