package org.seqfile.publisher;

import java.util.List;
import java.util.Objects;

/**
 * Files destined for one owner, in match order. Files with the same name are all kept,
 * and all of them are archived.
 */
public record Bundle(Owner owner, List<ArchiveMember> files) {

	public Bundle {
		Objects.requireNonNull(owner, "owner");
		files = List.copyOf(files);
	}

	public int fileCount() {
		return files.size();
	}

}
