package org.seqfile.publisher;

import java.util.List;
import java.util.Objects;

/**
 * A bundle written as an archive, ready for upload.
 *
 * @param owner destination project
 * @param filename archive file name, e.g. {@code P1_sequencing_files.zip}
 * @param data archive bytes
 * @param fileNames names of the entries written, in bundle order
 * @param duplicateNames names written more than once, each listed once
 */
public record BundleArchive(Owner owner, String filename, byte[] data, List<String> fileNames,
		List<String> duplicateNames) {

	public BundleArchive {
		Objects.requireNonNull(owner, "owner");
		Objects.requireNonNull(filename, "filename");
		Objects.requireNonNull(data, "data");
		fileNames = List.copyOf(fileNames);
		duplicateNames = List.copyOf(duplicateNames);
	}

	public int fileCount() {
		return fileNames.size();
	}

	@Override
	public String toString() {
		return "BundleArchive[owner=" + owner.id() + ", filename=" + filename + ", size=" + data.length
				+ ", fileCount=" + fileNames.size() + ", duplicateNames=" + duplicateNames + "]";
	}

}
