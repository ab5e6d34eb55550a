package org.seqfile.publisher;

import java.util.Objects;

/**
 * A single file read from, or destined for, an archive.
 *
 * @param filename entry name; for decomposed archives this is the name without any
 * directory prefix
 * @param data raw file content
 */
public record ArchiveMember(String filename, byte[] data) {

	public ArchiveMember {
		Objects.requireNonNull(filename, "filename");
		Objects.requireNonNull(data, "data");
	}

	public boolean isDirectory() {
		return filename.endsWith("/");
	}

	public int size() {
		return data.length;
	}

	@Override
	public String toString() {
		return "ArchiveMember[filename=" + filename + ", size=" + data.length + "]";
	}

}
