package org.seqfile.publisher;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small in-memory ZIP archives for tests.
 */
final class TestArchives {

	private TestArchives() {
	}

	/**
	 * Create a ZIP whose entries hold their own name as content. Names ending with
	 * {@code /} become directory entries.
	 */
	static byte[] zip(String... entryNames) {
		return zip(StandardCharsets.UTF_8, entryNames);
	}

	/**
	 * Create a ZIP with entry names encoded in the given charset. Only UTF-8 names are
	 * flagged as UTF-8.
	 */
	static byte[] zip(Charset nameCharset, String... entryNames) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (ZipOutputStream zos = new ZipOutputStream(out, nameCharset)) {
			for (String name : entryNames) {
				zos.putNextEntry(new ZipEntry(name));
				if (!name.endsWith("/")) {
					zos.write(name.getBytes(StandardCharsets.UTF_8));
				}
				zos.closeEntry();
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out.toByteArray();
	}

	static ArchiveMember member(String filename) {
		return new ArchiveMember(filename, filename.getBytes(StandardCharsets.UTF_8));
	}

	static FileGroup group(String identifier, String... filenames) {
		return new FileGroup(identifier, Arrays.stream(filenames).map(TestArchives::member).toList());
	}

}
