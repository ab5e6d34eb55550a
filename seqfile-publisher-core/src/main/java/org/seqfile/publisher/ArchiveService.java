package org.seqfile.publisher;

import java.util.List;

/**
 * Service interface for reading and writing in-memory archives.
 *
 * <p>
 * Abstracts the archive codec so that decomposition and bundling can be tested with
 * fakes and so that the codec is the only place that touches the compression API.
 */
public interface ArchiveService {

	/**
	 * Read every entry of an archive in archive order.
	 * @param archive raw archive bytes
	 * @return entries with their full in-archive paths; directory entries end with
	 * {@code /} and carry no data
	 * @throws ArchiveException if the bytes are not a readable archive
	 */
	List<ArchiveMember> readEntries(byte[] archive);

	/**
	 * Create an archive containing the given members under their filenames.
	 * @param members files to include; filenames must be unique
	 * @return raw archive bytes
	 * @throws ArchiveException if the archive cannot be written
	 */
	byte[] createArchive(List<ArchiveMember> members);

}
