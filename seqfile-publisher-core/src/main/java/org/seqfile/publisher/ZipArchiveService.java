package org.seqfile.publisher;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * ZIP implementation of {@link ArchiveService} backed by Commons Compress.
 *
 * <p>
 * Reads and writes ZIP archives entirely in memory. Written entries are deflated and
 * named in UTF-8. Entry names read without the UTF-8 flag are decoded as CP437, the ZIP
 * default used by most instrument and Windows tools. Duplicate entry names are written
 * as separate entries.
 */
public class ZipArchiveService implements ArchiveService {

	private static final Logger logger = LoggerFactory.getLogger(ZipArchiveService.class);

	static final String LEGACY_NAME_ENCODING = "Cp437";

	@Override
	public List<ArchiveMember> readEntries(byte[] archive) {
		// a streaming reader reports no entries for arbitrary bytes instead of failing
		if (!hasZipSignature(archive)) {
			throw new ArchiveException("Not a ZIP archive (" + archive.length + " bytes, no ZIP signature)");
		}
		if (isEmptyArchive(archive)) {
			logger.debug("ZIP archive has no entries");
			return List.of();
		}

		List<ArchiveMember> entries = new ArrayList<>();
		try (ZipArchiveInputStream zis = new ZipArchiveInputStream(new ByteArrayInputStream(archive),
				LEGACY_NAME_ENCODING, true, true)) {
			ZipArchiveEntry entry;
			while ((entry = zis.getNextEntry()) != null) {
				if (!zis.canReadEntryData(entry)) {
					throw new ArchiveException("Unsupported compression or encryption for entry " + entry.getName());
				}
				byte[] data = entry.isDirectory() ? new byte[0] : zis.readAllBytes();
				entries.add(new ArchiveMember(entry.getName(), data));
			}
		}
		catch (IOException | IllegalArgumentException e) {
			throw new ArchiveException("Failed to read ZIP archive: " + e.getMessage(), e);
		}

		logger.debug("Read {} entries from ZIP archive ({} bytes)", entries.size(), archive.length);
		return entries;
	}

	@Override
	public byte[] createArchive(List<ArchiveMember> members) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(out)) {
			zos.setEncoding(StandardCharsets.UTF_8.name());
			zos.setMethod(ZipArchiveOutputStream.DEFLATED);
			for (ArchiveMember member : members) {
				ZipArchiveEntry entry = new ZipArchiveEntry(member.filename());
				entry.setSize(member.data().length);
				zos.putArchiveEntry(entry);
				zos.write(member.data());
				zos.closeArchiveEntry();
			}
			zos.finish();
		}
		catch (IOException e) {
			throw new ArchiveException("Failed to create ZIP archive: " + e.getMessage(), e);
		}

		byte[] bytes = out.toByteArray();
		logger.debug("Created ZIP archive with {} entries ({} bytes)", members.size(), bytes.length);
		return bytes;
	}

	private static boolean hasZipSignature(byte[] archive) {
		if (archive.length < 4 || archive[0] != 'P' || archive[1] != 'K') {
			return false;
		}
		// local file header, or end of central directory for an empty archive
		return (archive[2] == 3 && archive[3] == 4) || isEmptyArchive(archive);
	}

	private static boolean isEmptyArchive(byte[] archive) {
		return archive[2] == 5 && archive[3] == 6;
	}

}
