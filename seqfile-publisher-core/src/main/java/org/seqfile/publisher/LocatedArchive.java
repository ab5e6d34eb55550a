package org.seqfile.publisher;

/**
 * A sequencing archive downloaded from the LIMS.
 */
public record LocatedArchive(String fileId, String fileUri, String name, byte[] data) {

	@Override
	public String toString() {
		return "LocatedArchive[fileId=" + fileId + ", name=" + name + ", size=" + data.length + "]";
	}

}
