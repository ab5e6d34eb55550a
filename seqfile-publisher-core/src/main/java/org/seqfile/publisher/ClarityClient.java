package org.seqfile.publisher;

/**
 * Interface for LIMS REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the Clarity REST API, enabling testability and decorator
 * implementations (retrying, logging). URIs may be absolute or relative to the API root
 * (e.g. {@code "files"} or {@code "glsstorage"}).
 */
public interface ClarityClient {

	/**
	 * Execute a GET request expecting an XML document.
	 * @param uri absolute URI or path relative to the API root
	 * @return response body
	 * @throws ClarityApiException if the request fails
	 */
	String get(String uri);

	/**
	 * Execute a GET request expecting binary content, e.g. a file download.
	 * @param uri absolute URI or path relative to the API root
	 * @return response body bytes
	 * @throws ClarityApiException if the request fails
	 */
	byte[] getBytes(String uri);

	/**
	 * POST an XML document.
	 * @param uri absolute URI or path relative to the API root
	 * @param xml request body
	 * @return response body
	 * @throws ClarityApiException if the request fails
	 */
	String post(String uri, String xml);

	/**
	 * PUT an XML document, replacing the resource.
	 * @param uri absolute URI or path relative to the API root
	 * @param xml request body
	 * @return response body
	 * @throws ClarityApiException if the request fails
	 */
	String put(String uri, String xml);

	/**
	 * POST file content as a {@code multipart/form-data} part named {@code file}.
	 * @param uri upload URI
	 * @param filename file name reported in the part header
	 * @param content file content
	 * @param contentType content type of the part
	 * @return response body
	 * @throws ClarityApiException if the request fails
	 */
	String upload(String uri, String filename, byte[] content, String contentType);

}
