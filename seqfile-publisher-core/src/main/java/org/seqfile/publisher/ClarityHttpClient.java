package org.seqfile.publisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

/**
 * HTTP client for the Clarity REST API using the JDK {@link HttpClient} with basic
 * authentication.
 *
 * <p>
 * Relative URIs are resolved against the API root, {@code <baseUri>/api/v2}.
 */
public class ClarityHttpClient implements ClarityClient {

	private static final Logger logger = LoggerFactory.getLogger(ClarityHttpClient.class);

	private static final String API_PATH = "/api/v2";

	private static final String XML_CONTENT_TYPE = "application/xml";

	private final HttpClient httpClient;

	private final String apiRoot;

	private final String authorization;

	public ClarityHttpClient(String baseUri, String username, String password) {
		this(baseUri, username, password, Duration.ofSeconds(30));
	}

	public ClarityHttpClient(String baseUri, String username, String password, Duration connectTimeout) {
		this.apiRoot = apiRoot(baseUri);
		this.authorization = "Basic "
				+ Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Returns the API root for a server base URI, tolerating a trailing slash and a base
	 * URI that already ends with the API path.
	 */
	static String apiRoot(String baseUri) {
		String root = baseUri.endsWith("/") ? baseUri.substring(0, baseUri.length() - 1) : baseUri;
		return root.endsWith(API_PATH) ? root : root + API_PATH;
	}

	/**
	 * Resolves a possibly relative URI against the API root.
	 */
	String resolve(String uri) {
		if (uri.startsWith("http://") || uri.startsWith("https://")) {
			return uri;
		}
		return apiRoot + (uri.startsWith("/") ? uri : "/" + uri);
	}

	@Override
	public String get(String uri) {
		HttpRequest request = requestBuilder(uri).header("Accept", XML_CONTENT_TYPE).GET().build();
		return asString(execute(request, "GET"));
	}

	@Override
	public byte[] getBytes(String uri) {
		HttpRequest request = requestBuilder(uri).GET().build();
		return execute(request, "GET");
	}

	@Override
	public String post(String uri, String xml) {
		HttpRequest request = requestBuilder(uri).header("Accept", XML_CONTENT_TYPE)
			.header("Content-Type", XML_CONTENT_TYPE)
			.POST(HttpRequest.BodyPublishers.ofString(xml, StandardCharsets.UTF_8))
			.build();
		return asString(execute(request, "POST"));
	}

	@Override
	public String put(String uri, String xml) {
		HttpRequest request = requestBuilder(uri).header("Accept", XML_CONTENT_TYPE)
			.header("Content-Type", XML_CONTENT_TYPE)
			.PUT(HttpRequest.BodyPublishers.ofString(xml, StandardCharsets.UTF_8))
			.build();
		return asString(execute(request, "PUT"));
	}

	@Override
	public String upload(String uri, String filename, byte[] content, String contentType) {
		String boundary = "----seqfile-publisher-" + UUID.randomUUID();
		byte[] body = multipartBody(boundary, filename, content, contentType);

		HttpRequest request = requestBuilder(uri).header("Content-Type", "multipart/form-data; boundary=" + boundary)
			.POST(HttpRequest.BodyPublishers.ofByteArray(body))
			.build();
		return asString(execute(request, "POST (upload " + filename + ")"));
	}

	static byte[] multipartBody(String boundary, String filename, byte[] content, String contentType) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 512);
		String header = "--" + boundary + "\r\n" + "Content-Disposition: form-data; name=\"file\"; filename=\""
				+ filename.replace("\"", "_") + "\"\r\n" + "Content-Type: " + contentType + "\r\n\r\n";
		out.writeBytes(header.getBytes(StandardCharsets.UTF_8));
		out.writeBytes(content);
		out.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
		return out.toByteArray();
	}

	private HttpRequest.Builder requestBuilder(String uri) {
		return HttpRequest.newBuilder().uri(URI.create(resolve(uri))).header("Authorization", authorization);
	}

	private byte[] execute(HttpRequest request, String method) {
		logger.debug("{} {}", method, request.uri());
		long start = System.currentTimeMillis();
		try {
			HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
			int statusCode = response.statusCode();
			logger.debug("{} {} -> {} in {}ms ({} bytes)", method, request.uri(), statusCode,
					System.currentTimeMillis() - start, response.body().length);

			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}

			String body = asString(response.body());
			if (statusCode == 401) {
				throw new ClarityApiException("Unauthorized: check the API username and password", statusCode, body);
			}
			else if (statusCode == 403) {
				throw new ClarityApiException("Forbidden: " + request.uri(), statusCode, body);
			}
			else if (statusCode == 404) {
				throw new ClarityApiException("Not found: " + request.uri(), statusCode, body);
			}
			else {
				throw new ClarityApiException("LIMS API error " + statusCode + " for " + method + " " + request.uri(),
						statusCode, body);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new ClarityApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ClarityApiException("HTTP request interrupted", e);
		}
	}

	private static String asString(byte[] body) {
		return new String(body, StandardCharsets.UTF_8);
	}

}
