package org.springaicommunity.permissionsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * HTTP client for the Bitbucket Data Center REST API using the JDK {@link HttpClient}.
 *
 * <p>
 * Authenticates with a bearer token or HTTP basic credentials and optionally sleeps before
 * each request to stay under server-side rate limits.
 */
public class BitbucketHttpClient implements BitbucketClient {

	private static final Logger logger = LoggerFactory.getLogger(BitbucketHttpClient.class);

	private final HttpClient httpClient;

	private final BitbucketConfig config;

	private final String authorization;

	public BitbucketHttpClient(BitbucketConfig config) {
		if (!config.hasToken() && !config.hasBasicAuth()) {
			throw new IllegalArgumentException("Bitbucket credentials are required: a token or username and password");
		}
		this.config = config;
		this.authorization = authorizationHeader(config);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : config.baseUrl() + path;
		pause();
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", authorization)
			.header("Accept", "application/json")
			.header("User-Agent", "permission-sync")
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (BitbucketApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		String url = config.baseUrl() + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			logger.error("Bitbucket GET {} failed: {} - {}", request.uri(), statusCode, response.body());
			if (statusCode == 401) {
				throw new BitbucketApiException("Unauthorized: check your Bitbucket credentials", statusCode,
						response.body());
			}
			if (statusCode == 404) {
				throw new BitbucketApiException("Not found: " + request.uri(), statusCode, response.body());
			}
			throw new BitbucketApiException("Bitbucket API error: " + statusCode, statusCode, response.body());
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new BitbucketApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BitbucketApiException("HTTP request interrupted", e);
		}
	}

	private void pause() {
		long millis = config.rateLimitSleep().toMillis();
		if (millis <= 0) {
			return;
		}
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BitbucketApiException("Rate limit sleep interrupted", e);
		}
	}

	private static String authorizationHeader(BitbucketConfig config) {
		if (config.hasToken()) {
			return "Bearer " + config.token();
		}
		String credentials = config.username() + ":" + config.password();
		return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Exception thrown when Bitbucket API calls fail.
	 */
	public static class BitbucketApiException extends RuntimeException {

		private final int statusCode;

		private final String responseBody;

		public BitbucketApiException(String message, int statusCode, String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public BitbucketApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public String getResponseBody() {
			return responseBody;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

	}

}
