package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Connection settings for a Bitbucket Data Center server.
 *
 * <p>
 * Either a personal access token or a username/password pair authenticates requests. The
 * token takes precedence when both are present.
 *
 * @param baseUrl server base URL, e.g. {@code https://bitbucket.example.com}
 * @param token personal access token, sent as a bearer token
 * @param username user for HTTP basic authentication
 * @param password password for HTTP basic authentication
 * @param rateLimitSleep pause inserted before every request
 */
public record BitbucketConfig(String baseUrl, @Nullable String token, @Nullable String username,
		@Nullable String password, Duration rateLimitSleep) {

	public BitbucketConfig {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("Bitbucket base URL is required");
		}
		baseUrl = stripTrailingSlashes(baseUrl.trim());
		if (rateLimitSleep == null || rateLimitSleep.isNegative()) {
			rateLimitSleep = Duration.ZERO;
		}
	}

	public static BitbucketConfig withToken(String baseUrl, String token) {
		return new BitbucketConfig(baseUrl, token, null, null, Duration.ZERO);
	}

	public static BitbucketConfig withBasicAuth(String baseUrl, String username, String password) {
		return new BitbucketConfig(baseUrl, null, username, password, Duration.ZERO);
	}

	public BitbucketConfig withRateLimitSleep(Duration sleep) {
		return new BitbucketConfig(baseUrl, token, username, password, sleep);
	}

	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	public boolean hasBasicAuth() {
		return username != null && !username.isBlank() && password != null;
	}

	private static String stripTrailingSlashes(String url) {
		String result = url;
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	@Override
	public String toString() {
		return "BitbucketConfig{baseUrl='" + baseUrl + "', auth=" + (hasToken() ? "token" : "basic:" + username)
				+ ", rateLimitSleep=" + rateLimitSleep + '}';
	}

}
