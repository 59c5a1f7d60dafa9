package org.springaicommunity.permissionsync;

/**
 * Interface for Bitbucket Data Center REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the HTTP transport, enabling testability and decorator
 * implementations.
 */
public interface BitbucketClient {

	/**
	 * Execute a GET request against the Bitbucket REST API.
	 * @param path API path (e.g., "/rest/api/1.0/projects")
	 * @return Response body as String
	 * @throws BitbucketHttpClient.BitbucketApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), already URL-encoded
	 * @return Response body as String
	 * @throws BitbucketHttpClient.BitbucketApiException if the request fails
	 */
	String getWithQuery(String path, String queryString);

}
