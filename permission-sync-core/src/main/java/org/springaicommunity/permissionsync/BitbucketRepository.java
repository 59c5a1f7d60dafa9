package org.springaicommunity.permissionsync;

/**
 * A repository inside a Bitbucket Data Center project.
 *
 * @param projectKey the owning project key
 * @param slug the repository slug
 * @param name the display name
 */
public record BitbucketRepository(String projectKey, String slug, String name) {

	public RepositoryKey key() {
		return new RepositoryKey(projectKey, slug);
	}

}
