package org.springaicommunity.permissionsync;

/**
 * The GitHub repository a Bitbucket repository migrates to.
 *
 * @param org target organization
 * @param repo repository name within the organization
 */
public record GitHubTarget(String org, String repo) implements Comparable<GitHubTarget> {

	/**
	 * Apply the naming convention {@code ORG/${PROJECT_KEY}-${REPO_SLUG}}.
	 * @param org target organization
	 * @param projectKey Bitbucket project key
	 * @param repoSlug Bitbucket repository slug
	 * @return the target repository
	 */
	public static GitHubTarget fromProjectRepo(String org, String projectKey, String repoSlug) {
		return new GitHubTarget(org, projectKey + "-" + repoSlug);
	}

	public String fullName() {
		return org + "/" + repo;
	}

	@Override
	public int compareTo(GitHubTarget other) {
		return fullName().compareTo(other.fullName());
	}

	@Override
	public String toString() {
		return fullName();
	}

}
