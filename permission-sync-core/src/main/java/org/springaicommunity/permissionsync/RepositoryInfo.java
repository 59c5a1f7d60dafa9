package org.springaicommunity.permissionsync;

/**
 * Basic repository information from the GitHub API.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param htmlUrl the web URL for the repository
 * @param isPrivate whether the repository is private
 * @param canAdminister whether the authenticated token has admin rights on it
 */
public record RepositoryInfo(long id, String name, String fullName, String htmlUrl, boolean isPrivate,
		boolean canAdminister) {

}
