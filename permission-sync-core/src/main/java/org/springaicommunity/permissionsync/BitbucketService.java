package org.springaicommunity.permissionsync;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the Bitbucket Data Center REST operations needed to extract permissions.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON. All list operations follow pagination to
 * the last page.
 */
public interface BitbucketService {

	/**
	 * List projects.
	 * @param projectKeys keys to keep, or empty for all projects
	 * @return matching projects
	 */
	List<BitbucketProject> getProjects(Collection<String> projectKeys);

	/**
	 * List repositories of a project.
	 * @param projectKey the project key
	 * @param repoSlugs slugs to keep, or empty for all repositories
	 * @return matching repositories
	 */
	List<BitbucketRepository> getRepositories(String projectKey, Collection<String> repoSlugs);

	/**
	 * List users with a direct permission on a repository.
	 */
	List<UserPermissionEntry> getRepositoryUserPermissions(String projectKey, String repoSlug);

	/**
	 * List groups with a permission on a repository.
	 */
	List<GroupPermissionEntry> getRepositoryGroupPermissions(String projectKey, String repoSlug);

	/**
	 * List members of a group. Requires admin privileges.
	 * @param group the group name
	 * @return the members
	 */
	List<BitbucketUser> getGroupMembers(String group);

	/**
	 * Look up a user by slug, falling back to a filtered user search matching name or slug.
	 * @param slugOrName user slug or name
	 * @return the user, or empty if not found or not accessible
	 */
	Optional<BitbucketUser> getUser(String slugOrName);

}
