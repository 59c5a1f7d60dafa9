package org.springaicommunity.permissionsync;

import org.kohsuke.github.GHRateLimit;

import java.io.IOException;
import java.util.Optional;

/**
 * Interface for the GitHub REST operations needed to apply collaborator permissions.
 *
 * <p>
 * Failures surface as {@link IOException}; a missing repository or user is reported as
 * {@link org.kohsuke.github.GHFileNotFoundException}.
 */
public interface RestService {

	/**
	 * Get current rate limit status.
	 * @return Rate limit information
	 * @throws IOException if the request fails
	 */
	GHRateLimit getRateLimit() throws IOException;

	/**
	 * Get a repository.
	 * @param owner Repository owner (organization)
	 * @param repo Repository name
	 * @return Repository information
	 * @throws IOException if the repository is missing or not accessible
	 */
	RepositoryInfo getRepository(String owner, String repo) throws IOException;

	/**
	 * Get the permission a user currently holds on a repository, normalized to the
	 * vocabulary accepted by {@link #addCollaborator}: {@code admin}, {@code maintain},
	 * {@code push}, {@code triage} or {@code pull}.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param login GitHub login
	 * @return the normalized permission, or empty if the user is not a collaborator
	 * @throws IOException if the request fails for another reason
	 */
	Optional<String> getCollaboratorPermission(String owner, String repo, String login) throws IOException;

	/**
	 * Add a collaborator or update the permission of an existing one. For users outside
	 * the organization this creates an invitation.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param login GitHub login
	 * @param permission {@code pull}, {@code push} or {@code admin}
	 * @throws IOException if the login is unknown or the grant is rejected
	 */
	void addCollaborator(String owner, String repo, String login, String permission) throws IOException;

}
