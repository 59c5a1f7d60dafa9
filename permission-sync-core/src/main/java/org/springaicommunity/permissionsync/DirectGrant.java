package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A permission assigned directly to a user on a repository.
 *
 * <p>
 * The email may be absent at extraction time. Such a grant cannot be resolved and is
 * reported as a diagnostic rather than dropped.
 *
 * @param repository the repository the grant applies to
 * @param principal the user principal holding the grant
 * @param email the user's email, possibly null or blank
 * @param permission the granted level
 */
public record DirectGrant(RepositoryKey repository, Principal principal, @Nullable String email,
		PermissionLevel permission) {

	public DirectGrant {
		if (!principal.isUser()) {
			throw new IllegalArgumentException("Direct grant requires a user principal, got group " + principal.name());
		}
		if (!Objects.equals(principal.email(), email)) {
			throw new IllegalArgumentException(
					"Email '" + email + "' does not match principal email '" + principal.email() + "'");
		}
	}

	public static DirectGrant of(RepositoryKey repository, String userName, @Nullable String email,
			PermissionLevel permission) {
		return new DirectGrant(repository, Principal.user(userName, email), email, permission);
	}

}
