package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * A Bitbucket Data Center user as returned by permission, membership and user endpoints.
 *
 * <p>
 * The email is only visible to sufficiently privileged callers and may be missing.
 *
 * @param name the user name
 * @param slug the URL slug of the user
 * @param emailAddress the email, if visible
 * @param displayName the display name
 */
public record BitbucketUser(String name, String slug, @Nullable String emailAddress, @Nullable String displayName) {

	public Optional<String> email() {
		return emailAddress == null || emailAddress.isBlank() ? Optional.empty() : Optional.of(emailAddress);
	}

	/**
	 * Returns the identifier used in output rows and lookups: the name, or the slug when
	 * the name is empty.
	 * @return the user identifier
	 */
	public String identifier() {
		return !name.isEmpty() ? name : slug;
	}

	public BitbucketUser withEmail(@Nullable String email) {
		return new BitbucketUser(name, slug, email, displayName);
	}

}
