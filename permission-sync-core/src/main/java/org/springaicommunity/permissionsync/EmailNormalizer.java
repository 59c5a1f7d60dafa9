package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical form of email addresses used as identity keys: trimmed and lower-cased.
 */
public final class EmailNormalizer {

	private EmailNormalizer() {
	}

	/**
	 * Normalize an email.
	 * @param email raw email, may be null
	 * @return the normalized email, or empty if it is null or blank
	 */
	public static Optional<String> normalize(@Nullable String email) {
		if (email == null) {
			return Optional.empty();
		}
		String trimmed = email.trim();
		if (trimmed.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(trimmed.toLowerCase(Locale.ROOT));
	}

}
