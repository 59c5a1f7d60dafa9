package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Email to GitHub login mapping with an optional fallback login for unmapped emails.
 *
 * <p>
 * Emails are matched trimmed and lower-cased. Rows with a blank email or login are
 * ignored; for repeated emails the last row wins.
 */
public final class IdentityMapping {

	private final Map<String, String> loginsByEmail;

	private final @Nullable String defaultLogin;

	private IdentityMapping(Map<String, String> loginsByEmail, @Nullable String defaultLogin) {
		this.loginsByEmail = Map.copyOf(loginsByEmail);
		this.defaultLogin = defaultLogin == null || defaultLogin.isBlank() ? null : defaultLogin.trim();
	}

	public static IdentityMapping of(List<LoginMappingRow> rows, @Nullable String defaultLogin) {
		Map<String, String> logins = new HashMap<>();
		for (LoginMappingRow row : rows) {
			String email = normalizeEmail(row.email());
			String login = row.githubLogin().trim();
			if (!email.isEmpty() && !login.isEmpty()) {
				logins.put(email, login);
			}
		}
		return new IdentityMapping(logins, defaultLogin);
	}

	public static IdentityMapping empty(@Nullable String defaultLogin) {
		return new IdentityMapping(Map.of(), defaultLogin);
	}

	/**
	 * Look up the login explicitly mapped to an email.
	 * @param email the email, in any case
	 * @return the mapped login, or empty
	 */
	public Optional<String> mappedLogin(String email) {
		return Optional.ofNullable(loginsByEmail.get(normalizeEmail(email)));
	}

	public Optional<String> defaultLogin() {
		return Optional.ofNullable(defaultLogin);
	}

	public int size() {
		return loginsByEmail.size();
	}

	static String normalizeEmail(@Nullable String email) {
		return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
	}

}
