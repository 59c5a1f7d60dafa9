package org.springaicommunity.permissionsync;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves credentials such as {@code GITHUB_TOKEN} and {@code BITBUCKET_TOKEN} from a
 * {@code .env} file or the system environment. The {@code .env} files are loaded once and
 * cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String BITBUCKET_TOKEN = "BITBUCKET_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

}
