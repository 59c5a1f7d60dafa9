package org.springaicommunity.permissionsync;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical repository permission levels, totally ordered {@code READ < WRITE < ADMIN}.
 *
 * <p>
 * Comparisons go through {@link #rank()} only. Source-system names are translated with
 * {@link #fromSourceName(String)} before records enter the resolution engine.
 */
public enum PermissionLevel {

	READ(1, "REPO_READ", "pull"),

	WRITE(2, "REPO_WRITE", "push"),

	ADMIN(3, "REPO_ADMIN", "admin");

	private final int rank;

	private final String bitbucketName;

	private final String gitHubPermission;

	PermissionLevel(int rank, String bitbucketName, String gitHubPermission) {
		this.rank = rank;
		this.bitbucketName = bitbucketName;
		this.gitHubPermission = gitHubPermission;
	}

	public int rank() {
		return rank;
	}

	/**
	 * Returns the Bitbucket Data Center name of this level (e.g., {@code REPO_WRITE}).
	 * @return the Bitbucket permission name
	 */
	public String bitbucketName() {
		return bitbucketName;
	}

	/**
	 * Returns the GitHub collaborator permission for this level.
	 * @return "pull", "push" or "admin"
	 */
	public String gitHubPermission() {
		return gitHubPermission;
	}

	public boolean isStrongerThan(PermissionLevel other) {
		return this.rank > other.rank;
	}

	/**
	 * Returns the stronger of two levels.
	 * @param a first level
	 * @param b second level
	 * @return {@code a} if it ranks at least as high as {@code b}, otherwise {@code b}
	 */
	public static PermissionLevel strongest(PermissionLevel a, PermissionLevel b) {
		return b.isStrongerThan(a) ? b : a;
	}

	/**
	 * Translate a permission name to a canonical level. Accepts Bitbucket names
	 * ({@code REPO_READ}, {@code REPO_WRITE}, {@code REPO_ADMIN}) and the canonical names
	 * ({@code READ}, {@code WRITE}, {@code ADMIN}), case-insensitively.
	 * @param name the permission name, may be null
	 * @return the level, or empty if the name is unknown
	 */
	public static Optional<PermissionLevel> fromSourceName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		for (PermissionLevel level : values()) {
			if (level.name().equals(normalized) || level.bitbucketName.equals(normalized)) {
				return Optional.of(level);
			}
		}
		return Optional.empty();
	}

}
