package org.springaicommunity.permissionsync;

import java.util.Comparator;

/**
 * Identifies a source repository by its Bitbucket project key and repository slug.
 *
 * <p>
 * Used as the grouping key throughout resolution. Ordering is by project key, then slug.
 *
 * @param projectKey the Bitbucket project key (e.g., "PROJ")
 * @param repoSlug the repository slug within the project
 */
public record RepositoryKey(String projectKey, String repoSlug) implements Comparable<RepositoryKey> {

	private static final Comparator<RepositoryKey> ORDER = Comparator.comparing(RepositoryKey::projectKey)
		.thenComparing(RepositoryKey::repoSlug);

	public RepositoryKey {
		if (projectKey == null || projectKey.isBlank()) {
			throw new IllegalArgumentException("Project key cannot be empty");
		}
		if (repoSlug == null || repoSlug.isBlank()) {
			throw new IllegalArgumentException("Repository slug cannot be empty");
		}
	}

	@Override
	public int compareTo(RepositoryKey other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return projectKey + "/" + repoSlug;
	}

}
