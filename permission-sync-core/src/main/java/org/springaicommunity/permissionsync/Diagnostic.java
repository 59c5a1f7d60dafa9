package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

/**
 * A recoverable problem found while resolving permissions, reported alongside the result
 * for operator-facing logging.
 *
 * @param kind what went wrong
 * @param repository the repository implicated, if any
 * @param group the group implicated, if any
 * @param subject the user name or email implicated, if any
 * @param message human readable description
 */
public record Diagnostic(Kind kind, @Nullable RepositoryKey repository, @Nullable String group,
		@Nullable String subject, String message) {

	/**
	 * Diagnostic categories and their default severity.
	 */
	public enum Kind {

		/** A direct grant or membership row without a usable email. */
		SKIPPED_MISSING_EMAIL(Severity.WARN),

		/** A group grant or membership row without a group name. */
		SKIPPED_MISSING_GROUP(Severity.WARN),

		/** A group grant whose group has no known members. */
		EMPTY_GROUP(Severity.INFO),

		/** A repository that had input grants but produced no effective permissions. */
		ZERO_OUTPUT_REPOSITORY(Severity.WARN),

		/** A row whose permission name could not be translated. */
		UNKNOWN_PERMISSION(Severity.WARN),

		/** A row without project key or repository slug. */
		MALFORMED_ROW(Severity.WARN);

		private final Severity severity;

		Kind(Severity severity) {
			this.severity = severity;
		}

		public Severity severity() {
			return severity;
		}

	}

	public enum Severity {

		INFO, WARN

	}

	public Severity severity() {
		return kind.severity();
	}

	public static Diagnostic skippedMissingEmail(@Nullable RepositoryKey repository, @Nullable String group,
			String subject, String message) {
		return new Diagnostic(Kind.SKIPPED_MISSING_EMAIL, repository, group, subject, message);
	}

	public static Diagnostic emptyGroup(RepositoryKey repository, String group) {
		return new Diagnostic(Kind.EMPTY_GROUP, repository, group, null,
				"Group " + group + " has permissions on " + repository + " but no known members");
	}

	public static Diagnostic zeroOutputRepository(RepositoryKey repository) {
		return new Diagnostic(Kind.ZERO_OUTPUT_REPOSITORY, repository, null, null,
				"Repository " + repository + " had grants but produced no effective permissions");
	}

}
