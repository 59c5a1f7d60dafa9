package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts between CSV rows and engine records.
 *
 * <p>
 * Bitbucket permission names are translated to {@link PermissionLevel} here, before the
 * records reach the resolution engine. Rows with an unknown permission or without a
 * project key or repository slug are excluded and reported.
 */
public class GrantRowMapper {

	/**
	 * Map extracted rows to engine records.
	 * @param userRows rows of {@code repo_user_permissions.csv}
	 * @param groupRows rows of {@code repo_group_permissions.csv}
	 * @param memberRows rows of {@code group_members.csv}
	 * @return mapped records and boundary diagnostics
	 */
	public MappedGrants toGrants(List<UserPermissionRow> userRows, List<GroupPermissionRow> groupRows,
			List<GroupMemberRow> memberRows) {
		List<Diagnostic> diagnostics = new ArrayList<>();

		List<DirectGrant> direct = new ArrayList<>(userRows.size());
		for (UserPermissionRow row : userRows) {
			Optional<RepositoryKey> repository = repositoryOf(row.projectKey(), row.repoSlug(), row.principal(),
					diagnostics);
			Optional<PermissionLevel> level = translate(row.permission(), repository.orElse(null), null,
					row.principal(), diagnostics);
			if (repository.isPresent() && level.isPresent()) {
				direct.add(DirectGrant.of(repository.get(), row.principal(), row.email(), level.get()));
			}
		}

		List<GroupGrant> group = new ArrayList<>(groupRows.size());
		for (GroupPermissionRow row : groupRows) {
			Optional<RepositoryKey> repository = repositoryOf(row.projectKey(), row.repoSlug(), row.principal(),
					diagnostics);
			Optional<PermissionLevel> level = translate(row.permission(), repository.orElse(null), row.principal(),
					null, diagnostics);
			if (repository.isPresent() && level.isPresent()) {
				group.add(GroupGrant.of(repository.get(), row.principal(), level.get()));
			}
		}

		List<Membership> memberships = new ArrayList<>(memberRows.size());
		for (GroupMemberRow row : memberRows) {
			memberships.add(new Membership(row.group(), row.user(), row.email()));
		}

		return new MappedGrants(direct, group, memberships, diagnostics);
	}

	/**
	 * Convert an effective permission to its CSV row. The permission column holds the
	 * canonical level name.
	 */
	public EffectivePermissionRow toRow(EffectivePermission permission) {
		return new EffectivePermissionRow(permission.repository().projectKey(), permission.repository().repoSlug(),
				permission.email(), permission.permission().name(), permission.source().label(),
				permission.sourcePrincipal());
	}

	public List<EffectivePermissionRow> toRows(List<EffectivePermission> permissions) {
		return permissions.stream().map(this::toRow).toList();
	}

	private static Optional<RepositoryKey> repositoryOf(String projectKey, String repoSlug, String principal,
			List<Diagnostic> diagnostics) {
		if (projectKey.isBlank() || repoSlug.isBlank()) {
			diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_ROW, null, null, principal,
					"Skipping row for '" + principal + "': missing project key or repository slug"));
			return Optional.empty();
		}
		return Optional.of(new RepositoryKey(projectKey.trim(), repoSlug.trim()));
	}

	private static Optional<PermissionLevel> translate(String permission, @Nullable RepositoryKey repository,
			@Nullable String group, @Nullable String subject, List<Diagnostic> diagnostics) {
		if (repository == null) {
			return Optional.empty();
		}
		Optional<PermissionLevel> level = PermissionLevel.fromSourceName(permission);
		if (level.isEmpty()) {
			String who = group != null ? "group " + group : "user '" + subject + "'";
			diagnostics.add(new Diagnostic(Diagnostic.Kind.UNKNOWN_PERMISSION, repository, group, subject,
					"Unknown permission '" + permission + "' for " + who + " on " + repository + "; skipping"));
		}
		return level;
	}

}
