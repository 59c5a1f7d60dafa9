package org.springaicommunity.permissionsync;

/**
 * A permission assigned to a group on a repository.
 *
 * @param repository the repository the grant applies to
 * @param principal the group principal holding the grant
 * @param groupName the group name, matched exactly against memberships
 * @param permission the granted level
 */
public record GroupGrant(RepositoryKey repository, Principal principal, String groupName,
		PermissionLevel permission) {

	public GroupGrant {
		if (!principal.isGroup()) {
			throw new IllegalArgumentException("Group grant requires a group principal, got user " + principal.name());
		}
		if (!principal.name().equals(groupName)) {
			throw new IllegalArgumentException(
					"Group name '" + groupName + "' does not match principal '" + principal.name() + "'");
		}
	}

	public static GroupGrant of(RepositoryKey repository, String groupName, PermissionLevel permission) {
		return new GroupGrant(repository, Principal.group(groupName), groupName, permission);
	}

}
