package org.springaicommunity.permissionsync;

/**
 * A group's permission on a repository as listed by Bitbucket.
 *
 * @param group the group name
 * @param permission the Bitbucket permission name (e.g., {@code REPO_READ})
 */
public record GroupPermissionEntry(String group, String permission) {
}
