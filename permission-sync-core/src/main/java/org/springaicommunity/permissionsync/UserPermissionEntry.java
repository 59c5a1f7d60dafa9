package org.springaicommunity.permissionsync;

/**
 * A user's permission on a repository as listed by Bitbucket.
 *
 * @param user the user
 * @param permission the Bitbucket permission name (e.g., {@code REPO_WRITE})
 */
public record UserPermissionEntry(BitbucketUser user, String permission) {
}
