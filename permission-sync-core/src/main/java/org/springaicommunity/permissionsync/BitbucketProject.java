package org.springaicommunity.permissionsync;

/**
 * A Bitbucket Data Center project.
 *
 * @param key the project key
 * @param name the display name
 */
public record BitbucketProject(String key, String name) {
}
