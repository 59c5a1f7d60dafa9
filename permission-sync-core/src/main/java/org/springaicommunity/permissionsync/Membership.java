package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

/**
 * One user belonging to one group.
 *
 * @param group the group name
 * @param user the user name or slug in the source system
 * @param email the user's email, possibly null or blank
 */
public record Membership(String group, String user, @Nullable String email) {
}
