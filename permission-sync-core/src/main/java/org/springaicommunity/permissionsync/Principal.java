package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

/**
 * An entity that can hold a permission grant, tagged as either a user or a group.
 *
 * <p>
 * A user principal may carry an email, which is the only identity key used for matching.
 * A group principal is identified by its name and never carries an email.
 *
 * @param kind whether this principal is a user or a group
 * @param name the user name or group name in the source system
 * @param email the user's email, always null for groups
 */
public record Principal(Kind kind, String name, @Nullable String email) {

	public enum Kind {

		USER, GROUP

	}

	public Principal {
		if (kind == null) {
			throw new IllegalArgumentException("Principal kind is required");
		}
		if (name == null) {
			name = "";
		}
		if (kind == Kind.GROUP && email != null) {
			throw new IllegalArgumentException("Group principal cannot carry an email: " + name);
		}
	}

	public static Principal user(String name, @Nullable String email) {
		return new Principal(Kind.USER, name, email);
	}

	public static Principal group(String name) {
		return new Principal(Kind.GROUP, name, null);
	}

	public boolean isUser() {
		return kind == Kind.USER;
	}

	public boolean isGroup() {
		return kind == Kind.GROUP;
	}

}
