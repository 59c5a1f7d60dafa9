package org.springaicommunity.permissionsync;

/**
 * The single resolved permission a user holds on a repository, with its provenance.
 *
 * @param repository the repository
 * @param email the normalized user email
 * @param permission the winning level
 * @param source whether the winning grant was direct or group-derived
 * @param sourcePrincipal the group name for group-derived permissions, empty for direct
 * ones
 */
public record EffectivePermission(RepositoryKey repository, String email, PermissionLevel permission,
		GrantSource source, String sourcePrincipal) {

	public EffectivePermission {
		if (source == GrantSource.DIRECT) {
			sourcePrincipal = "";
		}
		else if (sourcePrincipal == null || sourcePrincipal.isEmpty()) {
			throw new IllegalArgumentException("Group-derived permission requires the group name");
		}
	}

	public static EffectivePermission direct(RepositoryKey repository, String email, PermissionLevel permission) {
		return new EffectivePermission(repository, email, permission, GrantSource.DIRECT, "");
	}

	public static EffectivePermission fromGroup(RepositoryKey repository, String email, PermissionLevel permission,
			String group) {
		return new EffectivePermission(repository, email, permission, GrantSource.GROUP, group);
	}

	/**
	 * Returns the (repository, email) pair this permission is unique for.
	 * @return the identity key
	 */
	public Key key() {
		return new Key(repository, email);
	}

	/**
	 * Uniqueness key of an effective permission.
	 *
	 * @param repository the repository
	 * @param email the normalized email
	 */
	public record Key(RepositoryKey repository, String email) implements Comparable<Key> {

		@Override
		public int compareTo(Key other) {
			int byRepository = repository.compareTo(other.repository);
			return byRepository != 0 ? byRepository : email.compareTo(other.email);
		}

	}

}
