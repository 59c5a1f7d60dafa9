package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Thrown when the reduced output breaks the one-permission-per-(repository, email) rule.
 * This indicates a bug in reduction and aborts the run.
 */
public class ResolutionConsistencyException extends RuntimeException {

	private final List<EffectivePermission.Key> duplicateKeys;

	public ResolutionConsistencyException(List<EffectivePermission.Key> duplicateKeys) {
		super("Internal consistency error: " + duplicateKeys.size()
				+ " (repository, email) pair(s) resolved to more than one permission: " + duplicateKeys);
		this.duplicateKeys = List.copyOf(duplicateKeys);
	}

	public List<EffectivePermission.Key> getDuplicateKeys() {
		return duplicateKeys;
	}

}
