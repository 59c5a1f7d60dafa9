package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Grant and membership records that passed identity normalization, with the diagnostics
 * for the ones that did not.
 *
 * <p>
 * Every email in {@code directGrants} and {@code memberships} is trimmed, lower-cased and
 * non-empty.
 */
public record NormalizedGrants(List<DirectGrant> directGrants, List<GroupGrant> groupGrants,
		List<Membership> memberships, List<Diagnostic> diagnostics) {

	public NormalizedGrants {
		directGrants = List.copyOf(directGrants);
		groupGrants = List.copyOf(groupGrants);
		memberships = List.copyOf(memberships);
		diagnostics = List.copyOf(diagnostics);
	}

}
