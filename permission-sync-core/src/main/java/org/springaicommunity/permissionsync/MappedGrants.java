package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Engine input built from CSV rows, with diagnostics for rows that could not be
 * translated.
 */
public record MappedGrants(List<DirectGrant> directGrants, List<GroupGrant> groupGrants,
		List<Membership> memberships, List<Diagnostic> diagnostics) {

	public MappedGrants {
		directGrants = List.copyOf(directGrants);
		groupGrants = List.copyOf(groupGrants);
		memberships = List.copyOf(memberships);
		diagnostics = List.copyOf(diagnostics);
	}

}
