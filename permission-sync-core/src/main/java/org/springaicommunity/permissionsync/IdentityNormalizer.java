package org.springaicommunity.permissionsync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reduces raw grant and membership records to a canonical, email-keyed view.
 *
 * <p>
 * Emails are compared trimmed and case-insensitively; user names are never used for
 * matching. Group names are left untouched. Records that cannot be resolved are excluded
 * and reported as {@link Diagnostic}s instead of failing the run.
 */
public class IdentityNormalizer {

	public NormalizedGrants normalize(List<DirectGrant> directGrants, List<GroupGrant> groupGrants,
			List<Membership> memberships) {
		List<Diagnostic> diagnostics = new ArrayList<>();

		List<DirectGrant> normalizedDirect = new ArrayList<>(directGrants.size());
		for (DirectGrant grant : directGrants) {
			Optional<String> email = EmailNormalizer.normalize(grant.email());
			if (email.isEmpty()) {
				diagnostics.add(Diagnostic.skippedMissingEmail(grant.repository(), null, grant.principal().name(),
						"Skipping direct grant for user '" + grant.principal().name() + "' on " + grant.repository()
								+ ": missing email"));
				continue;
			}
			normalizedDirect.add(new DirectGrant(grant.repository(),
					Principal.user(grant.principal().name(), email.get()), email.get(), grant.permission()));
		}

		List<GroupGrant> validGroupGrants = new ArrayList<>(groupGrants.size());
		for (GroupGrant grant : groupGrants) {
			if (grant.groupName().isBlank()) {
				diagnostics.add(new Diagnostic(Diagnostic.Kind.SKIPPED_MISSING_GROUP, grant.repository(), null, null,
						"Skipping group grant on " + grant.repository() + ": missing group name"));
				continue;
			}
			validGroupGrants.add(grant);
		}

		List<Membership> normalizedMemberships = new ArrayList<>(memberships.size());
		for (Membership membership : memberships) {
			if (membership.group().isBlank()) {
				diagnostics.add(new Diagnostic(Diagnostic.Kind.SKIPPED_MISSING_GROUP, null, null, membership.user(),
						"Skipping membership of user '" + membership.user() + "': missing group name"));
				continue;
			}
			Optional<String> email = EmailNormalizer.normalize(membership.email());
			if (email.isEmpty()) {
				diagnostics.add(Diagnostic.skippedMissingEmail(null, membership.group(), membership.user(),
						"Skipping member '" + membership.user() + "' of group " + membership.group()
								+ ": missing email"));
				continue;
			}
			normalizedMemberships.add(new Membership(membership.group(), membership.user(), email.get()));
		}

		return new NormalizedGrants(normalizedDirect, validGroupGrants, normalizedMemberships, diagnostics);
	}

}
