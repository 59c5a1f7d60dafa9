package org.springaicommunity.permissionsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns group grants into per-user candidate permissions by joining them with group
 * membership.
 *
 * <p>
 * Group names match exactly (case-sensitive). Each distinct member email of a granted
 * group yields one candidate; duplicate membership rows collapse. No strength comparison
 * happens here.
 */
public class GroupExpansionJoin {

	private static final Logger logger = LoggerFactory.getLogger(GroupExpansionJoin.class);

	/**
	 * Expand group grants over normalized memberships.
	 * @param groupGrants grants with non-blank group names
	 * @param memberships memberships with normalized, non-empty emails
	 * @return candidates plus one {@link Diagnostic.Kind#EMPTY_GROUP} diagnostic per grant
	 * whose group has no members
	 */
	public Expansion expand(List<GroupGrant> groupGrants, List<Membership> memberships) {
		Map<String, Set<String>> membersByGroup = indexMembers(memberships);

		List<EffectivePermission> candidates = new ArrayList<>();
		List<Diagnostic> diagnostics = new ArrayList<>();

		for (GroupGrant grant : groupGrants) {
			Set<String> members = membersByGroup.getOrDefault(grant.groupName(), Set.of());
			if (members.isEmpty()) {
				logger.info("Group {} has permissions on {} but no members were found", grant.groupName(),
						grant.repository());
				diagnostics.add(Diagnostic.emptyGroup(grant.repository(), grant.groupName()));
				continue;
			}
			for (String email : members) {
				candidates.add(EffectivePermission.fromGroup(grant.repository(), email, grant.permission(),
						grant.groupName()));
			}
		}

		logger.debug("Expanded {} group grants over {} groups into {} candidates", groupGrants.size(),
				membersByGroup.size(), candidates.size());
		return new Expansion(candidates, diagnostics);
	}

	private Map<String, Set<String>> indexMembers(List<Membership> memberships) {
		Map<String, Set<String>> index = new HashMap<>();
		for (Membership membership : memberships) {
			if (membership.email() == null) {
				continue;
			}
			index.computeIfAbsent(membership.group(), g -> new LinkedHashSet<>()).add(membership.email());
		}
		return index;
	}

	/**
	 * Result of a group expansion.
	 *
	 * @param candidates group-derived candidate permissions
	 * @param diagnostics empty-group diagnostics
	 */
	public record Expansion(List<EffectivePermission> candidates, List<Diagnostic> diagnostics) {

		public Expansion {
			candidates = List.copyOf(candidates);
			diagnostics = List.copyOf(diagnostics);
		}

	}

}
