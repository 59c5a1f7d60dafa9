package org.springaicommunity.permissionsync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges candidate permissions into exactly one {@link EffectivePermission} per
 * (repository, email).
 *
 * <p>
 * The winner is the candidate with the highest {@link PermissionLevel}. Ties go to a
 * direct grant over a group grant, then to the group name that sorts first. Only the
 * winner's provenance is kept.
 */
public class StrongestWinsReducer {

	/**
	 * Orders candidates best-first.
	 */
	static final Comparator<EffectivePermission> PRECEDENCE = Comparator
		.comparingInt((EffectivePermission p) -> p.permission().rank())
		.reversed()
		.thenComparingInt(p -> p.source() == GrantSource.DIRECT ? 0 : 1)
		.thenComparing(EffectivePermission::sourcePrincipal);

	/**
	 * Reduce candidates.
	 * @param candidates direct and group-derived candidates, in any order
	 * @return one permission per (repository, email), sorted by repository then email
	 */
	public List<EffectivePermission> reduce(Collection<EffectivePermission> candidates) {
		Map<EffectivePermission.Key, EffectivePermission> winners = new TreeMap<>();
		for (EffectivePermission candidate : candidates) {
			winners.merge(candidate.key(), candidate, StrongestWinsReducer::better);
		}
		return new ArrayList<>(winners.values());
	}

	private static EffectivePermission better(EffectivePermission current, EffectivePermission challenger) {
		return PRECEDENCE.compare(challenger, current) < 0 ? challenger : current;
	}

}
