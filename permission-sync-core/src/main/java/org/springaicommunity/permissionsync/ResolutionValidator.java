package org.springaicommunity.permissionsync;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sanity checks on reduced output before it is handed to the applier.
 */
public class ResolutionValidator {

	/**
	 * Validate reduced permissions against the input grants.
	 * @param permissions reducer output
	 * @param directGrants direct grants as given to the engine (before normalization)
	 * @param groupGrants group grants as given to the engine
	 * @return a {@link Diagnostic.Kind#ZERO_OUTPUT_REPOSITORY} warning for each repository
	 * with grants but no output, in repository order
	 * @throws ResolutionConsistencyException if a (repository, email) pair occurs more than
	 * once
	 */
	public List<Diagnostic> validate(List<EffectivePermission> permissions, List<DirectGrant> directGrants,
			List<GroupGrant> groupGrants) {
		Set<EffectivePermission.Key> seen = new HashSet<>();
		Set<EffectivePermission.Key> duplicates = new TreeSet<>();
		Set<RepositoryKey> covered = new HashSet<>();
		for (EffectivePermission permission : permissions) {
			if (!seen.add(permission.key())) {
				duplicates.add(permission.key());
			}
			covered.add(permission.repository());
		}
		if (!duplicates.isEmpty()) {
			throw new ResolutionConsistencyException(new ArrayList<>(duplicates));
		}

		Set<RepositoryKey> granted = new TreeSet<>();
		directGrants.forEach(g -> granted.add(g.repository()));
		groupGrants.forEach(g -> granted.add(g.repository()));

		List<Diagnostic> diagnostics = new ArrayList<>();
		for (RepositoryKey repository : granted) {
			if (!covered.contains(repository)) {
				diagnostics.add(Diagnostic.zeroOutputRepository(repository));
			}
		}
		return diagnostics;
	}

}
