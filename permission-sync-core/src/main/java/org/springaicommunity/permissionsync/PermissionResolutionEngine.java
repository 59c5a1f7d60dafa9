package org.springaicommunity.permissionsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Computes the effective permission of every user on every repository from direct grants,
 * group grants and group membership.
 *
 * <p>
 * Pipeline: {@link IdentityNormalizer} &rarr; {@link GroupExpansionJoin} &rarr;
 * {@link StrongestWinsReducer} &rarr; {@link ResolutionValidator}. Each call is a pure
 * function of its inputs; the group index lives only for the duration of one call and the
 * input lists are never modified.
 *
 * <p>
 * Example:
 *
 * <pre>
 * {@code
 * PermissionResolutionEngine engine = new PermissionResolutionEngine();
 * ResolutionResult result = engine.resolve(directGrants, groupGrants, memberships);
 * result.permissions().forEach(p -> ...);
 * result.diagnostics().forEach(d -> ...);
 * }
 * </pre>
 */
public class PermissionResolutionEngine {

	private static final Logger logger = LoggerFactory.getLogger(PermissionResolutionEngine.class);

	private final IdentityNormalizer normalizer;

	private final GroupExpansionJoin join;

	private final StrongestWinsReducer reducer;

	private final ResolutionValidator validator;

	public PermissionResolutionEngine() {
		this(new IdentityNormalizer(), new GroupExpansionJoin(), new StrongestWinsReducer(),
				new ResolutionValidator());
	}

	public PermissionResolutionEngine(IdentityNormalizer normalizer, GroupExpansionJoin join,
			StrongestWinsReducer reducer, ResolutionValidator validator) {
		this.normalizer = normalizer;
		this.join = join;
		this.reducer = reducer;
		this.validator = validator;
	}

	/**
	 * Resolve effective permissions.
	 * @param directGrants direct user grants
	 * @param groupGrants group grants
	 * @param memberships group memberships
	 * @return one effective permission per (repository, email) plus diagnostics
	 * @throws ResolutionConsistencyException if reduction produced a duplicate pair
	 */
	public ResolutionResult resolve(List<DirectGrant> directGrants, List<GroupGrant> groupGrants,
			List<Membership> memberships) {
		NormalizedGrants normalized = normalizer.normalize(directGrants, groupGrants, memberships);
		logger.debug("Normalized {} direct grants, {} group grants, {} memberships ({} skipped)",
				normalized.directGrants().size(), normalized.groupGrants().size(), normalized.memberships().size(),
				normalized.diagnostics().size());

		GroupExpansionJoin.Expansion expansion = join.expand(normalized.groupGrants(), normalized.memberships());

		List<EffectivePermission> candidates = new ArrayList<>(
				normalized.directGrants().size() + expansion.candidates().size());
		for (DirectGrant grant : normalized.directGrants()) {
			candidates.add(EffectivePermission.direct(grant.repository(), grant.email(), grant.permission()));
		}
		candidates.addAll(expansion.candidates());

		List<EffectivePermission> permissions = reducer.reduce(candidates);
		logger.debug("Reduced {} candidates to {} effective permissions", candidates.size(), permissions.size());

		List<Diagnostic> diagnostics = new ArrayList<>(normalized.diagnostics());
		diagnostics.addAll(expansion.diagnostics());
		diagnostics.addAll(validator.validate(permissions, directGrants, groupGrants));

		logger.info("Resolved {} effective permissions from {} direct grants and {} group grants ({} diagnostics)",
				permissions.size(), directGrants.size(), groupGrants.size(), diagnostics.size());
		return new ResolutionResult(permissions, diagnostics);
	}

	/**
	 * Resolve effective permissions with one task per repository. Grants are partitioned by
	 * {@link RepositoryKey}; every partition sees the full membership list. The resulting
	 * permissions equal those of {@link #resolve}. Membership diagnostics are reported once
	 * rather than once per partition.
	 * @param directGrants direct user grants
	 * @param groupGrants group grants
	 * @param memberships group memberships, shared read-only across partitions
	 * @param executor executor running the partitions
	 * @return merged result
	 * @throws ResolutionConsistencyException if any partition produced a duplicate pair
	 */
	public ResolutionResult resolvePartitioned(List<DirectGrant> directGrants, List<GroupGrant> groupGrants,
			List<Membership> memberships, ExecutorService executor) {
		Map<RepositoryKey, List<DirectGrant>> directByRepo = new TreeMap<>();
		directGrants.forEach(g -> directByRepo.computeIfAbsent(g.repository(), r -> new ArrayList<>()).add(g));
		Map<RepositoryKey, List<GroupGrant>> groupByRepo = new TreeMap<>();
		groupGrants.forEach(g -> groupByRepo.computeIfAbsent(g.repository(), r -> new ArrayList<>()).add(g));

		Set<RepositoryKey> repositories = new TreeSet<>(directByRepo.keySet());
		repositories.addAll(groupByRepo.keySet());

		// Memberships are normalized once so their diagnostics are not repeated per partition
		NormalizedGrants sharedMemberships = normalizer.normalize(List.of(), List.of(), memberships);

		List<Future<ResolutionResult>> futures = new ArrayList<>();
		for (RepositoryKey repository : repositories) {
			List<DirectGrant> direct = directByRepo.getOrDefault(repository, List.of());
			List<GroupGrant> group = groupByRepo.getOrDefault(repository, List.of());
			futures.add(executor.submit(() -> resolve(direct, group, sharedMemberships.memberships())));
		}

		List<EffectivePermission> permissions = new ArrayList<>();
		List<Diagnostic> diagnostics = new ArrayList<>(sharedMemberships.diagnostics());
		for (Future<ResolutionResult> future : futures) {
			ResolutionResult partial = await(future);
			permissions.addAll(partial.permissions());
			diagnostics.addAll(partial.diagnostics());
		}
		permissions.sort(Comparator.comparing(EffectivePermission::key));
		return new ResolutionResult(permissions, diagnostics);
	}

	private static ResolutionResult await(Future<ResolutionResult> future) {
		try {
			return future.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Partitioned resolution interrupted", e);
		}
		catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Partitioned resolution failed", e.getCause());
		}
	}

}
