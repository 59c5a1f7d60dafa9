package org.springaicommunity.permissionsync;

import org.kohsuke.github.GHRateLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Applies effective per-user permissions to GitHub repositories.
 *
 * <p>
 * Rows are grouped by target repository ({@code ORG/${PROJECT_KEY}-${REPO_SLUG}}) and
 * processed in repository name order. Emails are resolved to logins through an
 * {@link IdentityMapping}. When several rows of one repository resolve to the same login,
 * only the strongest level is granted. A collaborator already holding the target permission
 * is left alone. Per-row and per-repository failures are logged and counted; the run
 * continues.
 */
public class PermissionApplyService {

	private static final Logger logger = LoggerFactory.getLogger(PermissionApplyService.class);

	private final RestService restService;

	private final PermissionCsvRepository csvRepository;

	public PermissionApplyService(RestService restService, PermissionCsvRepository csvRepository) {
		this.restService = restService;
		this.csvRepository = csvRepository;
	}

	public ApplyResult apply(ApplyRequest request) {
		List<EffectivePermissionRow> rows = csvRepository.readEffectivePermissions(request.effectiveCsv());
		logger.info("Loaded {} effective permission rows", rows.size());

		IdentityMapping mapping = request.mappingCsv() != null
				? IdentityMapping.of(csvRepository.readLoginMappings(request.mappingCsv()), request.defaultLogin())
				: IdentityMapping.empty(request.defaultLogin());
		logger.info("Loaded {} email to login mappings{}", mapping.size(),
				mapping.defaultLogin().map(login -> " (default login " + login + ")").orElse(""));

		Tally tally = new Tally();
		Map<GitHubTarget, List<EffectivePermissionRow>> byTarget = new TreeMap<>();
		for (EffectivePermissionRow row : rows) {
			if (row.projectKey().isBlank() || row.repoSlug().isBlank()) {
				logger.warn("Row for {} has no project key or repository slug; skipping", row.email());
				tally.skipped++;
				continue;
			}
			GitHubTarget target = GitHubTarget.fromProjectRepo(request.org(), row.projectKey().trim(),
					row.repoSlug().trim());
			byTarget.computeIfAbsent(target, t -> new ArrayList<>()).add(row);
		}

		if (!byTarget.isEmpty()) {
			logRateLimit();
		}
		for (Map.Entry<GitHubTarget, List<EffectivePermissionRow>> entry : byTarget.entrySet()) {
			applyToRepository(entry.getKey(), entry.getValue(), mapping, request.dryRun(), tally);
		}

		ApplyResult result = tally.toResult();
		logger.info("Apply finished: {} granted, {} unchanged, {} skipped, {} failed, {} planned (dry-run)",
				result.granted(), result.unchanged(), result.skipped(), result.failed(), result.dryRunPlanned());
		return result;
	}

	private void applyToRepository(GitHubTarget target, List<EffectivePermissionRow> entries,
			IdentityMapping mapping, boolean dryRun, Tally tally) {
		logger.info("Processing repo {} with {} entries", target, entries.size());
		try {
			restService.getRepository(target.org(), target.repo());
		}
		catch (IOException e) {
			logger.error("Cannot access repo {}: {}", target, e.getMessage());
			tally.failed += entries.size();
			return;
		}

		Map<String, PlannedGrant> grantsByLogin = new LinkedHashMap<>();
		for (EffectivePermissionRow row : entries) {
			String email = IdentityMapping.normalizeEmail(row.email());
			if (email.isEmpty()) {
				logger.warn("Row on {} has no email; skipping", target);
				tally.skipped++;
				continue;
			}
			// Rows without a permission value are granted read access
			String permissionName = row.permission().isBlank() ? PermissionLevel.READ.name() : row.permission();
			Optional<PermissionLevel> level = PermissionLevel.fromSourceName(permissionName);
			if (level.isEmpty()) {
				logger.warn("Unknown permission {} for {}; skipping", permissionName, email);
				tally.skipped++;
				continue;
			}

			Optional<String> login = resolveLogin(email, mapping);
			if (login.isEmpty()) {
				tally.skipped++;
				continue;
			}

			PlannedGrant candidate = new PlannedGrant(login.get(), email, level.get());
			PlannedGrant existing = grantsByLogin.get(candidate.login());
			if (existing == null) {
				grantsByLogin.put(candidate.login(), candidate);
				continue;
			}
			PlannedGrant kept = candidate.level().isStrongerThan(existing.level()) ? candidate : existing;
			logger.warn("{} and {} both resolve to login {} on {}; granting the stronger {}", existing.email(),
					candidate.email(), candidate.login(), target, kept.level());
			grantsByLogin.put(kept.login(), kept);
			tally.skipped++;
		}

		for (PlannedGrant grant : grantsByLogin.values()) {
			applyToCollaborator(target, grant.login(), grant.email(), grant.level().gitHubPermission(), dryRun, tally);
		}
	}

	private void applyToCollaborator(GitHubTarget target, String login, String email, String gitHubPermission,
			boolean dryRun, Tally tally) {
		Optional<String> current;
		try {
			current = restService.getCollaboratorPermission(target.org(), target.repo(), login);
		}
		catch (IOException e) {
			logger.debug("Could not read current permission of {} on {}: {}", login, target, e.getMessage());
			current = Optional.empty();
		}

		if (current.isPresent() && current.get().equals(gitHubPermission)) {
			logger.info("{} already has {} on {}", login, gitHubPermission, target);
			tally.unchanged++;
			return;
		}

		if (dryRun) {
			logger.info("Dry-run: would add/update {} on {} with {} (from {})", login, target, gitHubPermission,
					email);
			tally.planned++;
			return;
		}

		try {
			restService.addCollaborator(target.org(), target.repo(), login, gitHubPermission);
			logger.info("Granted {} to {} on {}", gitHubPermission, login, target);
			tally.granted++;
		}
		catch (IOException e) {
			logger.error("Failed to add {} to {} with {}: {}", login, target, gitHubPermission, e.getMessage());
			tally.failed++;
		}
	}

	private void logRateLimit() {
		try {
			GHRateLimit.Record core = restService.getRateLimit().getCore();
			logger.info("GitHub rate limit: {}/{} requests remaining, resets at {}", core.getRemaining(),
					core.getLimit(), core.getResetDate());
		}
		catch (IOException e) {
			logger.warn("Could not read GitHub rate limit: {}", e.getMessage());
		}
	}

	private static Optional<String> resolveLogin(String email, IdentityMapping mapping) {
		Optional<String> mapped = mapping.mappedLogin(email);
		if (mapped.isPresent()) {
			return mapped;
		}
		Optional<String> fallback = mapping.defaultLogin();
		if (fallback.isPresent()) {
			logger.warn("No mapping for {}; using default login {}", email, fallback.get());
		}
		else {
			logger.warn("No mapping for {}; skipping", email);
		}
		return fallback;
	}

	private record PlannedGrant(String login, String email, PermissionLevel level) {
	}

	private static final class Tally {

		int granted;

		int unchanged;

		int skipped;

		int failed;

		int planned;

		ApplyResult toResult() {
			return new ApplyResult(granted, unchanged, skipped, failed, planned);
		}

	}

}
