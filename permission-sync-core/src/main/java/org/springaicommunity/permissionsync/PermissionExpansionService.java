package org.springaicommunity.permissionsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands extracted group permissions into effective per-user permissions.
 *
 * <p>
 * Reads the three extract files, translates them with {@link GrantRowMapper}, resolves
 * them with {@link PermissionResolutionEngine} and writes
 * {@code effective_repo_user_permissions.csv}. Diagnostics are logged at their severity
 * and returned to the caller; a {@link ResolutionConsistencyException} is propagated and
 * nothing is written.
 */
public class PermissionExpansionService {

	private static final Logger logger = LoggerFactory.getLogger(PermissionExpansionService.class);

	private final PermissionCsvRepository csvRepository;

	private final GrantRowMapper rowMapper;

	private final PermissionResolutionEngine engine;

	public PermissionExpansionService(PermissionCsvRepository csvRepository, GrantRowMapper rowMapper,
			PermissionResolutionEngine engine) {
		this.csvRepository = csvRepository;
		this.rowMapper = rowMapper;
		this.engine = engine;
	}

	public ExpansionResult expand(ExpansionRequest request) {
		List<UserPermissionRow> userRows = csvRepository.readUserPermissions(request.userPermissions());
		List<GroupPermissionRow> groupRows = csvRepository.readGroupPermissions(request.groupPermissions());
		List<GroupMemberRow> memberRows = csvRepository.readGroupMembers(request.groupMembers());
		logger.info("Loaded {} user permissions, {} group permissions, {} group members", userRows.size(),
				groupRows.size(), memberRows.size());

		MappedGrants grants = rowMapper.toGrants(userRows, groupRows, memberRows);
		ResolutionResult result = engine.resolve(grants.directGrants(), grants.groupGrants(), grants.memberships());

		List<Diagnostic> diagnostics = new ArrayList<>(grants.diagnostics());
		diagnostics.addAll(result.diagnostics());
		diagnostics.forEach(PermissionExpansionService::log);

		List<EffectivePermissionRow> rows = rowMapper.toRows(result.permissions());
		if (request.dryRun()) {
			logger.info("Dry-run: would write {} effective permissions to {}", rows.size(), request.output());
		}
		else {
			csvRepository.writeEffectivePermissions(request.output(), rows);
			logger.info("Wrote {} effective permissions to {}", rows.size(), request.output());
		}
		return new ExpansionResult(rows.size(), diagnostics);
	}

	private static void log(Diagnostic diagnostic) {
		if (diagnostic.severity() == Diagnostic.Severity.WARN) {
			logger.warn(diagnostic.message());
		}
		else {
			logger.info(diagnostic.message());
		}
	}

}
