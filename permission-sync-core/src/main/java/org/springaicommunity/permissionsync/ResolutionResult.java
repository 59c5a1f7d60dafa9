package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Output of one resolution run.
 *
 * @param permissions exactly one effective permission per (repository, email), sorted by
 * repository then email
 * @param diagnostics recoverable problems found along the way
 */
public record ResolutionResult(List<EffectivePermission> permissions, List<Diagnostic> diagnostics) {

	public ResolutionResult {
		permissions = List.copyOf(permissions);
		diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> diagnosticsOfKind(Diagnostic.Kind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

}
