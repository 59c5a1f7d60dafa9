package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Outcome of an expand run.
 *
 * @param rowsWritten number of effective permission rows, written or planned
 * @param diagnostics boundary and engine diagnostics, in the order they were found
 */
public record ExpansionResult(int rowsWritten, List<Diagnostic> diagnostics) {

	public ExpansionResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public long warningCount() {
		return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.WARN).count();
	}

}
