package org.springaicommunity.permissionsync;

/**
 * Outcome of an apply run, counted per effective permission row.
 *
 * @param granted collaborators added or updated
 * @param unchanged collaborators already at the target permission
 * @param skipped rows without a login mapping, with an unknown permission or without a
 * repository
 * @param failed rows whose repository was not accessible or whose update failed
 * @param dryRunPlanned grants a dry run would have made
 */
public record ApplyResult(int granted, int unchanged, int skipped, int failed, int dryRunPlanned) {

	public int total() {
		return granted + unchanged + skipped + failed + dryRunPlanned;
	}

	public boolean hasFailures() {
		return failed > 0;
	}

}
