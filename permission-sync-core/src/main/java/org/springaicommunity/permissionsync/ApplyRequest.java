package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Parameters of an apply run.
 *
 * @param org target GitHub organization
 * @param effectiveCsv the effective permissions CSV produced by the expand phase
 * @param mappingCsv optional email to GitHub login mapping CSV
 * @param defaultLogin optional login used for emails without a mapping
 * @param dryRun if true, no collaborator is added or updated
 */
public record ApplyRequest(String org, Path effectiveCsv, @Nullable Path mappingCsv, @Nullable String defaultLogin,
		boolean dryRun) {

	public ApplyRequest {
		if (org == null || org.isBlank()) {
			throw new IllegalArgumentException("GitHub organization is required");
		}
	}

}
