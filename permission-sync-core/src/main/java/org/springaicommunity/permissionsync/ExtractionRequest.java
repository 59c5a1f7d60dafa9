package org.springaicommunity.permissionsync;

import java.nio.file.Path;
import java.util.List;

/**
 * Parameters of an extract run.
 *
 * @param outputDir directory receiving the three CSV files
 * @param projectKeys projects to extract, empty for all
 * @param repoSlugs repository slugs to extract, empty for all
 * @param dryRun if true, nothing is written
 */
public record ExtractionRequest(Path outputDir, List<String> projectKeys, List<String> repoSlugs, boolean dryRun) {

	public ExtractionRequest {
		projectKeys = List.copyOf(projectKeys);
		repoSlugs = List.copyOf(repoSlugs);
	}

}
