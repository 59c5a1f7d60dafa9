package org.springaicommunity.permissionsync;

import java.nio.file.Path;

/**
 * Parameters of an expand run.
 *
 * @param userPermissions the direct user permissions CSV
 * @param groupPermissions the group permissions CSV
 * @param groupMembers the group members CSV
 * @param output the effective permissions CSV to write
 * @param dryRun if true, the output file is not written
 */
public record ExpansionRequest(Path userPermissions, Path groupPermissions, Path groupMembers, Path output,
		boolean dryRun) {
}
