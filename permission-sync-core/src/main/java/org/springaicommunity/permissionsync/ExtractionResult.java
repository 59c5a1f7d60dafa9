package org.springaicommunity.permissionsync;

import java.util.List;

/**
 * Outcome of an extract run.
 *
 * @param projects number of projects visited
 * @param repositories number of repositories visited
 * @param userPermissionRows direct user permission rows extracted
 * @param groupPermissionRows group permission rows extracted
 * @param groupMemberRows group member rows extracted
 * @param files files written, empty on a dry run
 */
public record ExtractionResult(int projects, int repositories, int userPermissionRows, int groupPermissionRows,
		int groupMemberRows, List<String> files) {
}
