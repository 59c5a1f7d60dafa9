package org.springaicommunity.permissionsync;

import java.nio.file.Path;
import java.util.List;

/**
 * Repository interface for the CSV files exchanged between the pipeline phases.
 *
 * <p>
 * Abstracts file system operations to enable testability of the phase services.
 */
public interface PermissionCsvRepository {

	List<UserPermissionRow> readUserPermissions(Path file);

	List<GroupPermissionRow> readGroupPermissions(Path file);

	List<GroupMemberRow> readGroupMembers(Path file);

	List<EffectivePermissionRow> readEffectivePermissions(Path file);

	List<LoginMappingRow> readLoginMappings(Path file);

	void writeUserPermissions(Path file, List<UserPermissionRow> rows);

	void writeGroupPermissions(Path file, List<GroupPermissionRow> rows);

	void writeGroupMembers(Path file, List<GroupMemberRow> rows);

	void writeEffectivePermissions(Path file, List<EffectivePermissionRow> rows);

}
