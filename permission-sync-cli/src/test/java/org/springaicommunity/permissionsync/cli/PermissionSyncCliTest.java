package org.springaicommunity.permissionsync.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.permissionsync.ArgumentParser;
import org.springaicommunity.permissionsync.SyncProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the CLI in-process. Only the expand command is exercised end to end since it needs
 * no network access.
 */
@DisplayName("PermissionSyncCli Tests")
class PermissionSyncCliTest {

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("Should print help and succeed without a command")
	void shouldPrintHelp() {
		assertThat(PermissionSyncCli.run(new String[] {})).isZero();
		assertThat(PermissionSyncCli.run(new String[] { "expand", "--help" })).isZero();
	}

	@Test
	@DisplayName("Should fail on invalid arguments")
	void shouldFailOnInvalidArguments() {
		assertThat(PermissionSyncCli.run(new String[] { "expand", "--bogus" })).isEqualTo(1);
		assertThat(PermissionSyncCli.run(new String[] { "expand", "--user-permissions", "u.csv" })).isEqualTo(1);
	}

	@Test
	@DisplayName("Should fail apply without organization or token")
	void shouldFailApplyWithoutSettings() {
		SyncProperties properties = new SyncProperties();
		ArgumentParser parser = new ArgumentParser(properties, Map.<String, String>of()::get);

		assertThat(PermissionSyncCli.run(new String[] { "apply" }, parser, properties)).isEqualTo(1);
	}

	@Test
	@DisplayName("Should fail when an input file is missing")
	void shouldFailOnMissingInput() {
		String[] args = { "expand", "--user-permissions", tempDir.resolve("missing.csv").toString(),
				"--group-permissions", tempDir.resolve("missing.csv").toString(), "--group-members",
				tempDir.resolve("missing.csv").toString(), "--output", tempDir.resolve("out.csv").toString() };

		assertThat(PermissionSyncCli.run(args)).isEqualTo(1);
		assertThat(tempDir.resolve("out.csv")).doesNotExist();
	}

	@Test
	@DisplayName("Should expand group permissions into the effective permissions file")
	void shouldExpand() throws Exception {
		Path users = Files.writeString(tempDir.resolve("repo_user_permissions.csv"), """
				project_key,repo_slug,principal_type,principal,email,permission
				PROJ,repo1,user,alice,alice@example.com,REPO_READ
				PROJ,repo2,user,carol,,REPO_WRITE
				""");
		Path groups = Files.writeString(tempDir.resolve("repo_group_permissions.csv"), """
				project_key,repo_slug,principal_type,principal,permission
				PROJ,repo1,group,devs,REPO_WRITE
				PROJ,repo1,group,admins,REPO_ADMIN
				""");
		Path members = Files.writeString(tempDir.resolve("group_members.csv"), """
				group,user,email
				devs,alice,alice@example.com
				devs,bob,BOB@example.com
				admins,bob,bob@example.com
				""");
		Path output = tempDir.resolve("result/effective.csv");

		int exitCode = PermissionSyncCli.run(new String[] { "expand", "--user-permissions", users.toString(),
				"--group-permissions", groups.toString(), "--group-members", members.toString(), "--output",
				output.toString(), "--verbose" });

		assertThat(exitCode).isZero();
		assertThat(Files.readAllLines(output)).containsExactly(
				"project_key,repo_slug,email,permission,source,source_principal",
				"PROJ,repo1,alice@example.com,WRITE,group,devs", "PROJ,repo1,bob@example.com,ADMIN,group,admins");
	}

	@Test
	@DisplayName("Should not write the output on a dry run")
	void shouldNotWriteOnDryRun() throws Exception {
		Path users = Files.writeString(tempDir.resolve("u.csv"), "project_key,repo_slug,principal,email,permission\n");
		Path groups = Files.writeString(tempDir.resolve("g.csv"), "project_key,repo_slug,principal,permission\n");
		Path members = Files.writeString(tempDir.resolve("m.csv"), "group,user,email\n");
		Path output = tempDir.resolve("effective.csv");

		int exitCode = PermissionSyncCli.run(new String[] { "expand", "--user-permissions", users.toString(),
				"--group-permissions", groups.toString(), "--group-members", members.toString(), "--output",
				output.toString(), "-d" });

		assertThat(exitCode).isZero();
		assertThat(output).doesNotExist();
	}

}
