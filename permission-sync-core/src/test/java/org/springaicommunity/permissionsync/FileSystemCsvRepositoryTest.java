package org.springaicommunity.permissionsync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemCsvRepository}.
 */
@DisplayName("FileSystemCsvRepository Tests")
class FileSystemCsvRepositoryTest {

	@TempDir
	Path tempDir;

	private FileSystemCsvRepository repository;

	@BeforeEach
	void setUp() {
		repository = new FileSystemCsvRepository(ObjectMapperFactory.createCsvMapper());
	}

	@Nested
	@DisplayName("Read Tests")
	class ReadTest {

		@Test
		@DisplayName("Should match columns by header name")
		void shouldMatchColumnsByHeader() throws Exception {
			Path file = tempDir.resolve("repo_user_permissions.csv");
			Files.writeString(file, """
					permission,email,principal,repo_slug,project_key,principal_type,extra
					REPO_WRITE,alice@example.com,alice,repo1,PROJ,user,ignored
					""");

			List<UserPermissionRow> rows = repository.readUserPermissions(file);

			assertThat(rows).containsExactly(
					UserPermissionRow.of("PROJ", "repo1", "alice", "alice@example.com", "REPO_WRITE"));
		}

		@Test
		@DisplayName("Should read empty and missing columns as empty strings")
		void shouldReadMissingColumnsAsEmpty() throws Exception {
			Path file = tempDir.resolve("group_members.csv");
			Files.writeString(file, """
					group,user
					devs,bob
					""");

			List<GroupMemberRow> rows = repository.readGroupMembers(file);

			assertThat(rows).containsExactly(new GroupMemberRow("devs", "bob", ""));
		}

		@Test
		@DisplayName("Should read quoted values containing commas")
		void shouldReadQuotedValues() throws Exception {
			Path file = tempDir.resolve("repo_group_permissions.csv");
			Files.writeString(file, """
					project_key,repo_slug,principal_type,principal,permission
					PROJ,repo1,group,"Devs, Europe",REPO_READ
					""");

			List<GroupPermissionRow> rows = repository.readGroupPermissions(file);

			assertThat(rows).singleElement().extracting(GroupPermissionRow::principal).isEqualTo("Devs, Europe");
		}

		@Test
		@DisplayName("Should read the login mapping file")
		void shouldReadLoginMappings() throws Exception {
			Path file = tempDir.resolve("mapping.csv");
			Files.writeString(file, """
					email,github_login
					Alice@Example.com,alice-gh
					""");

			assertThat(repository.readLoginMappings(file))
				.containsExactly(new LoginMappingRow("Alice@Example.com", "alice-gh"));
		}

		@Test
		@DisplayName("Should name the file when it cannot be read")
		void shouldFailOnMissingFile() {
			Path missing = tempDir.resolve("missing.csv");

			assertThatThrownBy(() -> repository.readEffectivePermissions(missing))
				.isInstanceOf(UncheckedIOException.class)
				.hasMessageContaining("missing.csv");
		}

	}

	@Nested
	@DisplayName("Write Tests")
	class WriteTest {

		@Test
		@DisplayName("Should write the effective permissions header and rows")
		void shouldWriteEffectivePermissions() throws Exception {
			Path file = tempDir.resolve("out/effective_repo_user_permissions.csv");

			repository.writeEffectivePermissions(file,
					List.of(new EffectivePermissionRow("PROJ", "repo1", "alice@example.com", "ADMIN", "group", "devs"),
							new EffectivePermissionRow("PROJ", "repo1", "bob@example.com", "READ", "direct", "")));

			assertThat(Files.readAllLines(file)).containsExactly(
					"project_key,repo_slug,email,permission,source,source_principal",
					"PROJ,repo1,alice@example.com,ADMIN,group,devs", "PROJ,repo1,bob@example.com,READ,direct,");
		}

		@Test
		@DisplayName("Should write only the header when there are no rows")
		void shouldWriteHeaderOnly() throws Exception {
			Path file = tempDir.resolve("group_members.csv");

			repository.writeGroupMembers(file, List.of());

			assertThat(Files.readAllLines(file)).containsExactly("group,user,email");
			assertThat(repository.readGroupMembers(file)).isEmpty();
		}

		@Test
		@DisplayName("Should write rows the reader accepts")
		void shouldWriteReadableRows() {
			Path file = tempDir.resolve("repo_group_permissions.csv");
			List<GroupPermissionRow> rows = List.of(GroupPermissionRow.of("PROJ", "repo1", "Devs, Europe", "REPO_READ"));

			repository.writeGroupPermissions(file, rows);

			assertThat(repository.readGroupPermissions(file)).isEqualTo(rows);
		}

	}

}
