package org.springaicommunity.permissionsync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GrantRowMapper Tests")
class GrantRowMapperTest {

	private static final RepositoryKey REPO = new RepositoryKey("PROJ", "repo1");

	private GrantRowMapper mapper;

	@BeforeEach
	void setUp() {
		mapper = new GrantRowMapper();
	}

	@Nested
	@DisplayName("Row To Grant Tests")
	class RowToGrantTest {

		@Test
		@DisplayName("Should translate Bitbucket permission names at the boundary")
		void shouldTranslatePermissions() {
			MappedGrants grants = mapper.toGrants(
					List.of(UserPermissionRow.of("PROJ", "repo1", "alice", "alice@example.com", "REPO_WRITE")),
					List.of(GroupPermissionRow.of("PROJ", "repo1", "devs", "REPO_ADMIN")),
					List.of(new GroupMemberRow("devs", "bob", "bob@example.com")));

			assertThat(grants.directGrants())
				.containsExactly(DirectGrant.of(REPO, "alice", "alice@example.com", PermissionLevel.WRITE));
			assertThat(grants.groupGrants()).containsExactly(GroupGrant.of(REPO, "devs", PermissionLevel.ADMIN));
			assertThat(grants.memberships()).containsExactly(new Membership("devs", "bob", "bob@example.com"));
			assertThat(grants.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Should exclude and report rows with an unknown permission")
		void shouldReportUnknownPermission() {
			MappedGrants grants = mapper.toGrants(
					List.of(UserPermissionRow.of("PROJ", "repo1", "alice", "alice@example.com", "PROJECT_ADMIN")),
					List.of(GroupPermissionRow.of("PROJ", "repo1", "devs", "")), List.of());

			assertThat(grants.directGrants()).isEmpty();
			assertThat(grants.groupGrants()).isEmpty();
			assertThat(grants.diagnostics()).extracting(Diagnostic::kind)
				.containsExactly(Diagnostic.Kind.UNKNOWN_PERMISSION, Diagnostic.Kind.UNKNOWN_PERMISSION);
			assertThat(grants.diagnostics().get(0).message()).contains("PROJECT_ADMIN").contains("alice");
			assertThat(grants.diagnostics().get(1).group()).isEqualTo("devs");
		}

		@Test
		@DisplayName("Should exclude and report rows without a repository")
		void shouldReportMalformedRows() {
			MappedGrants grants = mapper.toGrants(
					List.of(UserPermissionRow.of("", "repo1", "alice", "alice@example.com", "REPO_READ")),
					List.of(GroupPermissionRow.of("PROJ", " ", "devs", "REPO_READ")), List.of());

			assertThat(grants.directGrants()).isEmpty();
			assertThat(grants.groupGrants()).isEmpty();
			assertThat(grants.diagnostics()).extracting(Diagnostic::kind)
				.containsExactly(Diagnostic.Kind.MALFORMED_ROW, Diagnostic.Kind.MALFORMED_ROW);
		}

		@Test
		@DisplayName("Should pass rows without email through to the engine")
		void shouldKeepMissingEmailForEngine() {
			MappedGrants grants = mapper.toGrants(
					List.of(UserPermissionRow.of("PROJ", "repo1", "ghost", "", "REPO_READ")), List.of(), List.of());

			assertThat(grants.directGrants()).hasSize(1);
			assertThat(grants.diagnostics()).isEmpty();
		}

	}

	@Test
	@DisplayName("Should write canonical level names and source labels")
	void shouldConvertToRows() {
		List<EffectivePermissionRow> rows = mapper.toRows(List.of(
				EffectivePermission.fromGroup(REPO, "bob@example.com", PermissionLevel.ADMIN, "devs"),
				EffectivePermission.direct(REPO, "alice@example.com", PermissionLevel.WRITE)));

		assertThat(rows).containsExactly(
				new EffectivePermissionRow("PROJ", "repo1", "bob@example.com", "ADMIN", "group", "devs"),
				new EffectivePermissionRow("PROJ", "repo1", "alice@example.com", "WRITE", "direct", ""));
	}

}
