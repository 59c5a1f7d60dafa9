package org.springaicommunity.permissionsync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GrantExtractionService Tests")
@ExtendWith(MockitoExtension.class)
class GrantExtractionServiceTest {

	private static final Path OUT = Path.of("out");

	private static final BitbucketUser ALICE = new BitbucketUser("alice", "alice", "alice@example.com", "Alice");

	private static final BitbucketUser BOB_WITHOUT_EMAIL = new BitbucketUser("bob", "bob", null, "Bob");

	@Mock
	private BitbucketService mockBitbucket;

	@Mock
	private PermissionCsvRepository mockCsvRepository;

	private GrantExtractionService service;

	@BeforeEach
	void setUp() {
		service = new GrantExtractionService(mockBitbucket, mockCsvRepository, new SyncProperties());
	}

	private void givenOneRepository() {
		when(mockBitbucket.getProjects(List.of())).thenReturn(List.of(new BitbucketProject("PROJ", "Project")));
		when(mockBitbucket.getRepositories("PROJ", List.of()))
			.thenReturn(List.of(new BitbucketRepository("PROJ", "repo1", "Repo 1")));
		when(mockBitbucket.getRepositoryUserPermissions("PROJ", "repo1"))
			.thenReturn(List.of(new UserPermissionEntry(ALICE, "REPO_WRITE"),
					new UserPermissionEntry(BOB_WITHOUT_EMAIL, "REPO_READ")));
		when(mockBitbucket.getRepositoryGroupPermissions("PROJ", "repo1"))
			.thenReturn(List.of(new GroupPermissionEntry("devs", "REPO_ADMIN")));
		when(mockBitbucket.getGroupMembers("devs")).thenReturn(List.of(ALICE, BOB_WITHOUT_EMAIL));
		when(mockBitbucket.getUser("bob")).thenReturn(Optional.of(BOB_WITHOUT_EMAIL.withEmail("bob@example.com")));
	}

	@Test
	@SuppressWarnings("unchecked")
	@DisplayName("Should write the three extract files")
	void shouldWriteExtractFiles() {
		givenOneRepository();

		ExtractionResult result = service.extract(new ExtractionRequest(OUT, List.of(), List.of(), false));

		ArgumentCaptor<List<UserPermissionRow>> users = ArgumentCaptor.forClass(List.class);
		ArgumentCaptor<List<GroupPermissionRow>> groups = ArgumentCaptor.forClass(List.class);
		ArgumentCaptor<List<GroupMemberRow>> members = ArgumentCaptor.forClass(List.class);
		verify(mockCsvRepository).writeUserPermissions(eq(OUT.resolve("repo_user_permissions.csv")), users.capture());
		verify(mockCsvRepository).writeGroupPermissions(eq(OUT.resolve("repo_group_permissions.csv")),
				groups.capture());
		verify(mockCsvRepository).writeGroupMembers(eq(OUT.resolve("group_members.csv")), members.capture());

		assertThat(users.getValue()).containsExactly(
				UserPermissionRow.of("PROJ", "repo1", "alice", "alice@example.com", "REPO_WRITE"),
				UserPermissionRow.of("PROJ", "repo1", "bob", "bob@example.com", "REPO_READ"));
		assertThat(groups.getValue()).containsExactly(GroupPermissionRow.of("PROJ", "repo1", "devs", "REPO_ADMIN"));
		assertThat(members.getValue()).containsExactly(new GroupMemberRow("devs", "alice", "alice@example.com"),
				new GroupMemberRow("devs", "bob", "bob@example.com"));
		assertThat(result).isEqualTo(new ExtractionResult(1, 1, 2, 1, 2,
				List.of(OUT.resolve("repo_user_permissions.csv").toString(),
						OUT.resolve("repo_group_permissions.csv").toString(),
						OUT.resolve("group_members.csv").toString())));
	}

	@Test
	@DisplayName("Should look up a missing email once per run")
	void shouldCacheEmailLookups() {
		givenOneRepository();

		service.extract(new ExtractionRequest(OUT, List.of(), List.of(), false));

		verify(mockBitbucket, times(1)).getUser("bob");
		verify(mockBitbucket, never()).getUser("alice");
	}

	@Test
	@SuppressWarnings("unchecked")
	@DisplayName("Should leave the email empty when the lookup fails")
	void shouldLeaveEmailEmptyWhenUnknown() {
		when(mockBitbucket.getProjects(List.of("PROJ"))).thenReturn(List.of(new BitbucketProject("PROJ", "Project")));
		when(mockBitbucket.getRepositories("PROJ", List.of("repo1")))
			.thenReturn(List.of(new BitbucketRepository("PROJ", "repo1", "Repo 1")));
		when(mockBitbucket.getRepositoryUserPermissions("PROJ", "repo1"))
			.thenReturn(List.of(new UserPermissionEntry(BOB_WITHOUT_EMAIL, "REPO_READ")));
		when(mockBitbucket.getRepositoryGroupPermissions("PROJ", "repo1")).thenReturn(List.of());
		when(mockBitbucket.getUser("bob")).thenReturn(Optional.empty());

		service.extract(new ExtractionRequest(OUT, List.of("PROJ"), List.of("repo1"), false));

		ArgumentCaptor<List<UserPermissionRow>> users = ArgumentCaptor.forClass(List.class);
		verify(mockCsvRepository).writeUserPermissions(any(), users.capture());
		assertThat(users.getValue()).singleElement().extracting(UserPermissionRow::email).isEqualTo("");
		verify(mockBitbucket, never()).getGroupMembers(anyString());
		verify(mockCsvRepository).writeGroupMembers(any(), eq(List.of()));
	}

	@Test
	@DisplayName("Should write nothing on a dry run")
	void shouldNotWriteOnDryRun() {
		givenOneRepository();

		ExtractionResult result = service.extract(new ExtractionRequest(OUT, List.of(), List.of(), true));

		assertThat(result.userPermissionRows()).isEqualTo(2);
		assertThat(result.files()).isEmpty();
		verifyNoInteractions(mockCsvRepository);
	}

}
