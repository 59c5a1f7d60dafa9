package org.springaicommunity.permissionsync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link PermissionResolutionEngine} covering the end-to-end pipeline.
 */
@DisplayName("PermissionResolutionEngine Tests")
class PermissionResolutionEngineTest {

	private static final RepositoryKey REPO1 = new RepositoryKey("PROJ", "repo1");

	private static final RepositoryKey REPO2 = new RepositoryKey("PROJ", "repo2");

	private static final RepositoryKey OTHER = new RepositoryKey("OPS", "infra");

	private PermissionResolutionEngine engine;

	@BeforeEach
	void setUp() {
		engine = new PermissionResolutionEngine();
	}

	@Nested
	@DisplayName("Example Scenario Tests")
	class ExampleScenarioTest {

		@Test
		@DisplayName("Group ADMIN should beat direct WRITE and reach every member")
		void shouldResolveExampleScenario() {
			List<DirectGrant> direct = List
				.of(DirectGrant.of(REPO1, "alice", "alice@example.com", PermissionLevel.WRITE));
			List<GroupGrant> group = List.of(GroupGrant.of(REPO1, "devs", PermissionLevel.ADMIN));
			List<Membership> memberships = List.of(new Membership("devs", "alice", "alice@example.com"),
					new Membership("devs", "bob", "bob@example.com"));

			ResolutionResult result = engine.resolve(direct, group, memberships);

			assertThat(result.permissions()).containsExactly(
					EffectivePermission.fromGroup(REPO1, "alice@example.com", PermissionLevel.ADMIN, "devs"),
					EffectivePermission.fromGroup(REPO1, "bob@example.com", PermissionLevel.ADMIN, "devs"));
			assertThat(result.diagnostics()).isEmpty();
		}

		@Test
		@DisplayName("Should match direct and group identities by email regardless of case")
		void shouldMatchEmailsCaseInsensitively() {
			List<DirectGrant> direct = List
				.of(DirectGrant.of(REPO1, "alice", "Alice@Example.com", PermissionLevel.ADMIN));
			List<GroupGrant> group = List.of(GroupGrant.of(REPO1, "devs", PermissionLevel.READ));
			List<Membership> memberships = List.of(new Membership("devs", "alice.s", " ALICE@example.com "));

			ResolutionResult result = engine.resolve(direct, group, memberships);

			assertThat(result.permissions())
				.containsExactly(EffectivePermission.direct(REPO1, "alice@example.com", PermissionLevel.ADMIN));
		}

	}

	@Nested
	@DisplayName("Property Tests")
	class PropertyTest {

		@Test
		@DisplayName("Should produce the same set for any input permutation")
		void shouldBeDeterministicUnderPermutation() {
			List<DirectGrant> direct = new ArrayList<>(sampleDirect());
			List<GroupGrant> group = new ArrayList<>(sampleGroup());
			List<Membership> memberships = new ArrayList<>(sampleMemberships());
			ResolutionResult expected = engine.resolve(direct, group, memberships);

			Random random = new Random(7);
			for (int i = 0; i < 25; i++) {
				Collections.shuffle(direct, random);
				Collections.shuffle(group, random);
				Collections.shuffle(memberships, random);

				ResolutionResult result = engine.resolve(direct, group, memberships);

				assertThat(new HashSet<>(result.permissions())).isEqualTo(new HashSet<>(expected.permissions()));
			}
		}

		@Test
		@DisplayName("Should produce exactly one permission per repository and email")
		void shouldProduceUniquePairs() {
			ResolutionResult result = engine.resolve(sampleDirect(), sampleGroup(), sampleMemberships());

			List<EffectivePermission.Key> keys = result.permissions().stream().map(EffectivePermission::key).toList();
			assertThat(keys).doesNotHaveDuplicates();
			assertThat(keys).isSorted();
		}

		@Test
		@DisplayName("Should pick the maximum candidate level")
		void shouldPickMaximumLevel() {
			ResolutionResult result = engine.resolve(sampleDirect(), sampleGroup(), sampleMemberships());

			assertThat(result.permissions()).contains(
					EffectivePermission.fromGroup(REPO2, "bob@example.com", PermissionLevel.ADMIN, "admins"),
					EffectivePermission.direct(REPO2, "carol@example.com", PermissionLevel.WRITE),
					EffectivePermission.fromGroup(OTHER, "alice@example.com", PermissionLevel.READ, "devs"));
		}

		@Test
		@DisplayName("Should report direct source when direct and group levels tie")
		void shouldPreferDirectOnTie() {
			List<DirectGrant> direct = List
				.of(DirectGrant.of(REPO1, "alice", "alice@example.com", PermissionLevel.WRITE));
			List<GroupGrant> group = List.of(GroupGrant.of(REPO1, "devs", PermissionLevel.WRITE));
			List<Membership> memberships = List.of(new Membership("devs", "alice", "alice@example.com"));

			ResolutionResult result = engine.resolve(direct, group, memberships);

			assertThat(result.permissions()).singleElement().satisfies(p -> {
				assertThat(p.source()).isEqualTo(GrantSource.DIRECT);
				assertThat(p.permission()).isEqualTo(PermissionLevel.WRITE);
			});
		}

		@Test
		@DisplayName("Duplicate membership rows should not change the output")
		void shouldBeIdempotentOverDuplicateMemberships() {
			List<Membership> duplicated = new ArrayList<>(sampleMemberships());
			duplicated.addAll(sampleMemberships());

			ResolutionResult once = engine.resolve(sampleDirect(), sampleGroup(), sampleMemberships());
			ResolutionResult twice = engine.resolve(sampleDirect(), sampleGroup(), duplicated);

			assertThat(twice.permissions()).isEqualTo(once.permissions());
		}

		@Test
		@DisplayName("A direct grant without email should yield no row and one diagnostic")
		void shouldExcludeMissingEmail() {
			List<DirectGrant> direct = List.of(DirectGrant.of(REPO1, "ghost", "", PermissionLevel.ADMIN),
					DirectGrant.of(REPO1, "alice", "alice@example.com", PermissionLevel.READ));

			ResolutionResult result = engine.resolve(direct, List.of(), List.of());

			assertThat(result.permissions()).extracting(EffectivePermission::email)
				.containsExactly("alice@example.com");
			assertThat(result.diagnosticsOfKind(Diagnostic.Kind.SKIPPED_MISSING_EMAIL)).hasSize(1);
			assertThat(result.diagnostics()).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Diagnostics Tests")
	class DiagnosticsTest {

		@Test
		@DisplayName("Should report empty groups and repositories without output")
		void shouldReportEmptyGroupAndZeroOutput() {
			List<GroupGrant> group = List.of(GroupGrant.of(REPO1, "ghosts", PermissionLevel.WRITE));

			ResolutionResult result = engine.resolve(List.of(), group, List.of());

			assertThat(result.permissions()).isEmpty();
			assertThat(result.diagnostics()).extracting(Diagnostic::kind)
				.containsExactly(Diagnostic.Kind.EMPTY_GROUP, Diagnostic.Kind.ZERO_OUTPUT_REPOSITORY);
		}

		@Test
		@DisplayName("Should propagate a consistency failure from the validator")
		void shouldPropagateConsistencyFailure() {
			StrongestWinsReducer brokenReducer = mock(StrongestWinsReducer.class);
			EffectivePermission duplicate = EffectivePermission.direct(REPO1, "alice@example.com",
					PermissionLevel.READ);
			when(brokenReducer.reduce(anyCollection())).thenReturn(List.of(duplicate, duplicate));
			PermissionResolutionEngine brokenEngine = new PermissionResolutionEngine(new IdentityNormalizer(),
					new GroupExpansionJoin(), brokenReducer, new ResolutionValidator());

			assertThatThrownBy(() -> brokenEngine.resolve(
					List.of(DirectGrant.of(REPO1, "alice", "alice@example.com", PermissionLevel.READ)), List.of(),
					List.of()))
				.isInstanceOf(ResolutionConsistencyException.class);
		}

	}

	@Nested
	@DisplayName("Partitioned Resolution Tests")
	class PartitionedResolutionTest {

		private ExecutorService executor;

		@BeforeEach
		void setUp() {
			executor = Executors.newFixedThreadPool(4);
		}

		@AfterEach
		void tearDown() {
			executor.shutdownNow();
		}

		@Test
		@DisplayName("Should produce the same permissions as sequential resolution")
		void shouldMatchSequentialResolution() {
			ResolutionResult sequential = engine.resolve(sampleDirect(), sampleGroup(), sampleMemberships());

			ResolutionResult partitioned = engine.resolvePartitioned(sampleDirect(), sampleGroup(),
					sampleMemberships(), executor);

			assertThat(partitioned.permissions()).isEqualTo(sequential.permissions());
		}

		@Test
		@DisplayName("Should report membership diagnostics once")
		void shouldReportMembershipDiagnosticsOnce() {
			List<Membership> memberships = new ArrayList<>(sampleMemberships());
			memberships.add(new Membership("devs", "nomail", ""));

			ResolutionResult partitioned = engine.resolvePartitioned(sampleDirect(), sampleGroup(), memberships,
					executor);

			assertThat(partitioned.diagnosticsOfKind(Diagnostic.Kind.SKIPPED_MISSING_EMAIL)).hasSize(1);
		}

	}

	private static List<DirectGrant> sampleDirect() {
		return List.of(DirectGrant.of(REPO1, "alice", "alice@example.com", PermissionLevel.WRITE),
				DirectGrant.of(REPO2, "bob", "bob@example.com", PermissionLevel.READ),
				DirectGrant.of(REPO2, "carol", "carol@example.com", PermissionLevel.WRITE));
	}

	private static List<GroupGrant> sampleGroup() {
		return List.of(GroupGrant.of(REPO1, "devs", PermissionLevel.ADMIN),
				GroupGrant.of(REPO2, "admins", PermissionLevel.ADMIN), GroupGrant.of(REPO2, "devs", PermissionLevel.READ),
				GroupGrant.of(OTHER, "devs", PermissionLevel.READ));
	}

	private static List<Membership> sampleMemberships() {
		return List.of(new Membership("devs", "alice", "alice@example.com"),
				new Membership("devs", "carol", "carol@example.com"),
				new Membership("admins", "bob", "bob@example.com"));
	}

}
