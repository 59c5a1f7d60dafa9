package org.springaicommunity.permissionsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts repository permissions and group membership from Bitbucket Data Center into
 * the CSV files consumed by {@link PermissionExpansionService}.
 *
 * <p>
 * Users whose email is not included in a listing are looked up individually; lookups are
 * cached for the duration of one run. Members are exported only for groups that hold a
 * permission on at least one extracted repository.
 */
public class GrantExtractionService {

	private static final Logger logger = LoggerFactory.getLogger(GrantExtractionService.class);

	private final BitbucketService bitbucketService;

	private final PermissionCsvRepository csvRepository;

	private final SyncProperties properties;

	public GrantExtractionService(BitbucketService bitbucketService, PermissionCsvRepository csvRepository,
			SyncProperties properties) {
		this.bitbucketService = bitbucketService;
		this.csvRepository = csvRepository;
		this.properties = properties;
	}

	public ExtractionResult extract(ExtractionRequest request) {
		Map<String, Optional<String>> emailCache = new HashMap<>();

		List<BitbucketProject> projects = bitbucketService.getProjects(request.projectKeys());
		logger.info("Found {} projects", projects.size());

		List<UserPermissionRow> userRows = new ArrayList<>();
		List<GroupPermissionRow> groupRows = new ArrayList<>();
		int repositoryCount = 0;

		for (BitbucketProject project : projects) {
			List<BitbucketRepository> repositories = bitbucketService.getRepositories(project.key(),
					request.repoSlugs());
			logger.info("Project {}: {} repos", project.key(), repositories.size());
			repositoryCount += repositories.size();

			for (BitbucketRepository repository : repositories) {
				for (UserPermissionEntry entry : bitbucketService.getRepositoryUserPermissions(project.key(),
						repository.slug())) {
					String email = resolveEmail(entry.user(), emailCache);
					userRows.add(UserPermissionRow.of(project.key(), repository.slug(), entry.user().identifier(),
							email, entry.permission()));
				}
				for (GroupPermissionEntry entry : bitbucketService.getRepositoryGroupPermissions(project.key(),
						repository.slug())) {
					groupRows.add(GroupPermissionRow.of(project.key(), repository.slug(), entry.group(),
							entry.permission()));
				}
			}
		}

		Set<String> referencedGroups = new TreeSet<>();
		for (GroupPermissionRow row : groupRows) {
			if (!row.principal().isEmpty()) {
				referencedGroups.add(row.principal());
			}
		}
		logger.info("Exporting members for {} groups", referencedGroups.size());

		List<GroupMemberRow> memberRows = new ArrayList<>();
		for (String group : referencedGroups) {
			for (BitbucketUser member : bitbucketService.getGroupMembers(group)) {
				memberRows.add(new GroupMemberRow(group, member.identifier(), resolveEmail(member, emailCache)));
			}
		}

		if (request.dryRun()) {
			logger.info("Dry-run: would write {} user permission rows, {} group permission rows, {} group members",
					userRows.size(), groupRows.size(), memberRows.size());
			return new ExtractionResult(projects.size(), repositoryCount, userRows.size(), groupRows.size(),
					memberRows.size(), List.of());
		}

		Path userFile = request.outputDir().resolve(properties.getUserPermissionsFile());
		Path groupFile = request.outputDir().resolve(properties.getGroupPermissionsFile());
		Path memberFile = request.outputDir().resolve(properties.getGroupMembersFile());
		csvRepository.writeUserPermissions(userFile, userRows);
		csvRepository.writeGroupPermissions(groupFile, groupRows);
		csvRepository.writeGroupMembers(memberFile, memberRows);

		return new ExtractionResult(projects.size(), repositoryCount, userRows.size(), groupRows.size(),
				memberRows.size(), List.of(userFile.toString(), groupFile.toString(), memberFile.toString()));
	}

	private String resolveEmail(BitbucketUser user, Map<String, Optional<String>> cache) {
		Optional<String> email = user.email();
		if (email.isPresent()) {
			return email.get();
		}
		String identifier = !user.slug().isEmpty() ? user.slug() : user.name();
		if (identifier.isEmpty()) {
			return "";
		}
		return cache.computeIfAbsent(identifier, id -> bitbucketService.getUser(id).flatMap(BitbucketUser::email))
			.orElse("");
	}

}
