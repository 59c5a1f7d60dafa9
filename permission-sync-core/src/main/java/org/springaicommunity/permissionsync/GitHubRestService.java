package org.springaicommunity.permissionsync;

import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHOrganization;
import org.kohsuke.github.GHPermissionType;
import org.kohsuke.github.GHRateLimit;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHUser;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for GitHub REST API operations backed by the {@code github-api} client.
 *
 * <p>
 * Repositories are looked up once and cached for the lifetime of the service, so the
 * per-collaborator calls of an apply run do not refetch them.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHub gitHub;

	private final Map<String, GHRepository> repositories = new ConcurrentHashMap<>();

	public GitHubRestService(GitHub gitHub) {
		this.gitHub = gitHub;
	}

	@Override
	public GHRateLimit getRateLimit() throws IOException {
		return gitHub.getRateLimit();
	}

	@Override
	public RepositoryInfo getRepository(String owner, String repo) throws IOException {
		GHRepository repository = repository(owner, repo);
		return new RepositoryInfo(repository.getId(), repository.getName(), repository.getFullName(),
				String.valueOf(repository.getHtmlUrl()), repository.isPrivate(), repository.hasAdminAccess());
	}

	@Override
	public Optional<String> getCollaboratorPermission(String owner, String repo, String login) throws IOException {
		GHPermissionType type;
		try {
			type = repository(owner, repo).getPermission(login);
		}
		catch (GHFileNotFoundException e) {
			logger.debug("{} is not a collaborator on {}/{}", login, owner, repo);
			return Optional.empty();
		}
		return normalizePermission(type);
	}

	@Override
	public void addCollaborator(String owner, String repo, String login, String permission) throws IOException {
		GHUser user = gitHub.getUser(login);
		repository(owner, repo).addCollaborators(GHOrganization.RepositoryRole.custom(permission), user);
	}

	/**
	 * Map a GitHub permission type to the permission vocabulary of the collaborator API.
	 * {@code none} and unrecognized types mean no known access.
	 */
	static Optional<String> normalizePermission(GHPermissionType type) {
		switch (type.name()) {
			case "ADMIN":
				return Optional.of("admin");
			case "MAINTAIN":
				return Optional.of("maintain");
			case "WRITE":
				return Optional.of("push");
			case "TRIAGE":
				return Optional.of("triage");
			case "READ":
				return Optional.of("pull");
			default:
				return Optional.empty();
		}
	}

	private GHRepository repository(String owner, String repo) throws IOException {
		String fullName = owner + "/" + repo;
		GHRepository cached = repositories.get(fullName);
		if (cached != null) {
			return cached;
		}
		GHRepository repository = gitHub.getRepository(fullName);
		repositories.put(fullName, repository);
		return repository;
	}

}
