package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service for Bitbucket Data Center REST API (v1.0) operations.
 *
 * <p>
 * Follows the {@code isLastPage}/{@code nextPageStart} paging protocol and converts JSON
 * responses to DTOs at the service boundary.
 */
public class BitbucketRestService implements BitbucketService {

	private static final Logger logger = LoggerFactory.getLogger(BitbucketRestService.class);

	private static final String API = "/rest/api/1.0";

	private final BitbucketClient client;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public BitbucketRestService(BitbucketClient client, ObjectMapper objectMapper, int pageSize) {
		if (pageSize <= 0) {
			throw new IllegalArgumentException("Page size must be positive: " + pageSize);
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	@Override
	public List<BitbucketProject> getProjects(Collection<String> projectKeys) {
		Set<String> keep = Set.copyOf(projectKeys);
		List<BitbucketProject> projects = new ArrayList<>();
		for (JsonNode node : paginate(API + "/projects", "")) {
			String key = node.path("key").asText("");
			if (!keep.isEmpty() && !keep.contains(key)) {
				continue;
			}
			projects.add(new BitbucketProject(key, node.path("name").asText(key)));
		}
		return projects;
	}

	@Override
	public List<BitbucketRepository> getRepositories(String projectKey, Collection<String> repoSlugs) {
		Set<String> keep = Set.copyOf(repoSlugs);
		List<BitbucketRepository> repositories = new ArrayList<>();
		for (JsonNode node : paginate(API + "/projects/" + encode(projectKey) + "/repos", "")) {
			String slug = node.path("slug").asText("");
			if (!keep.isEmpty() && !keep.contains(slug)) {
				continue;
			}
			repositories.add(new BitbucketRepository(projectKey, slug, node.path("name").asText(slug)));
		}
		return repositories;
	}

	@Override
	public List<UserPermissionEntry> getRepositoryUserPermissions(String projectKey, String repoSlug) {
		List<UserPermissionEntry> entries = new ArrayList<>();
		for (JsonNode node : paginate(repoPath(projectKey, repoSlug) + "/permissions/users", "")) {
			entries.add(new UserPermissionEntry(parseUser(node.path("user")), node.path("permission").asText("")));
		}
		return entries;
	}

	@Override
	public List<GroupPermissionEntry> getRepositoryGroupPermissions(String projectKey, String repoSlug) {
		List<GroupPermissionEntry> entries = new ArrayList<>();
		for (JsonNode node : paginate(repoPath(projectKey, repoSlug) + "/permissions/groups", "")) {
			JsonNode group = node.path("group");
			String name = group.path("name").asText("");
			if (name.isEmpty()) {
				name = group.path("slug").asText("");
			}
			entries.add(new GroupPermissionEntry(name, node.path("permission").asText("")));
		}
		return entries;
	}

	@Override
	public List<BitbucketUser> getGroupMembers(String group) {
		List<BitbucketUser> members = new ArrayList<>();
		for (JsonNode node : paginate(API + "/admin/groups/more-members", "context=" + encode(group))) {
			members.add(parseUser(node));
		}
		return members;
	}

	@Override
	public Optional<BitbucketUser> getUser(String slugOrName) {
		try {
			return Optional.of(parseUser(readTree(client.get(API + "/users/" + encode(slugOrName)))));
		}
		catch (BitbucketHttpClient.BitbucketApiException e) {
			if (e.isNotFound()) {
				for (JsonNode node : paginate(API + "/users", "filter=" + encode(slugOrName))) {
					BitbucketUser candidate = parseUser(node);
					if (slugOrName.equals(candidate.name()) || slugOrName.equals(candidate.slug())) {
						return Optional.of(candidate);
					}
				}
			}
			logger.warn("Unable to fetch user details for {}: {}", slugOrName, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Fetch every page of a paged resource.
	 * @param path resource path
	 * @param query extra encoded query parameters, may be empty
	 * @return the concatenated {@code values} of all pages
	 */
	List<JsonNode> paginate(String path, String query) {
		List<JsonNode> values = new ArrayList<>();
		int start = 0;
		while (true) {
			String pageQuery = (query.isEmpty() ? "" : query + "&") + "limit=" + pageSize + "&start=" + start;
			JsonNode page = readTree(client.getWithQuery(path, pageQuery));
			JsonNode pageValues = page.path("values");
			int count = 0;
			for (JsonNode value : pageValues) {
				values.add(value);
				count++;
			}
			if (page.path("isLastPage").asBoolean(false)) {
				break;
			}
			JsonNode nextPageStart = page.get("nextPageStart");
			if (nextPageStart != null && nextPageStart.isNumber()) {
				start = nextPageStart.asInt();
			}
			else if (count > 0) {
				start += count;
			}
			else {
				logger.warn("Page of {} at start={} is empty but not marked last; stopping", path, start);
				break;
			}
		}
		logger.debug("Fetched {} values from {}", values.size(), path);
		return values;
	}

	private BitbucketUser parseUser(JsonNode node) {
		String email = node.path("emailAddress").asText("");
		if (email.isEmpty()) {
			email = node.path("email").asText("");
		}
		return new BitbucketUser(node.path("name").asText(""), node.path("slug").asText(""),
				email.isEmpty() ? null : email, node.path("displayName").asText(null));
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new BitbucketHttpClient.BitbucketApiException("Invalid JSON response from Bitbucket", e);
		}
	}

	private static String repoPath(String projectKey, String repoSlug) {
		return API + "/projects/" + encode(projectKey) + "/repos/" + encode(repoSlug);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

}
