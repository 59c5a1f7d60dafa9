package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of {@code repo_group_permissions.csv}: a group grant as extracted from
 * Bitbucket.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "project_key", "repo_slug", "principal_type", "principal", "permission" })
public record GroupPermissionRow(@JsonProperty("project_key") String projectKey,
		@JsonProperty("repo_slug") String repoSlug, @JsonProperty("principal_type") String principalType,
		@JsonProperty("principal") String principal, @JsonProperty("permission") String permission) {

	public static final String PRINCIPAL_TYPE = "group";

	public GroupPermissionRow {
		projectKey = projectKey == null ? "" : projectKey;
		repoSlug = repoSlug == null ? "" : repoSlug;
		principalType = principalType == null || principalType.isEmpty() ? PRINCIPAL_TYPE : principalType;
		principal = principal == null ? "" : principal;
		permission = permission == null ? "" : permission;
	}

	public static GroupPermissionRow of(String projectKey, String repoSlug, String group, String permission) {
		return new GroupPermissionRow(projectKey, repoSlug, PRINCIPAL_TYPE, group, permission);
	}

}
