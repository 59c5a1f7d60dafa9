package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of {@code repo_user_permissions.csv}: a direct user grant as extracted from
 * Bitbucket, with the source-system permission name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "project_key", "repo_slug", "principal_type", "principal", "email", "permission" })
public record UserPermissionRow(@JsonProperty("project_key") String projectKey,
		@JsonProperty("repo_slug") String repoSlug, @JsonProperty("principal_type") String principalType,
		@JsonProperty("principal") String principal, @JsonProperty("email") String email,
		@JsonProperty("permission") String permission) {

	public static final String PRINCIPAL_TYPE = "user";

	public UserPermissionRow {
		projectKey = projectKey == null ? "" : projectKey;
		repoSlug = repoSlug == null ? "" : repoSlug;
		principalType = principalType == null || principalType.isEmpty() ? PRINCIPAL_TYPE : principalType;
		principal = principal == null ? "" : principal;
		email = email == null ? "" : email;
		permission = permission == null ? "" : permission;
	}

	public static UserPermissionRow of(String projectKey, String repoSlug, String principal, String email,
			String permission) {
		return new UserPermissionRow(projectKey, repoSlug, PRINCIPAL_TYPE, principal, email, permission);
	}

}
