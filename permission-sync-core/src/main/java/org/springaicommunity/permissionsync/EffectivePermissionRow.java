package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of {@code effective_repo_user_permissions.csv}, the hand-off between the expand
 * and apply phases.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "project_key", "repo_slug", "email", "permission", "source", "source_principal" })
public record EffectivePermissionRow(@JsonProperty("project_key") String projectKey,
		@JsonProperty("repo_slug") String repoSlug, @JsonProperty("email") String email,
		@JsonProperty("permission") String permission, @JsonProperty("source") String source,
		@JsonProperty("source_principal") String sourcePrincipal) {

	public EffectivePermissionRow {
		projectKey = projectKey == null ? "" : projectKey;
		repoSlug = repoSlug == null ? "" : repoSlug;
		email = email == null ? "" : email;
		permission = permission == null ? "" : permission;
		source = source == null ? "" : source;
		sourcePrincipal = sourcePrincipal == null ? "" : sourcePrincipal;
	}

}
