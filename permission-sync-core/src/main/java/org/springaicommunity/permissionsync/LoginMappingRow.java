package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the email to GitHub login mapping file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "email", "github_login" })
public record LoginMappingRow(@JsonProperty("email") String email, @JsonProperty("github_login") String githubLogin) {

	public LoginMappingRow {
		email = email == null ? "" : email;
		githubLogin = githubLogin == null ? "" : githubLogin;
	}

}
