package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of {@code group_members.csv}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "group", "user", "email" })
public record GroupMemberRow(@JsonProperty("group") String group, @JsonProperty("user") String user,
		@JsonProperty("email") String email) {

	public GroupMemberRow {
		group = group == null ? "" : group;
		user = user == null ? "" : user;
		email = email == null ? "" : email;
	}

}
