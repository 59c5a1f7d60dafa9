package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Subcommand: extract, expand or apply
	public @Nullable String command;

	// Mode flags
	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Extract
	public @Nullable String baseUrl;

	public @Nullable String bitbucketToken;

	public @Nullable String username;

	public @Nullable String password;

	public double rateLimitSleepSeconds;

	public int pageSize;

	public String outputDir;

	public List<String> projects = new ArrayList<>();

	public List<String> repos = new ArrayList<>();

	// Expand
	public @Nullable String userPermissions;

	public @Nullable String groupPermissions;

	public @Nullable String groupMembers;

	public String output;

	// Apply
	public @Nullable String gitHubToken;

	public @Nullable String org;

	public @Nullable String apiUrl;

	public String effectiveCsv;

	public @Nullable String mappingCsv;

	public @Nullable String defaultMissing;

	public ParsedConfiguration(SyncProperties defaultProperties) {
		this.rateLimitSleepSeconds = defaultProperties.getRateLimitSleepSeconds();
		this.pageSize = defaultProperties.getBitbucketPageSize();
		this.outputDir = defaultProperties.getOutputDir();
		this.output = defaultProperties.getDefaultEffectivePermissionsPath();
		this.effectiveCsv = defaultProperties.getDefaultEffectivePermissionsPath();
		this.verbose = defaultProperties.isVerbose();
	}

	public BitbucketConfig toBitbucketConfig() {
		Duration sleep = Duration.ofMillis(Math.round(rateLimitSleepSeconds * 1000));
		return new BitbucketConfig(String.valueOf(baseUrl), bitbucketToken, username, password, sleep);
	}

	public ExtractionRequest toExtractionRequest() {
		return new ExtractionRequest(Path.of(outputDir), projects, repos, dryRun);
	}

	public ExpansionRequest toExpansionRequest() {
		return new ExpansionRequest(Path.of(String.valueOf(userPermissions)), Path.of(String.valueOf(groupPermissions)),
				Path.of(String.valueOf(groupMembers)), Path.of(output), dryRun);
	}

	public ApplyRequest toApplyRequest() {
		return new ApplyRequest(String.valueOf(org), Path.of(effectiveCsv),
				mappingCsv != null ? Path.of(mappingCsv) : null, defaultMissing, dryRun);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", dryRun=" + dryRun + ", verbose=" + verbose
				+ ", baseUrl='" + baseUrl + '\'' + ", bitbucketToken=" + mask(bitbucketToken) + ", username='"
				+ username + '\'' + ", password=" + mask(password) + ", rateLimitSleepSeconds=" + rateLimitSleepSeconds
				+ ", pageSize=" + pageSize + ", outputDir='" + outputDir + '\'' + ", projects=" + projects + ", repos="
				+ repos + ", userPermissions='" + userPermissions + '\'' + ", groupPermissions='" + groupPermissions
				+ '\'' + ", groupMembers='" + groupMembers + '\'' + ", output='" + output + '\'' + ", gitHubToken="
				+ mask(gitHubToken) + ", org='" + org + '\'' + ", apiUrl='" + apiUrl + '\'' + ", effectiveCsv='"
				+ effectiveCsv + '\'' + ", mappingCsv='" + mappingCsv + '\'' + ", defaultMissing='" + defaultMissing
				+ '\'' + '}';
	}

	private static String mask(@Nullable String secret) {
		return secret == null ? "null" : "****";
	}

}
