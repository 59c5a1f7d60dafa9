package org.springaicommunity.permissionsync;

/**
 * Configuration properties for the extract, expand and apply phases.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link PermissionSyncBuilder}.
 * Default values are suitable for most migrations; lower the page size or add a rate
 * limit sleep for busy Bitbucket servers.
 */
public class SyncProperties {

	/**
	 * Directory for extracted and effective permission files.
	 */
	private String outputDir = "out";

	/**
	 * File name of the direct user permissions export.
	 */
	private String userPermissionsFile = "repo_user_permissions.csv";

	/**
	 * File name of the group permissions export.
	 */
	private String groupPermissionsFile = "repo_group_permissions.csv";

	/**
	 * File name of the group members export.
	 */
	private String groupMembersFile = "group_members.csv";

	/**
	 * File name of the effective per-user permissions.
	 */
	private String effectivePermissionsFile = "effective_repo_user_permissions.csv";

	/**
	 * Number of values requested per Bitbucket page.
	 */
	private int bitbucketPageSize = 100;

	/**
	 * Seconds to sleep before each Bitbucket request.
	 */
	private double rateLimitSleepSeconds = 0.0;

	/**
	 * Remaining GitHub core rate limit at or below which requests wait for the reset.
	 */
	private int pacingThreshold = 100;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getOutputDir() {
		return outputDir;
	}

	public void setOutputDir(String outputDir) {
		this.outputDir = outputDir;
	}

	public String getUserPermissionsFile() {
		return userPermissionsFile;
	}

	public void setUserPermissionsFile(String userPermissionsFile) {
		this.userPermissionsFile = userPermissionsFile;
	}

	public String getGroupPermissionsFile() {
		return groupPermissionsFile;
	}

	public void setGroupPermissionsFile(String groupPermissionsFile) {
		this.groupPermissionsFile = groupPermissionsFile;
	}

	public String getGroupMembersFile() {
		return groupMembersFile;
	}

	public void setGroupMembersFile(String groupMembersFile) {
		this.groupMembersFile = groupMembersFile;
	}

	public String getEffectivePermissionsFile() {
		return effectivePermissionsFile;
	}

	public void setEffectivePermissionsFile(String effectivePermissionsFile) {
		this.effectivePermissionsFile = effectivePermissionsFile;
	}

	/**
	 * Returns the default location of the effective permissions file, inside the output
	 * directory.
	 * @return e.g. {@code out/effective_repo_user_permissions.csv}
	 */
	public String getDefaultEffectivePermissionsPath() {
		return outputDir + "/" + effectivePermissionsFile;
	}

	public int getBitbucketPageSize() {
		return bitbucketPageSize;
	}

	public void setBitbucketPageSize(int bitbucketPageSize) {
		this.bitbucketPageSize = bitbucketPageSize;
	}

	public double getRateLimitSleepSeconds() {
		return rateLimitSleepSeconds;
	}

	public void setRateLimitSleepSeconds(double rateLimitSleepSeconds) {
		this.rateLimitSleepSeconds = rateLimitSleepSeconds;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
