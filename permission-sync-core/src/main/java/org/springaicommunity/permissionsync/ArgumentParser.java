package org.springaicommunity.permissionsync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Command-line argument parser for the extract, expand and apply commands.
 *
 * <p>
 * The first non-option argument selects the command. Options that do not belong to the
 * selected command are rejected. Missing tokens are looked up in the environment
 * ({@code BITBUCKET_TOKEN}, {@code GITHUB_TOKEN}). All validation problems are reported
 * together in one {@link IllegalArgumentException}.
 */
public class ArgumentParser {

	public static final String EXTRACT = "extract";

	public static final String EXPAND = "expand";

	public static final String APPLY = "apply";

	private static final List<String> COMMANDS = List.of(EXTRACT, EXPAND, APPLY);

	private static final Map<String, Set<String>> COMMANDS_BY_OPTION = Map.ofEntries(
			Map.entry("--base-url", Set.of(EXTRACT)), Map.entry("--username", Set.of(EXTRACT)),
			Map.entry("--password", Set.of(EXTRACT)), Map.entry("--rate-limit-sleep", Set.of(EXTRACT)),
			Map.entry("--page-size", Set.of(EXTRACT)), Map.entry("--output-dir", Set.of(EXTRACT)),
			Map.entry("--project", Set.of(EXTRACT)), Map.entry("--repo", Set.of(EXTRACT)),
			Map.entry("--user-permissions", Set.of(EXPAND)), Map.entry("--group-permissions", Set.of(EXPAND)),
			Map.entry("--group-members", Set.of(EXPAND)), Map.entry("--output", Set.of(EXPAND)),
			Map.entry("--org", Set.of(APPLY)), Map.entry("--api-url", Set.of(APPLY)),
			Map.entry("--effective-csv", Set.of(APPLY)), Map.entry("--mapping-csv", Set.of(APPLY)),
			Map.entry("--default-missing", Set.of(APPLY)), Map.entry("--token", Set.of(EXTRACT, APPLY)));

	private final SyncProperties defaultProperties;

	private final Function<String, @Nullable String> environment;

	public ArgumentParser(SyncProperties defaultProperties) {
		this(defaultProperties, EnvironmentSupport::get);
	}

	/**
	 * Create a parser with a custom environment lookup.
	 * @param defaultProperties defaults for optional values
	 * @param environment variable lookup returning null when unset
	 */
	public ArgumentParser(SyncProperties defaultProperties, Function<String, @Nullable String> environment) {
		this.defaultProperties = defaultProperties;
		this.environment = environment;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> usedOptions = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (COMMANDS_BY_OPTION.containsKey(arg)) {
				usedOptions.add(arg);
			}

			switch (arg) {
				case "--base-url":
					config.baseUrl = getRequiredValue(args, i, "base-url");
					i++;
					break;

				case "--token":
					// Meaning depends on the command, resolved after parsing
					config.bitbucketToken = getRequiredValue(args, i, "token");
					config.gitHubToken = config.bitbucketToken;
					i++;
					break;

				case "--username":
					config.username = getRequiredValue(args, i, "username");
					i++;
					break;

				case "--password":
					config.password = getRequiredValue(args, i, "password");
					i++;
					break;

				case "--rate-limit-sleep":
					String sleepStr = getRequiredValue(args, i, "rate-limit-sleep");
					try {
						config.rateLimitSleepSeconds = Double.parseDouble(sleepStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid rate limit sleep '" + sleepStr + "': must be a number of seconds");
					}
					i++;
					break;

				case "--page-size":
					String pageSizeStr = getRequiredValue(args, i, "page-size");
					try {
						config.pageSize = Integer.parseInt(pageSizeStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid page size '" + pageSizeStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "--project":
					config.projects.add(getRequiredValue(args, i, "project"));
					i++;
					break;

				case "--repo":
					config.repos.add(getRequiredValue(args, i, "repo"));
					i++;
					break;

				case "--user-permissions":
					config.userPermissions = getRequiredValue(args, i, "user-permissions");
					i++;
					break;

				case "--group-permissions":
					config.groupPermissions = getRequiredValue(args, i, "group-permissions");
					i++;
					break;

				case "--group-members":
					config.groupMembers = getRequiredValue(args, i, "group-members");
					i++;
					break;

				case "--output":
					config.output = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--org":
					config.org = getRequiredValue(args, i, "org");
					i++;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					i++;
					break;

				case "--effective-csv":
					config.effectiveCsv = getRequiredValue(args, i, "effective-csv");
					i++;
					break;

				case "--mapping-csv":
					config.mappingCsv = getRequiredValue(args, i, "mapping-csv");
					i++;
					break;

				case "--default-missing":
					config.defaultMissing = getRequiredValue(args, i, "default-missing");
					i++;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					if (!COMMANDS.contains(arg)) {
						throw new IllegalArgumentException(
								"Unknown command '" + arg + "': must be 'extract', 'expand', or 'apply'");
					}
					config.command = arg;
					break;
			}
		}

		if (config.helpRequested) {
			return config;
		}

		validateConfiguration(config, usedOptions);

		return config;
	}

	/**
	 * Check if help is requested without full parsing. Arguments without a command count
	 * as a help request.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		boolean hasCommand = false;
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
			hasCommand |= COMMANDS.contains(arg);
		}
		return !hasCommand;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: permission-sync <extract|expand|apply> [OPTIONS]\n");
		help.append("\n");
		help.append("Migrate Bitbucket Data Center repository permissions to GitHub.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    extract                 Extract Bitbucket permissions to CSVs\n");
		help.append("    expand                  Expand group permissions to effective per-user permissions\n");
		help.append("    apply                   Apply effective permissions into GitHub\n");
		help.append("\n");
		help.append("COMMON OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -d, --dry-run           Log what would happen without writing anything\n");
		help.append("    -v, --verbose           Log the configuration and stack traces on failure\n");
		help.append("\n");
		help.append("EXTRACT OPTIONS:\n");
		help.append("    --base-url URL          Bitbucket base URL, e.g. https://bitbucket.example.com (required)\n");
		help.append("    --token TOKEN           Bitbucket personal access token (or BITBUCKET_TOKEN)\n");
		help.append("    --username USER         Bitbucket username for basic auth\n");
		help.append("    --password PASS         Bitbucket password for basic auth\n");
		help.append("    --rate-limit-sleep SECS Sleep before each request (default: ")
			.append(defaultProperties.getRateLimitSleepSeconds())
			.append(")\n");
		help.append("    --page-size N           Values per page (default: ")
			.append(defaultProperties.getBitbucketPageSize())
			.append(")\n");
		help.append("    --output-dir DIR        Directory for the CSV files (default: ")
			.append(defaultProperties.getOutputDir())
			.append(")\n");
		help.append("    --project KEY           Only extract this project (repeatable)\n");
		help.append("    --repo SLUG             Only extract this repository slug (repeatable)\n");
		help.append("\n");
		help.append("EXPAND OPTIONS:\n");
		help.append("    --user-permissions FILE Path to ")
			.append(defaultProperties.getUserPermissionsFile())
			.append(" (required)\n");
		help.append("    --group-permissions FILE Path to ")
			.append(defaultProperties.getGroupPermissionsFile())
			.append(" (required)\n");
		help.append("    --group-members FILE    Path to ")
			.append(defaultProperties.getGroupMembersFile())
			.append(" (required)\n");
		help.append("    --output FILE           Output CSV (default: ")
			.append(defaultProperties.getDefaultEffectivePermissionsPath())
			.append(")\n");
		help.append("\n");
		help.append("APPLY OPTIONS:\n");
		help.append("    --token TOKEN           GitHub token with admin rights (or GITHUB_TOKEN)\n");
		help.append("    --org ORG               Target GitHub organization (required)\n");
		help.append("    --api-url URL           GitHub API root (default: ")
			.append(PermissionSyncBuilder.GITHUB_API_URL)
			.append(")\n");
		help.append("    --effective-csv FILE    Effective permissions CSV (default: ")
			.append(defaultProperties.getDefaultEffectivePermissionsPath())
			.append(")\n");
		help.append("    --mapping-csv FILE      CSV mapping email,github_login\n");
		help.append("    --default-missing LOGIN Login used for emails without a mapping\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    BITBUCKET_TOKEN         Bitbucket personal access token (extract)\n");
		help.append("    GITHUB_TOKEN            GitHub token (apply)\n");
		help.append("    Both may also be set in a .env file in the current or home directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    permission-sync extract --base-url https://bitbucket.example.com --project PROJ\n");
		help.append("    permission-sync expand --user-permissions out/repo_user_permissions.csv \\\n");
		help.append("        --group-permissions out/repo_group_permissions.csv \\\n");
		help.append("        --group-members out/group_members.csv\n");
		help.append("    permission-sync apply --org your-org --mapping-csv email_github_login.csv --dry-run\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config, List<String> usedOptions) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required: 'extract', 'expand', or 'apply'");
		}
		else {
			for (String option : usedOptions) {
				if (!COMMANDS_BY_OPTION.get(option).contains(config.command)) {
					errors.add("Option " + option + " is not valid for '" + config.command + "'");
				}
			}
			switch (config.command) {
				case EXTRACT -> validateExtract(config, errors);
				case EXPAND -> validateExpand(config, errors);
				default -> validateApply(config, errors);
			}
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private void validateExtract(ParsedConfiguration config, List<String> errors) {
		config.gitHubToken = null;
		if (isBlank(config.baseUrl)) {
			errors.add("Bitbucket base URL is required (--base-url)");
		}
		else if (!config.baseUrl.startsWith("http://") && !config.baseUrl.startsWith("https://")) {
			errors.add("Bitbucket base URL must start with http:// or https:// (got: " + config.baseUrl + ")");
		}

		boolean basicAuth = config.username != null || config.password != null;
		if (config.bitbucketToken != null && basicAuth) {
			errors.add("Use either --token or --username/--password, not both");
		}
		else if (basicAuth) {
			if (isBlank(config.username) || config.password == null) {
				errors.add("Both --username and --password are required for basic authentication");
			}
		}
		else if (config.bitbucketToken == null) {
			config.bitbucketToken = environment.apply(EnvironmentSupport.BITBUCKET_TOKEN);
			if (isBlank(config.bitbucketToken)) {
				errors.add("Bitbucket credentials are required: --token, BITBUCKET_TOKEN, or --username and --password");
			}
		}

		if (config.rateLimitSleepSeconds < 0) {
			errors.add("Rate limit sleep must not be negative (got: " + config.rateLimitSleepSeconds + ")");
		}
		if (config.pageSize <= 0) {
			errors.add("Page size must be positive (got: " + config.pageSize + ")");
		}
		else if (config.pageSize > 1000) {
			errors.add("Page size too large (got: " + config.pageSize + ", max: 1000)");
		}
		if (isBlank(config.outputDir)) {
			errors.add("Output directory cannot be empty");
		}
	}

	private void validateExpand(ParsedConfiguration config, List<String> errors) {
		if (isBlank(config.userPermissions)) {
			errors.add("User permissions file is required (--user-permissions)");
		}
		if (isBlank(config.groupPermissions)) {
			errors.add("Group permissions file is required (--group-permissions)");
		}
		if (isBlank(config.groupMembers)) {
			errors.add("Group members file is required (--group-members)");
		}
		if (isBlank(config.output)) {
			errors.add("Output file cannot be empty");
		}
	}

	private void validateApply(ParsedConfiguration config, List<String> errors) {
		config.bitbucketToken = null;
		if (isBlank(config.org)) {
			errors.add("GitHub organization is required (--org)");
		}
		if (config.gitHubToken == null) {
			config.gitHubToken = environment.apply(EnvironmentSupport.GITHUB_TOKEN);
		}
		if (isBlank(config.gitHubToken)) {
			errors.add("GitHub token is required: --token or GITHUB_TOKEN");
		}
		if (isBlank(config.effectiveCsv)) {
			errors.add("Effective permissions file cannot be empty");
		}
		if (config.defaultMissing != null && config.defaultMissing.isBlank()) {
			errors.add("Default login cannot be blank");
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
