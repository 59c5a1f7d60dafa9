package org.springaicommunity.permissionsync.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.permissionsync.ApplyResult;
import org.springaicommunity.permissionsync.ArgumentParser;
import org.springaicommunity.permissionsync.Diagnostic;
import org.springaicommunity.permissionsync.ExpansionResult;
import org.springaicommunity.permissionsync.ExtractionResult;
import org.springaicommunity.permissionsync.ParsedConfiguration;
import org.springaicommunity.permissionsync.PermissionSyncBuilder;
import org.springaicommunity.permissionsync.SyncProperties;

/**
 * Permission Sync CLI Application
 *
 * Plain Java command-line application migrating Bitbucket Data Center repository
 * permissions to GitHub in three steps: extract, expand and apply. Uses
 * PermissionSyncBuilder for service wiring.
 *
 * Usage: java -jar permission-sync-cli.jar &lt;extract|expand|apply&gt; [OPTIONS]
 *
 * Environment Variables: BITBUCKET_TOKEN - Bitbucket personal access token (extract),
 * GITHUB_TOKEN - GitHub token with admin rights (apply)
 */
public class PermissionSyncCli {

	private static final Logger logger = LoggerFactory.getLogger(PermissionSyncCli.class);

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run one command.
	 * @param args command-line arguments
	 * @return 0 on success, 1 on failure
	 */
	public static int run(String[] args) {
		SyncProperties properties = new SyncProperties();
		return run(args, new ArgumentParser(properties), properties);
	}

	static int run(String[] args, ArgumentParser argumentParser, SyncProperties properties) {
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			return 1;
		}

		properties.setVerbose(config.verbose);
		properties.setOutputDir(config.outputDir);
		properties.setBitbucketPageSize(config.pageSize);
		properties.setRateLimitSleepSeconds(config.rateLimitSleepSeconds);
		if (config.verbose) {
			logger.info("Configuration: {}", config);
		}

		try {
			switch (String.valueOf(config.command)) {
				case ArgumentParser.EXTRACT -> runExtract(config, properties);
				case ArgumentParser.EXPAND -> runExpand(config, properties);
				default -> {
					return runApply(config, properties);
				}
			}
			return 0;
		}
		catch (RuntimeException e) {
			logger.error("{} failed: {}", config.command, e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	private static void runExtract(ParsedConfiguration config, SyncProperties properties) {
		ExtractionResult result = PermissionSyncBuilder.create()
			.properties(properties)
			.bitbucket(config.toBitbucketConfig())
			.buildExtractionService()
			.extract(config.toExtractionRequest());

		logger.info("Extraction completed: {} projects, {} repositories", result.projects(), result.repositories());
		logger.info("  User permission rows: {}", result.userPermissionRows());
		logger.info("  Group permission rows: {}", result.groupPermissionRows());
		logger.info("  Group member rows: {}", result.groupMemberRows());
		for (String file : result.files()) {
			logger.info("  Wrote {}", file);
		}
	}

	private static void runExpand(ParsedConfiguration config, SyncProperties properties) {
		ExpansionResult result = PermissionSyncBuilder.create()
			.properties(properties)
			.buildExpansionService()
			.expand(config.toExpansionRequest());

		logger.info("Expansion completed: {} effective permissions, {} diagnostics ({} warnings)",
				result.rowsWritten(), result.diagnostics().size(), result.warningCount());
		if (config.verbose) {
			for (Diagnostic.Kind kind : Diagnostic.Kind.values()) {
				long count = result.diagnostics().stream().filter(d -> d.kind() == kind).count();
				if (count > 0) {
					logger.info("  {}: {}", kind, count);
				}
			}
		}
	}

	private static int runApply(ParsedConfiguration config, SyncProperties properties) {
		ApplyResult result = PermissionSyncBuilder.create()
			.properties(properties)
			.gitHubToken(String.valueOf(config.gitHubToken))
			.gitHubApiUrl(config.apiUrl)
			.buildApplyService()
			.apply(config.toApplyRequest());

		if (result.hasFailures()) {
			logger.warn("Apply completed with {} failures", result.failed());
			return 1;
		}
		logger.info("Apply completed successfully");
		return 0;
	}

}
