package org.springaicommunity.permissionsync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.jspecify.annotations.Nullable;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubAbuseLimitHandler;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.GitHubRateLimitHandler;
import org.kohsuke.github.RateLimitChecker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Builder wiring the extract, expand and apply services.
 *
 * <pre>
 * {@code
 * GrantExtractionService extractor = PermissionSyncBuilder.create()
 *     .bitbucket(BitbucketConfig.withToken("https://bitbucket.example.com", token))
 *     .buildExtractionService();
 *
 * PermissionExpansionService expander = PermissionSyncBuilder.create().buildExpansionService();
 *
 * PermissionApplyService applier = PermissionSyncBuilder.create()
 *     .gitHubTokenFromEnv()
 *     .buildApplyService();
 *
 * // For testing with a mocked GitHub connection
 * PermissionApplyService testApplier = PermissionSyncBuilder.create()
 *     .gitHub(mock(GitHub.class))
 *     .buildApplyService();
 * }
 * </pre>
 */
public class PermissionSyncBuilder {

	public static final String GITHUB_API_URL = "https://api.github.com";

	private SyncProperties properties;

	private @Nullable BitbucketConfig bitbucketConfig;

	private @Nullable String gitHubToken;

	private String gitHubApiUrl = GITHUB_API_URL;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable CsvMapper csvMapper;

	private @Nullable BitbucketClient bitbucketClient;

	private @Nullable GitHub gitHub;

	private @Nullable PermissionCsvRepository csvRepository;

	private @Nullable PermissionResolutionEngine engine;

	private PermissionSyncBuilder() {
		this.properties = new SyncProperties();
	}

	public static PermissionSyncBuilder create() {
		return new PermissionSyncBuilder();
	}

	/**
	 * Set sync properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public PermissionSyncBuilder properties(@Nullable SyncProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the Bitbucket server and credentials used by the extraction service.
	 * @param config Bitbucket connection settings
	 * @return this builder
	 */
	public PermissionSyncBuilder bitbucket(BitbucketConfig config) {
		this.bitbucketConfig = config;
		return this;
	}

	public PermissionSyncBuilder gitHubToken(String token) {
		this.gitHubToken = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public PermissionSyncBuilder gitHubTokenFromEnv() {
		this.gitHubToken = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (this.gitHubToken == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set a token with admin rights on the target repositories.");
		}
		return this;
	}

	/**
	 * Set the GitHub API root, e.g. {@code https://github.example.com/api/v3} for GitHub
	 * Enterprise Server.
	 * @param apiUrl API root URL (null for api.github.com)
	 * @return this builder
	 */
	public PermissionSyncBuilder gitHubApiUrl(@Nullable String apiUrl) {
		this.gitHubApiUrl = apiUrl != null && !apiUrl.isBlank() ? apiUrl : GITHUB_API_URL;
		return this;
	}

	public PermissionSyncBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	public PermissionSyncBuilder csvMapper(@Nullable CsvMapper csvMapper) {
		this.csvMapper = csvMapper;
		return this;
	}

	/**
	 * Set a custom BitbucketClient. When provided, no Bitbucket configuration is needed.
	 * @param bitbucketClient custom client (null to use default)
	 * @return this builder
	 */
	public PermissionSyncBuilder bitbucketClient(@Nullable BitbucketClient bitbucketClient) {
		this.bitbucketClient = bitbucketClient;
		return this;
	}

	/**
	 * Set a preconfigured GitHub connection. When provided, the token and API URL are not
	 * used.
	 * @param gitHub custom connection (null to use default)
	 * @return this builder
	 */
	public PermissionSyncBuilder gitHub(@Nullable GitHub gitHub) {
		this.gitHub = gitHub;
		return this;
	}

	public PermissionSyncBuilder csvRepository(@Nullable PermissionCsvRepository csvRepository) {
		this.csvRepository = csvRepository;
		return this;
	}

	public PermissionSyncBuilder engine(@Nullable PermissionResolutionEngine engine) {
		this.engine = engine;
		return this;
	}

	/**
	 * Build a GrantExtractionService.
	 * @return configured GrantExtractionService
	 * @throws IllegalStateException if neither Bitbucket settings nor a client were given
	 */
	public GrantExtractionService buildExtractionService() {
		Components components = buildComponents();
		return new GrantExtractionService(buildBitbucketService(components.objectMapper), components.csvRepository,
				properties);
	}

	public PermissionExpansionService buildExpansionService() {
		Components components = buildComponents();
		return new PermissionExpansionService(components.csvRepository, new GrantRowMapper(),
				engine != null ? engine : new PermissionResolutionEngine());
	}

	/**
	 * Build a PermissionApplyService.
	 * @return configured PermissionApplyService
	 * @throws IllegalStateException if neither a token nor a connection were given
	 */
	public PermissionApplyService buildApplyService() {
		return new PermissionApplyService(buildRestService(), buildComponents().csvRepository);
	}

	/**
	 * Build the GitHub RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		return new GitHubRestService(gitHub != null ? gitHub : connectToGitHub());
	}

	private BitbucketService buildBitbucketService(ObjectMapper mapper) {
		BitbucketClient client = this.bitbucketClient;
		if (client == null) {
			if (bitbucketConfig == null) {
				throw new IllegalStateException("Bitbucket settings are required. Call bitbucket() first.");
			}
			BitbucketConfig config = bitbucketConfig;
			if (config.rateLimitSleep().isZero() && properties.getRateLimitSleepSeconds() > 0) {
				config = config.withRateLimitSleep(
						Duration.ofMillis(Math.round(properties.getRateLimitSleepSeconds() * 1000)));
			}
			client = new BitbucketHttpClient(config);
		}
		return new BitbucketRestService(client, mapper, properties.getBitbucketPageSize());
	}

	private GitHub connectToGitHub() {
		if (gitHubToken == null || gitHubToken.isBlank()) {
			throw new IllegalStateException(
					"GitHub token is required. Call gitHubToken() or gitHubTokenFromEnv() first.");
		}
		try {
			return new GitHubBuilder().withEndpoint(gitHubApiUrl)
				.withOAuthToken(gitHubToken)
				.withRateLimitHandler(GitHubRateLimitHandler.WAIT)
				.withAbuseLimitHandler(GitHubAbuseLimitHandler.WAIT)
				.withRateLimitChecker(new RateLimitChecker.LiteralValue(properties.getPacingThreshold()))
				.build();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to connect to GitHub at " + gitHubApiUrl, e);
		}
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		CsvMapper csv = this.csvMapper != null ? this.csvMapper : ObjectMapperFactory.createCsvMapper();
		PermissionCsvRepository repository = this.csvRepository != null ? this.csvRepository
				: new FileSystemCsvRepository(csv);
		return new Components(mapper, repository);
	}

	private record Components(ObjectMapper objectMapper, PermissionCsvRepository csvRepository) {
	}

}
