package org.springaicommunity.github.releasenotes;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for wiring a {@link ReleaseNotesService} without a dependency injection
 * container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Simple usage with environment variable
 * ReleaseNotesService service = ReleaseNotesBuilder.create()
 *     .tokenFromEnv()
 *     .buildService();
 *
 * // With custom configuration
 * ReleaseNotesProperties props = new ReleaseNotesProperties();
 * props.setMaxHistoryPages(50);
 *
 * ReleaseNotesService service = ReleaseNotesBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildService();
 *
 * String notes = service.generate(new ReleaseNotesRequest("owner", "repo", null, null, "v1.2.0"));
 *
 * // For testing with a mock provider
 * CommitHistoryProvider mockProvider = mock(CommitHistoryProvider.class);
 * ReleaseNotesService testService = ReleaseNotesBuilder.create()
 *     .historyProvider(mockProvider)
 *     .buildService();
 * }
 * </pre>
 */
public class ReleaseNotesBuilder {

	private @Nullable String token;

	private ReleaseNotesProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable CommitHistoryProvider historyProvider;

	private @Nullable RetryPolicy retryPolicy;

	private ReleaseNotesBuilder() {
		this.properties = new ReleaseNotesProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ReleaseNotesBuilder
	 */
	public static ReleaseNotesBuilder create() {
		return new ReleaseNotesBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public ReleaseNotesBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from the GITHUB_TOKEN variable ({@code .env} file or
	 * environment).
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public ReleaseNotesBuilder tokenFromEnv() {
		String value = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		this.token = value;
		return this;
	}

	/**
	 * Set release notes properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ReleaseNotesBuilder properties(@Nullable ReleaseNotesProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ReleaseNotesBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators (caching, logging).
	 *
	 * <p>
	 * When a custom client is provided, the token is not required. Calls made through it
	 * are still retried.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public ReleaseNotesBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom CommitHistoryProvider. It is used as is, without retries, and takes
	 * precedence over {@link #httpClient(GitHubClient)}.
	 * @param historyProvider custom provider (null to use the GitHub REST API)
	 * @return this builder
	 */
	public ReleaseNotesBuilder historyProvider(@Nullable CommitHistoryProvider historyProvider) {
		this.historyProvider = historyProvider;
		return this;
	}

	/**
	 * Set a custom RetryPolicy instead of the one derived from the properties.
	 * @param retryPolicy retry policy (null to use the properties)
	 * @return this builder
	 */
	public ReleaseNotesBuilder retryPolicy(@Nullable RetryPolicy retryPolicy) {
		this.retryPolicy = retryPolicy;
		return this;
	}

	/**
	 * Build a ReleaseNotesService.
	 * @return configured ReleaseNotesService
	 */
	public ReleaseNotesService buildService() {
		AuthorIdentityResolver authorResolver = new AuthorIdentityResolver();
		CommitClassifier classifier = buildClassifier();
		return new ReleaseNotesService(buildHistoryProvider(), classifier, authorResolver,
				new ReleaseNotesFormatter(classifier.getIndex(), properties, authorResolver), properties);
	}

	/**
	 * Build the CommitHistoryProvider directly (for advanced usage).
	 * @return the custom provider, or a retrying provider over the GitHub REST API
	 */
	public CommitHistoryProvider buildHistoryProvider() {
		if (historyProvider != null) {
			return historyProvider;
		}
		validateToken();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(requireToken(), properties.getApiBaseUrl(), properties.getRequestTimeout());
		RetryPolicy retry = this.retryPolicy != null ? this.retryPolicy : buildRetryPolicy();
		return new RetryingCommitHistoryProvider(new GitHubRestService(client, mapper), retry);
	}

	/**
	 * Build the CommitClassifier for the configured categories and bot overrides.
	 * @return configured CommitClassifier
	 */
	public CommitClassifier buildClassifier() {
		PrefixCategoryIndex index = PrefixCategoryIndex.of(properties.getOtherCategoryName(),
				properties.getCategories());
		return new CommitClassifier(index, properties.getBotCategoryOverrides());
	}

	private RetryPolicy buildRetryPolicy() {
		return RetryPolicy.builder()
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getRetryDelay())
			.jitter(properties.getRetryJitter())
			.build();
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		requireToken();
	}

	private String requireToken() {
		String value = this.token;
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		return value;
	}

}
