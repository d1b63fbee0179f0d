package org.springaicommunity.github.releasenotes;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for release notes generation.
 *
 * <p>
 * This class provides the category table, the bot overrides and the limits used while
 * fetching history. Properties can be set directly via setters or passed to
 * {@link ReleaseNotesBuilder}.
 *
 * <p>
 * Default values are provided for all properties and are suitable for most use cases.
 * Lower {@code maxHistoryPages} for very large repositories to bound the time spent
 * collecting historical authors.
 */
public class ReleaseNotesProperties {

	/**
	 * Categories in the order they are registered. Section order follows their priority.
	 */
	private List<CategoryDefinition> categories = defaultCategories();

	/**
	 * Category for commits whose message matches no prefix.
	 */
	private String otherCategoryName = "Other";

	/**
	 * Heading emoji of the fallback category.
	 */
	private String otherCategoryEmoji = "📌";

	/**
	 * Heading emoji for categories found in a grouping but missing from the table.
	 */
	private String unknownCategoryEmoji = "🔹";

	/**
	 * Bot logins whose commits are categorized by author, mapped to the prefix looked up
	 * instead of the commit message.
	 */
	private Map<String, String> botCategoryOverrides = defaultBotCategoryOverrides();

	/**
	 * Number of commits requested per history page.
	 */
	private int pageSize = 100;

	/**
	 * Maximum number of history pages fetched when walking a ref's history.
	 */
	private int maxHistoryPages = 500;

	/**
	 * Maximum number of retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay between retry attempts, doubled on each retry.
	 */
	private Duration retryDelay = Duration.ofSeconds(2);

	/**
	 * Relative random variation applied to retry delays (0 to 1).
	 */
	private double retryJitter = 0.2;

	/**
	 * GitHub REST API root.
	 */
	private String apiBaseUrl = GitHubHttpClient.DEFAULT_API_BASE;

	/**
	 * Timeout of a single API request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(60);

	/**
	 * Returns the built-in category table.
	 * @return a new mutable list of the default categories
	 */
	public static List<CategoryDefinition> defaultCategories() {
		List<CategoryDefinition> categories = new ArrayList<>();
		categories.add(new CategoryDefinition("Breaking Changes", "💥", 1, List.of("break")));
		categories.add(new CategoryDefinition("Features", "✨", 2, List.of("feat")));
		categories.add(new CategoryDefinition("Refactoring", "♻️", 3, List.of("refactor")));
		categories.add(new CategoryDefinition("Fixes", "🐛", 4, List.of("fix", "bug")));
		categories.add(new CategoryDefinition("Performance", "⚡", 5, List.of("perf")));
		categories.add(new CategoryDefinition("General Changes", "🧹", 6,
				List.of("housekeeping", "chore", "update")));
		categories.add(new CategoryDefinition("Tests", "✅", 7, List.of("test")));
		categories.add(new CategoryDefinition("Documentation", "📝", 8, List.of("doc")));
		categories.add(new CategoryDefinition("Style Changes", "💅", 9, List.of("style")));
		categories.add(new CategoryDefinition("Dependencies", "📦", 10, List.of("dep")));
		return categories;
	}

	/**
	 * Returns the built-in bot overrides: dependency update bots map to "Dependencies".
	 * @return a new mutable map of bot login to prefix key
	 */
	public static Map<String, String> defaultBotCategoryOverrides() {
		Map<String, String> overrides = new LinkedHashMap<>();
		overrides.put("renovate[bot]", "dep");
		overrides.put("dependabot[bot]", "dep");
		overrides.put("dependabot", "dep");
		return overrides;
	}

	public List<CategoryDefinition> getCategories() {
		return categories;
	}

	public void setCategories(List<CategoryDefinition> categories) {
		this.categories = categories;
	}

	public String getOtherCategoryName() {
		return otherCategoryName;
	}

	public void setOtherCategoryName(String otherCategoryName) {
		this.otherCategoryName = otherCategoryName;
	}

	public String getOtherCategoryEmoji() {
		return otherCategoryEmoji;
	}

	public void setOtherCategoryEmoji(String otherCategoryEmoji) {
		this.otherCategoryEmoji = otherCategoryEmoji;
	}

	public String getUnknownCategoryEmoji() {
		return unknownCategoryEmoji;
	}

	public void setUnknownCategoryEmoji(String unknownCategoryEmoji) {
		this.unknownCategoryEmoji = unknownCategoryEmoji;
	}

	public Map<String, String> getBotCategoryOverrides() {
		return botCategoryOverrides;
	}

	public void setBotCategoryOverrides(Map<String, String> botCategoryOverrides) {
		this.botCategoryOverrides = botCategoryOverrides;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getMaxHistoryPages() {
		return maxHistoryPages;
	}

	public void setMaxHistoryPages(int maxHistoryPages) {
		this.maxHistoryPages = maxHistoryPages;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getRetryDelay() {
		return retryDelay;
	}

	public void setRetryDelay(Duration retryDelay) {
		this.retryDelay = retryDelay;
	}

	public double getRetryJitter() {
		return retryJitter;
	}

	public void setRetryJitter(double retryJitter) {
		this.retryJitter = retryJitter;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

}
