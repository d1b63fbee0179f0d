package org.springaicommunity.github.releasenotes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CommitHistoryProvider} backed by the GitHub REST API.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubRestService implements CommitHistoryProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

	/**
	 * Page size of the compare endpoint (GitHub maximum).
	 */
	private static final int COMPARE_PAGE_SIZE = 100;

	/**
	 * Upper bound of compare pages fetched for a single comparison.
	 */
	private static final int MAX_COMPARE_PAGES = 100;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public RepositoryInfo getRepository(String owner, String repo) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo)));
		return new RepositoryInfo(node.path("id").asLong(), node.path("name").asText(repo),
				node.path("full_name").asText(owner + "/" + repo),
				node.path("html_url").asText("https://github.com/" + owner + "/" + repo),
				node.path("default_branch").asText("main"));
	}

	@Override
	public Optional<Release> getLatestRelease(String owner, String repo) {
		try {
			JsonNode node = readTree(httpClient.get(repoPath(owner, repo) + "/releases/latest"));
			return Optional.of(parseRelease(node));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				logger.debug("No latest release for {}/{}", owner, repo);
				return Optional.empty();
			}
			throw e;
		}
	}

	@Override
	public CommitComparison compareRefs(String owner, String repo, String base, String head) {
		String path = repoPath(owner, repo) + "/compare/" + encodePath(base) + "..." + encodePath(head);
		List<CommitInfo> commits = new ArrayList<>();
		int total = 0;

		for (int page = 1; page <= MAX_COMPARE_PAGES; page++) {
			JsonNode comparison = readTree(
					httpClient.getWithQuery(path, "per_page=" + COMPARE_PAGE_SIZE + "&page=" + page));
			List<CommitInfo> pageCommits = parseCommits(comparison.path("commits"));
			commits.addAll(pageCommits);

			total = comparison.path("total_commits").asInt(commits.size());
			logger.debug("Compare {}...{} page {}: {}/{} commits", base, head, page, commits.size(), total);
			if (pageCommits.isEmpty() || commits.size() >= total) {
				return new CommitComparison(commits, commits.size() < total);
			}
		}

		logger.warn("Comparison {}...{} exceeds {} pages, keeping the first {} of {} commits", base, head,
				MAX_COMPARE_PAGES, commits.size(), total);
		return new CommitComparison(commits, true);
	}

	@Override
	public List<CommitInfo> listCommits(String owner, String repo, String ref, int page, int pageSize) {
		String query = "sha=" + URLEncoder.encode(ref, StandardCharsets.UTF_8) + "&per_page=" + pageSize + "&page="
				+ page;
		return parseCommits(readTree(httpClient.getWithQuery(repoPath(owner, repo) + "/commits", query)));
	}

	// ========== JSON Parsing Methods ==========

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new UncheckedIOException("Malformed GitHub API response", e);
		}
	}

	private List<CommitInfo> parseCommits(JsonNode nodes) {
		List<CommitInfo> commits = new ArrayList<>();
		if (nodes != null && nodes.isArray()) {
			for (JsonNode node : nodes) {
				commits.add(parseCommit(node));
			}
		}
		return commits;
	}

	private CommitInfo parseCommit(JsonNode node) {
		JsonNode gitCommit = node.path("commit");
		return new CommitInfo(node.path("sha").asText("unknown"), gitCommit.path("message").asText(""),
				textOrNull(node.path("author").path("login")), textOrNull(node.path("committer").path("login")),
				textOrNull(gitCommit.path("author").path("name")),
				textOrNull(gitCommit.path("committer").path("name")));
	}

	private Release parseRelease(JsonNode node) {
		return new Release(node.path("id").asLong(), node.path("tag_name").asText(""),
				textOrNull(node.path("name")), node.path("draft").asBoolean(false),
				node.path("prerelease").asBoolean(false), parseDateTime(textOrNull(node.path("published_at"))),
				node.path("html_url").asText(""));
	}

	private static @Nullable String textOrNull(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

	private @Nullable LocalDateTime parseDateTime(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return LocalDateTime.parse(dateTimeStr, ISO_FORMATTER);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", dateTimeStr);
			return null;
		}
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + encodePath(owner) + "/" + encodePath(repo);
	}

	/**
	 * Encode a ref for use in a URL path. Slashes are kept since GitHub accepts branch
	 * names such as {@code release/1.x} unescaped.
	 */
	static String encodePath(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20").replace("%2F", "/");
	}

}
