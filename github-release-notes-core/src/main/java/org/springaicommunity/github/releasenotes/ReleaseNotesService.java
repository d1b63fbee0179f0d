package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Generates the release notes of a repository between two refs.
 *
 * <p>
 * A run resolves the release window (latest release to default branch unless given
 * explicitly), fetches the window commits, collects the authors of the history before the
 * window to tell new contributors apart, classifies and groups the window commits and
 * finally renders them with {@link ReleaseNotesFormatter}.
 *
 * <p>
 * All remote calls are sequential. A failure the provider does not recover from aborts
 * the run with a {@link ReleaseNotesException}; a missing latest release is not a
 * failure and makes the window cover the entire history of the head ref.
 */
public class ReleaseNotesService {

	private static final Logger logger = LoggerFactory.getLogger(ReleaseNotesService.class);

	private final CommitHistoryProvider historyProvider;

	private final CommitClassifier classifier;

	private final AuthorIdentityResolver authorResolver;

	private final ReleaseNotesFormatter formatter;

	private final ReleaseNotesProperties properties;

	public ReleaseNotesService(CommitHistoryProvider historyProvider, CommitClassifier classifier,
			AuthorIdentityResolver authorResolver, ReleaseNotesFormatter formatter, ReleaseNotesProperties properties) {
		this.historyProvider = historyProvider;
		this.classifier = classifier;
		this.authorResolver = authorResolver;
		this.formatter = formatter;
		this.properties = properties;
	}

	/**
	 * Collect and render the release notes for a request.
	 * @param request owner, repository, optional refs and the version being released
	 * @return the Markdown document
	 * @throws ReleaseNotesException if a remote call fails
	 */
	public String generate(ReleaseNotesRequest request) {
		AggregationResult result = aggregate(request);
		return formatter.format(result, request.version());
	}

	/**
	 * Collect everything needed to render the release notes of a request.
	 * @param request owner, repository, optional refs and the version being released
	 * @return grouped commits and contributor sets
	 * @throws ReleaseNotesException if a remote call fails
	 */
	public AggregationResult aggregate(ReleaseNotesRequest request) {
		String owner = request.owner();
		String repo = request.repo();
		logger.info("Generating release notes for {} version {}", request.fullName(), request.version());

		RepositoryInfo repository = call("get repository " + request.fullName(),
				() -> historyProvider.getRepository(owner, repo));

		ReleaseWindow window = new ReleaseWindow(resolveBaseRef(request), resolveHeadRef(request, repository));
		logger.info("Release window for {}: {}", request.fullName(), window);

		List<CommitInfo> windowCommits;
		boolean truncated;
		if (window.baseRef() != null) {
			String base = window.baseRef();
			CommitComparison comparison = call("compare " + base + "..." + window.headRef(),
					() -> historyProvider.compareRefs(owner, repo, base, window.headRef()));
			windowCommits = comparison.commits();
			truncated = comparison.truncated();
		}
		else {
			List<CommitInfo> history = new ArrayList<>();
			truncated = walkHistory(owner, repo, window.headRef(), history::addAll).truncated();
			windowCommits = history;
		}
		logger.info("Found {} commits in {}", windowCommits.size(), window);

		List<ClassifiedCommit> classified = new ArrayList<>(windowCommits.size());
		SortedSet<String> authorsInWindow = AuthorIdentityResolver.newIdentitySet();
		for (CommitInfo commit : windowCommits) {
			SortedSet<String> authors = authorResolver.extractAuthors(commit);
			authorsInWindow.addAll(authors);
			classified.add(ClassifiedCommit.of(commit, classifier.classify(commit), authors));
		}

		SortedSet<String> authorsBeforeWindow = AuthorIdentityResolver.newIdentitySet();
		if (window.baseRef() != null) {
			HistoryWalk previous = walkHistory(owner, repo, window.baseRef(), page -> {
				for (CommitInfo commit : page) {
					authorsBeforeWindow.addAll(authorResolver.extractAuthors(commit));
				}
			});
			truncated |= previous.truncated();
			logger.info("Found {} contributors in {} commits reachable from {}", authorsBeforeWindow.size(),
					previous.commitCount(), window.baseRef());
		}

		SortedSet<String> newAuthors = AuthorIdentityResolver.newIdentitySet();
		newAuthors.addAll(authorsInWindow);
		newAuthors.removeAll(authorsBeforeWindow);
		logger.info("{} contributors in window, {} new", authorsInWindow.size(), newAuthors.size());

		return new AggregationResult(repository, window, classifier.groupClassified(classified), authorsInWindow,
				authorsBeforeWindow, newAuthors, truncated);
	}

	private @Nullable String resolveBaseRef(ReleaseNotesRequest request) {
		if (request.baseRef() != null && !request.baseRef().isBlank()) {
			return request.baseRef();
		}
		Optional<Release> latest = call("get latest release of " + request.fullName(),
				() -> historyProvider.getLatestRelease(request.owner(), request.repo()));
		if (latest.isPresent()) {
			logger.info("Latest release of {}: {}", request.fullName(), latest.get().tagName());
			return latest.get().tagName();
		}
		logger.info("No release found for {}, including the entire history", request.fullName());
		return null;
	}

	private static String resolveHeadRef(ReleaseNotesRequest request, RepositoryInfo repository) {
		if (request.headRef() != null && !request.headRef().isBlank()) {
			return request.headRef();
		}
		return repository.defaultBranch();
	}

	/**
	 * Page through the history reachable from a ref until an empty page or the page cap,
	 * handing each page to {@code pageConsumer} as it arrives.
	 */
	private HistoryWalk walkHistory(String owner, String repo, String ref, Consumer<List<CommitInfo>> pageConsumer) {
		int pageSize = properties.getPageSize();
		int maxPages = properties.getMaxHistoryPages();
		int commitCount = 0;

		for (int page = 1; page <= maxPages; page++) {
			if (Thread.currentThread().isInterrupted()) {
				throw new ReleaseNotesException(ErrorKind.CANCELLED,
						"Interrupted while reading history of " + ref + " at page " + page);
			}
			int current = page;
			List<CommitInfo> pageCommits = call("list commits of " + ref + " (page " + page + ")",
					() -> historyProvider.listCommits(owner, repo, ref, current, pageSize));
			if (pageCommits.isEmpty()) {
				return new HistoryWalk(commitCount, false);
			}
			pageConsumer.accept(pageCommits);
			commitCount += pageCommits.size();
			logger.debug("History of {} page {}: {} commits so far", ref, page, commitCount);
		}

		logger.warn("Reached the limit of {} pages reading the history of {}; contributors older than the first {} "
				+ "commits are ignored", maxPages, ref, commitCount);
		return new HistoryWalk(commitCount, true);
	}

	private static <T> T call(String description, Supplier<T> call) {
		try {
			return call.get();
		}
		catch (ReleaseNotesException e) {
			throw e;
		}
		catch (RuntimeException e) {
			ErrorKind kind = RetryPolicy.classify(e);
			throw new ReleaseNotesException(kind, "Failed to " + description + ": " + e.getMessage(), e);
		}
	}

	private record HistoryWalk(int commitCount, boolean truncated) {
	}

}
