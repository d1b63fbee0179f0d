package org.springaicommunity.github.releasenotes;

import java.util.List;
import java.util.Optional;

/**
 * Decorator that runs every call of a {@link CommitHistoryProvider} through a
 * {@link RetryPolicy}.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * CommitHistoryProvider provider = new RetryingCommitHistoryProvider(
 *     new GitHubRestService(new GitHubHttpClient(token), ObjectMapperFactory.create()),
 *     RetryPolicy.builder().build());
 * }
 * </pre>
 */
public final class RetryingCommitHistoryProvider implements CommitHistoryProvider {

	private final CommitHistoryProvider delegate;

	private final RetryPolicy retryPolicy;

	public RetryingCommitHistoryProvider(CommitHistoryProvider delegate, RetryPolicy retryPolicy) {
		this.delegate = delegate;
		this.retryPolicy = retryPolicy;
	}

	@Override
	public RepositoryInfo getRepository(String owner, String repo) {
		return retryPolicy.execute("Get repository " + owner + "/" + repo, () -> delegate.getRepository(owner, repo));
	}

	@Override
	public Optional<Release> getLatestRelease(String owner, String repo) {
		return retryPolicy.execute("Get latest release of " + owner + "/" + repo,
				() -> delegate.getLatestRelease(owner, repo));
	}

	@Override
	public CommitComparison compareRefs(String owner, String repo, String base, String head) {
		return retryPolicy.execute("Compare " + base + "..." + head,
				() -> delegate.compareRefs(owner, repo, base, head));
	}

	@Override
	public List<CommitInfo> listCommits(String owner, String repo, String ref, int page, int pageSize) {
		return retryPolicy.execute("List commits of " + ref + " (page " + page + ")",
				() -> delegate.listCommits(owner, repo, ref, page, pageSize));
	}

}
