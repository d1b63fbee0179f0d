package org.springaicommunity.github.releasenotes;

import java.util.List;
import java.util.Optional;

/**
 * Access to the commit history of a hosted repository.
 *
 * <p>
 * Returns strongly-typed DTOs and hides the transport. Implementations throw
 * {@link GitHubHttpClient.GitHubApiException} (or another runtime exception) when a call
 * fails; the one expected "not found" - a repository without releases - is reported as
 * {@link Optional#empty()} instead.
 */
public interface CommitHistoryProvider {

	/**
	 * Get repository information.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @return Repository information
	 */
	RepositoryInfo getRepository(String owner, String repo);

	/**
	 * Get the latest published release.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @return the latest release, or empty if the repository has no release yet
	 */
	Optional<Release> getLatestRelease(String owner, String repo);

	/**
	 * Get the commits reachable from {@code head} but not from {@code base}.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param base Ref to compare from
	 * @param head Ref to compare to
	 * @return commits in chronological order, flagged when only part of them was fetched
	 */
	CommitComparison compareRefs(String owner, String repo, String base, String head);

	/**
	 * List one page of the history reachable from a ref, newest first.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param ref Branch, tag or SHA to start from
	 * @param page 1-based page number
	 * @param pageSize commits per page
	 * @return the commits of the page, empty once the history is exhausted
	 */
	List<CommitInfo> listCommits(String owner, String repo, String ref, int page, int pageSize);

}
