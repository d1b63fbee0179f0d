package org.springaicommunity.github.releasenotes;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Everything collected for one release before rendering.
 *
 * @param repository the repository the release belongs to
 * @param window the resolved base and head refs
 * @param groupedCommits window commits per category, in ascending category priority
 * @param authorsInWindow every identity that authored or co-authored a window commit
 * @param authorsBeforeWindow every identity found in the history reachable from the base
 * ref (empty when the window covers the entire history)
 * @param newAuthors {@code authorsInWindow} minus {@code authorsBeforeWindow}
 * @param historyTruncated whether a page cap stopped a history walk or the comparison early,
 * in which case the window commits or {@code authorsBeforeWindow} may be incomplete
 */
public record AggregationResult(RepositoryInfo repository, ReleaseWindow window,
		Map<String, List<ClassifiedCommit>> groupedCommits, SortedSet<String> authorsInWindow,
		SortedSet<String> authorsBeforeWindow, SortedSet<String> newAuthors, boolean historyTruncated) {

	public int commitCount() {
		return groupedCommits.values().stream().mapToInt(List::size).sum();
	}

}
