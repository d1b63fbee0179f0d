package org.springaicommunity.github.releasenotes;

import java.util.List;

/**
 * Commits reachable from the head of a comparison but not from its base.
 *
 * @param commits the fetched commits in chronological order
 * @param truncated whether the comparison holds more commits than were fetched
 */
public record CommitComparison(List<CommitInfo> commits, boolean truncated) {

	public CommitComparison {
		commits = List.copyOf(commits);
	}

	/**
	 * Create a comparison whose commits were all fetched.
	 * @param commits the commits in chronological order
	 * @return a non-truncated comparison
	 */
	public static CommitComparison complete(List<CommitInfo> commits) {
		return new CommitComparison(commits, false);
	}

}
