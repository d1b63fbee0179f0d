package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

/**
 * A commit as returned by a {@link CommitHistoryProvider}.
 *
 * <p>
 * GitHub distinguishes between the account linked to a commit ({@code author.login},
 * {@code committer.login}) and the raw git identity recorded in the commit object
 * ({@code commit.author.name}, {@code commit.committer.name}). Either may be missing, for
 * example when the commit email is not linked to any account.
 *
 * @param sha the commit SHA
 * @param message the full commit message
 * @param authorLogin login of the GitHub account that authored the commit
 * @param committerLogin login of the GitHub account that committed the commit
 * @param authorName git author display name
 * @param committerName git committer display name
 */
public record CommitInfo(String sha, String message, @Nullable String authorLogin, @Nullable String committerLogin,
		@Nullable String authorName, @Nullable String committerName) {

	/**
	 * Returns the first line of the commit message.
	 * @return the subject line, empty if the message is empty
	 */
	public String subject() {
		int end = message.indexOf('\n');
		String line = end >= 0 ? message.substring(0, end) : message;
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

}
