package org.springaicommunity.github.releasenotes;

import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Extracts and normalizes the identities credited for a commit.
 *
 * <p>
 * The primary identity is the first non-blank of: author login, committer login, git
 * author name, git committer name. Additional identities come from
 * {@code Co-authored-by:} trailer lines in the commit message. Identities are compared
 * case-insensitively everywhere.
 */
public class AuthorIdentityResolver {

	static final String UNKNOWN = "unknown";

	private static final String CO_AUTHOR_MARKER = "co-authored-by:";

	private static final String BOT_MARKER = "[bot]";

	private static final Pattern LINE_SEPARATOR = Pattern.compile("\r\n|\n");

	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	/**
	 * Create an empty identity set with case-insensitive equality and ordering.
	 * @return new mutable set
	 */
	public static SortedSet<String> newIdentitySet() {
		return new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
	}

	/**
	 * Extract the primary author and all co-authors of a commit.
	 * @param commit the commit
	 * @return normalized identities, never empty
	 */
	public SortedSet<String> extractAuthors(CommitInfo commit) {
		SortedSet<String> authors = newIdentitySet();

		String primary = firstNonBlank(commit.authorLogin(), commit.committerLogin(), commit.authorName(),
				commit.committerName());
		authors.add(normalize(primary != null ? primary : UNKNOWN));

		for (String line : LINE_SEPARATOR.split(commit.message(), -1)) {
			String trimmed = line.trim();
			if (trimmed.length() >= CO_AUTHOR_MARKER.length()
					&& trimmed.regionMatches(true, 0, CO_AUTHOR_MARKER, 0, CO_AUTHOR_MARKER.length())) {
				authors.add(normalize(trimmed.substring(CO_AUTHOR_MARKER.length())));
			}
		}
		return authors;
	}

	/**
	 * Normalize a login or a "Name &lt;email&gt;" string: drop everything from the first
	 * {@code <}, then all whitespace.
	 * @param raw raw identity
	 * @return normalized identity, {@code "unknown"} if nothing is left
	 */
	public String normalize(@Nullable String raw) {
		if (raw == null) {
			return UNKNOWN;
		}
		int emailStart = raw.indexOf('<');
		String name = emailStart >= 0 ? raw.substring(0, emailStart) : raw;
		String normalized = WHITESPACE.matcher(name).replaceAll("").trim();
		return normalized.isEmpty() ? UNKNOWN : normalized;
	}

	/**
	 * Returns whether an identity belongs to an automated account.
	 * @param identity normalized identity
	 * @return true if it contains {@code [bot]}, ignoring case
	 */
	public boolean isBot(String identity) {
		return identity.toLowerCase(Locale.ROOT).contains(BOT_MARKER);
	}

	private static @Nullable String firstNonBlank(@Nullable String... candidates) {
		for (String candidate : candidates) {
			if (candidate != null && !candidate.isBlank()) {
				return candidate;
			}
		}
		return null;
	}

}
