package org.springaicommunity.github.releasenotes;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A commit assigned to a release-note category, with its resolved authors.
 *
 * @param commit the classified commit
 * @param category the category name
 * @param priority the category priority
 * @param authors the normalized author identities, ordered case-insensitively
 */
public record ClassifiedCommit(CommitInfo commit, String category, int priority, SortedSet<String> authors) {

	public ClassifiedCommit {
		TreeSet<String> copy = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
		copy.addAll(authors);
		authors = Collections.unmodifiableSortedSet(copy);
	}

	public static ClassifiedCommit of(CommitInfo commit, CategoryMatch match, SortedSet<String> authors) {
		return new ClassifiedCommit(commit, match.category(), match.priority(), authors);
	}

}
