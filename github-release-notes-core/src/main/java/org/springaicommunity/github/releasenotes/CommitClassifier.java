package org.springaicommunity.github.releasenotes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Assigns commits to release-note categories.
 *
 * <p>
 * Commits made by a known bot account are categorized by their author: the bot's login is
 * mapped to a synthetic key which is looked up in the same {@link PrefixCategoryIndex} as
 * commit messages, so bot overrides and prefix rules share one priority order. All other
 * commits are categorized by the prefix of their message.
 */
public class CommitClassifier {

	private final PrefixCategoryIndex index;

	private final Map<String, String> botLoginToKey;

	/**
	 * @param index the prefix index used for messages and bot keys
	 * @param botLoginToKey bot login to index key, logins compared case-insensitively
	 */
	public CommitClassifier(PrefixCategoryIndex index, Map<String, String> botLoginToKey) {
		this.index = index;
		TreeMap<String, String> overrides = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		overrides.putAll(botLoginToKey);
		this.botLoginToKey = overrides;
	}

	public PrefixCategoryIndex getIndex() {
		return index;
	}

	/**
	 * Categorize a single commit.
	 * @param commit the commit
	 * @return the category and its priority
	 */
	public CategoryMatch classify(CommitInfo commit) {
		String login = commit.authorLogin() != null ? commit.authorLogin() : commit.committerLogin();
		if (login != null && !login.isEmpty()) {
			String key = botLoginToKey.get(login);
			if (key != null) {
				return index.lookup(key);
			}
		}
		return index.lookup(commit.message());
	}

	/**
	 * Group commits by category.
	 * @param commits commits in history order
	 * @return category name to commits, iterated in ascending category priority; commits
	 * keep their input order within a category
	 */
	public Map<String, List<CommitInfo>> group(List<CommitInfo> commits) {
		return groupBy(commits, this::classify);
	}

	/**
	 * Group already classified commits by category, with the same ordering guarantees as
	 * {@link #group(List)}.
	 * @param commits classified commits in history order
	 * @return category name to commits in ascending category priority
	 */
	public Map<String, List<ClassifiedCommit>> groupClassified(List<ClassifiedCommit> commits) {
		return groupBy(commits, c -> new CategoryMatch(c.priority(), c.category()));
	}

	private static <T> Map<String, List<T>> groupBy(List<T> items, Function<T, CategoryMatch> classification) {
		List<Entry<T>> entries = new ArrayList<>(items.size());
		for (T item : items) {
			entries.add(new Entry<>(classification.apply(item), item));
		}
		// List.sort is stable, so equal priorities keep their input order
		entries.sort(Comparator.comparingInt(e -> e.match().priority()));

		Map<String, List<T>> grouped = new LinkedHashMap<>();
		for (Entry<T> entry : entries) {
			grouped.computeIfAbsent(entry.match().category(), k -> new ArrayList<>()).add(entry.item());
		}
		return grouped;
	}

	private record Entry<T>(CategoryMatch match, T item) {
	}

}
