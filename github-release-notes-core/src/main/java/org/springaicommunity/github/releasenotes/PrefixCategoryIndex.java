package org.springaicommunity.github.releasenotes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Prefix tree mapping lowercase commit message prefixes to release-note categories.
 *
 * <p>
 * Nodes live in a single growable list owned by the index; child edges are indexes into
 * that list keyed by lowercase character. Node 0 is the root and is never terminal.
 *
 * <p>
 * {@link #lookup(String)} walks the message one character at a time and returns the
 * category of the first terminal node it reaches, so its cost depends only on the length
 * of the matched prefix. Which category wins when one registered prefix is itself a
 * prefix of another is unspecified.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * PrefixCategoryIndex index = new PrefixCategoryIndex("Other");
 * index.insert(2, "Features", List.of("feat"));
 * index.insert(4, "Fixes", List.of("fix", "bug"));
 *
 * index.lookup("feat: add button"); // (2, "Features")
 * index.lookup("Bugfix in parser"); // (4, "Fixes")
 * index.lookup("initial import");   // (Integer.MAX_VALUE, "Other")
 * }
 * </pre>
 */
public final class PrefixCategoryIndex implements Iterable<PrefixGroup> {

	private static final int ROOT = 0;

	private final List<Node> nodes = new ArrayList<>();

	private final List<PrefixGroup> groups = new ArrayList<>();

	private final CategoryMatch otherCategory;

	/**
	 * Create an empty index.
	 * @param otherCategoryName category returned for messages matching no prefix
	 */
	public PrefixCategoryIndex(String otherCategoryName) {
		this.otherCategory = new CategoryMatch(Integer.MAX_VALUE, otherCategoryName);
		this.nodes.add(new Node());
	}

	/**
	 * Create an index holding the given categories.
	 * @param otherCategoryName category returned for messages matching no prefix
	 * @param categories categories to insert, in order
	 * @return the populated index
	 */
	public static PrefixCategoryIndex of(String otherCategoryName, List<CategoryDefinition> categories) {
		PrefixCategoryIndex index = new PrefixCategoryIndex(otherCategoryName);
		for (CategoryDefinition category : categories) {
			index.insert(category.priority(), category.name(), category.prefixes());
		}
		return index;
	}

	/**
	 * Register a category and insert all of its prefixes.
	 * @param priority the category priority
	 * @param category the category name
	 * @param prefixes the prefixes mapping to the category
	 * @throws IllegalArgumentException if a prefix is empty
	 */
	public void insert(int priority, String category, List<String> prefixes) {
		Objects.requireNonNull(category, "category");
		for (String prefix : prefixes) {
			if (prefix.isEmpty()) {
				throw new IllegalArgumentException("Empty prefix registered for category '" + category + "'");
			}
		}
		groups.add(new PrefixGroup(priority, category, prefixes));
		for (String prefix : prefixes) {
			insertPrefix(priority, category, prefix);
		}
	}

	private void insertPrefix(int priority, String category, String prefix) {
		int current = ROOT;
		for (int i = 0; i < prefix.length(); i++) {
			char ch = Character.toLowerCase(prefix.charAt(i));
			Integer child = nodes.get(current).children.get(ch);
			if (child == null) {
				child = nodes.size();
				nodes.add(new Node());
				nodes.get(current).children.put(ch, child);
			}
			current = child;
		}
		Node terminal = nodes.get(current);
		terminal.priority = priority;
		terminal.category = category;
	}

	/**
	 * Find the category of a commit message.
	 * @param message the commit message
	 * @return the matched category, or {@link #otherCategory()} if no prefix matches
	 */
	public CategoryMatch lookup(String message) {
		Objects.requireNonNull(message, "message");
		int current = ROOT;
		for (int i = 0; i < message.length(); i++) {
			Integer child = nodes.get(current).children.get(Character.toLowerCase(message.charAt(i)));
			if (child == null) {
				return otherCategory;
			}
			current = child;
			Node node = nodes.get(current);
			if (node.category != null) {
				return new CategoryMatch(node.priority, node.category);
			}
		}
		return otherCategory;
	}

	/**
	 * Returns the fallback category for unmatched messages.
	 * @return the fallback, always with priority {@link Integer#MAX_VALUE}
	 */
	public CategoryMatch otherCategory() {
		return otherCategory;
	}

	/**
	 * Returns whether a category with this name was registered.
	 * @param category category name, compared case-insensitively
	 * @return true if the name belongs to a registered category
	 */
	public boolean isKnownCategory(String category) {
		for (PrefixGroup group : groups) {
			if (group.category().equalsIgnoreCase(category)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the registered categories in insertion order.
	 * @return unmodifiable view of the registered groups
	 */
	public List<PrefixGroup> groups() {
		return Collections.unmodifiableList(groups);
	}

	/**
	 * Returns the number of registered categories.
	 * @return category count
	 */
	public int size() {
		return groups.size();
	}

	@Override
	public Iterator<PrefixGroup> iterator() {
		return groups().iterator();
	}

	private static final class Node {

		private final Map<Character, Integer> children = new HashMap<>();

		private int priority = Integer.MAX_VALUE;

		private @Nullable String category;

	}

}
