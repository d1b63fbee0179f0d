package org.springaicommunity.github.releasenotes;

/**
 * Result of classifying a commit.
 *
 * @param priority the priority of the matched category ({@link Integer#MAX_VALUE} for the
 * fallback category)
 * @param category the category name
 */
public record CategoryMatch(int priority, String category) {
}
