package org.springaicommunity.github.releasenotes;

import java.util.List;

/**
 * A category registered in a {@link PrefixCategoryIndex} together with its prefixes.
 *
 * @param priority the category priority
 * @param category the category name
 * @param prefixes the prefixes inserted for the category, in insertion order
 */
public record PrefixGroup(int priority, String category, List<String> prefixes) {

	public PrefixGroup {
		prefixes = List.copyOf(prefixes);
	}

}
