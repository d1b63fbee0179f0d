package org.springaicommunity.github.releasenotes;

import java.util.List;

/**
 * A release-note category with its heading emoji and the commit message prefixes that map
 * to it.
 *
 * @param name the display name used as section heading (e.g. "Features")
 * @param emoji the emoji shown in front of the heading
 * @param priority the section order, lower values render first
 * @param prefixes the lowercase commit message prefixes assigned to this category
 */
public record CategoryDefinition(String name, String emoji, int priority, List<String> prefixes) {

	public CategoryDefinition {
		prefixes = List.copyOf(prefixes);
	}

}
