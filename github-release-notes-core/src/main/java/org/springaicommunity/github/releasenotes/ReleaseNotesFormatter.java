package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders an {@link AggregationResult} as a Markdown release-note document.
 *
 * <p>
 * Sections appear in this order: known categories by ascending priority, the fallback
 * category, then any category present in the grouping but missing from the table. Empty
 * sections are left out. The contributions block lists new contributors and all
 * contributors without bots, followed by the bots on their own line.
 */
public class ReleaseNotesFormatter {

	static final String HEADER = "## 🗺️ What's Changed";

	static final String CHANGELOG_PREFIX = "🔗 **Full Changelog**: ";

	static final String CONTRIBUTIONS_HEADER = "### 🙌 Contributions";

	static final String NEW_CONTRIBUTORS_PREFIX = "🌱 New contributors since the last release: ";

	static final String ALL_CONTRIBUTORS_PREFIX = "💖 Thanks to all the contributors: ";

	static final String BOTS_PREFIX = "🤖 Automated services that contributed: ";

	private final PrefixCategoryIndex index;

	private final List<PrefixGroup> sections;

	private final Map<String, String> emojiByCategory = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

	private final String unknownCategoryEmoji;

	private final AuthorIdentityResolver authorResolver;

	/**
	 * @param index the category table the commits were grouped with
	 * @param properties source of the category emojis
	 * @param authorResolver used to tell bots apart
	 */
	public ReleaseNotesFormatter(PrefixCategoryIndex index, ReleaseNotesProperties properties,
			AuthorIdentityResolver authorResolver) {
		this.index = index;
		this.sections = index.groups()
			.stream()
			.sorted(Comparator.comparingInt(PrefixGroup::priority))
			.collect(Collectors.toList());
		for (CategoryDefinition category : properties.getCategories()) {
			emojiByCategory.put(category.name(), category.emoji());
		}
		emojiByCategory.put(index.otherCategory().category(), properties.getOtherCategoryEmoji());
		this.unknownCategoryEmoji = properties.getUnknownCategoryEmoji();
		this.authorResolver = authorResolver;
	}

	/**
	 * Build the "Full Changelog" link.
	 * @param repositoryHtmlUrl web URL of the repository
	 * @param baseRef base ref of the window, or null when the window is the whole history
	 * @param version version being released
	 * @return compare view URL when a base ref exists, commit history URL otherwise
	 */
	public static String changelogUrl(String repositoryHtmlUrl, @Nullable String baseRef, String version) {
		String root = repositoryHtmlUrl.endsWith("/") ? repositoryHtmlUrl.substring(0, repositoryHtmlUrl.length() - 1)
				: repositoryHtmlUrl;
		if (baseRef != null && !baseRef.isEmpty()) {
			return root + "/compare/" + baseRef + "..." + version;
		}
		return root + "/commits/" + version;
	}

	/**
	 * Render the release notes of an aggregation run.
	 * @param result the aggregation result
	 * @param version version being released
	 * @return Markdown document
	 */
	public String format(AggregationResult result, String version) {
		RepositoryInfo repository = result.repository();
		return format(repository.fullName(),
				changelogUrl(repository.htmlUrl(), result.window().baseRef(), version), result.authorsInWindow(),
				result.newAuthors(), result.groupedCommits());
	}

	/**
	 * Render release notes from their parts.
	 * @param repositoryFullName "owner/repo", used in commit references
	 * @param changelogUrl the full changelog link
	 * @param allAuthors everyone who contributed to the window
	 * @param newAuthors contributors who had not contributed before the window
	 * @param groupedCommits commits per category
	 * @return Markdown document
	 */
	public String format(String repositoryFullName, String changelogUrl, Collection<String> allAuthors,
			Collection<String> newAuthors, Map<String, List<ClassifiedCommit>> groupedCommits) {
		StringBuilder sb = new StringBuilder();
		sb.append(HEADER).append('\n').append('\n');

		Map<String, List<ClassifiedCommit>> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		byName.putAll(groupedCommits);

		for (PrefixGroup section : sections) {
			appendSection(sb, section.category(), byName.get(section.category()), repositoryFullName);
		}
		String otherCategoryName = index.otherCategory().category();
		appendSection(sb, otherCategoryName, byName.get(otherCategoryName), repositoryFullName);

		for (Map.Entry<String, List<ClassifiedCommit>> entry : groupedCommits.entrySet()) {
			if (!index.isKnownCategory(entry.getKey()) && !entry.getKey().equalsIgnoreCase(otherCategoryName)) {
				appendSection(sb, entry.getKey(), entry.getValue(), repositoryFullName);
			}
		}

		sb.append(CHANGELOG_PREFIX).append(changelogUrl).append('\n').append('\n');

		sb.append(CONTRIBUTIONS_HEADER).append('\n');

		List<String> newHumans = newAuthors.stream().filter(a -> !authorResolver.isBot(a)).collect(Collectors.toList());
		if (!newHumans.isEmpty()) {
			sb.append(NEW_CONTRIBUTORS_PREFIX).append(mentions(newHumans, ", ")).append('\n');
		}

		List<String> humans = allAuthors.stream().filter(a -> !authorResolver.isBot(a)).collect(Collectors.toList());
		if (!humans.isEmpty()) {
			sb.append(ALL_CONTRIBUTORS_PREFIX).append(mentions(humans, ", ")).append('\n');
		}

		List<String> bots = allAuthors.stream().filter(authorResolver::isBot).collect(Collectors.toList());
		if (!bots.isEmpty()) {
			sb.append('\n').append(BOTS_PREFIX).append(mentions(bots, ", ")).append('\n');
		}

		return sb.toString().stripTrailing();
	}

	/**
	 * Returns the heading emoji of a category.
	 * @param category category name, compared case-insensitively
	 * @return the configured emoji, or the unknown-category emoji
	 */
	public String emojiFor(String category) {
		return emojiByCategory.getOrDefault(category, unknownCategoryEmoji);
	}

	private void appendSection(StringBuilder sb, String category, @Nullable List<ClassifiedCommit> commits,
			String repositoryFullName) {
		if (commits == null || commits.isEmpty()) {
			return;
		}
		sb.append("### ").append(emojiFor(category)).append(' ').append(category).append('\n');
		for (ClassifiedCommit commit : commits) {
			sb.append(" * ")
				.append(repositoryFullName)
				.append('@')
				.append(commit.commit().sha())
				.append(' ')
				.append(commit.commit().subject())
				.append(' ')
				.append(mentions(commit.authors(), " "))
				.append('\n');
		}
		sb.append('\n');
	}

	private static String mentions(Collection<String> authors, String separator) {
		return authors.stream().map(a -> "@" + a).collect(Collectors.joining(separator));
	}

}
