package org.springaicommunity.github.releasenotes;

import java.time.LocalDateTime;

import org.jspecify.annotations.Nullable;

/**
 * Represents a published GitHub release.
 *
 * <p>
 * Only the latest release is of interest here: its tag marks where the next release
 * window begins.
 *
 * @param id the unique GitHub release ID
 * @param tagName the Git tag name (e.g., "v1.0.0", "1.0.0-M1")
 * @param name the release title (may differ from tag name)
 * @param draft whether this is a draft release
 * @param prerelease whether this is a pre-release (e.g., milestone, RC)
 * @param publishedAt when the release was published (null for drafts)
 * @param htmlUrl the URL to the release page on GitHub
 * @see <a href=
 * "https://docs.github.com/en/rest/releases/releases#get-the-latest-release">GitHub
 * latest release API</a>
 */
public record Release(long id, String tagName, @Nullable String name, boolean draft, boolean prerelease,
		@Nullable LocalDateTime publishedAt, String htmlUrl) {
}
