package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

/**
 * The commit range covered by a release.
 *
 * @param baseRef the ref the release starts from, or {@code null} when no earlier release
 * exists and the window covers the entire history reachable from {@code headRef}
 * @param headRef the ref the release ends at
 */
public record ReleaseWindow(@Nullable String baseRef, String headRef) {

	public boolean coversEntireHistory() {
		return baseRef == null;
	}

	@Override
	public String toString() {
		return (baseRef != null ? baseRef : "(all history)") + " -> " + headRef;
	}

}
