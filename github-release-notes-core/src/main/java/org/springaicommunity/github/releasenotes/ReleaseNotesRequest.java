package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

/**
 * Input of a release notes run.
 *
 * @param owner the repository owner (user or organization)
 * @param repo the repository name
 * @param baseRef the ref to compare from; {@code null} or blank selects the latest
 * release tag
 * @param headRef the ref to compare to; {@code null} or blank selects the default branch
 * @param version the version being released, used in the changelog link
 */
public record ReleaseNotesRequest(String owner, String repo, @Nullable String baseRef, @Nullable String headRef,
		String version) {

	public String fullName() {
		return owner + "/" + repo;
	}

}
