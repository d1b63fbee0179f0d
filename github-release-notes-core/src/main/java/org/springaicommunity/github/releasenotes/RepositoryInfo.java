package org.springaicommunity.github.releasenotes;

/**
 * Basic repository information from the GitHub API.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param htmlUrl the web URL for the repository, used to build changelog links
 * @param defaultBranch the default branch name, used when no head ref is given
 */
public record RepositoryInfo(long id, String name, String fullName, String htmlUrl, String defaultBranch) {

}
