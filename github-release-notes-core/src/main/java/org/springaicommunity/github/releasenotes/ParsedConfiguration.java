package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public static final String DEFAULT_OUTPUT_NAME = "changelog";

	// Credentials
	public @Nullable String token;

	// Repository settings
	public @Nullable String owner;

	public @Nullable String repo;

	// Release window
	public @Nullable String baseRef; // null = latest release

	public @Nullable String headRef; // null = default branch

	public @Nullable String releaseVersion;

	// Output options
	public @Nullable String outputFile = null; // null = stdout only

	public boolean githubOutput = false; // append to the file named by GITHUB_OUTPUT

	public String outputName = DEFAULT_OUTPUT_NAME;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	/**
	 * Convert to the request handed to {@link ReleaseNotesService}.
	 * @return the request
	 * @throws IllegalStateException if owner, repository or version are missing
	 */
	public ReleaseNotesRequest toRequest() {
		if (owner == null || repo == null || releaseVersion == null) {
			throw new IllegalStateException("Configuration has not been validated: " + this);
		}
		return new ReleaseNotesRequest(owner, repo, baseRef, headRef, releaseVersion);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "token=" + (token != null ? "****" : "null") + ", owner='" + owner + '\''
				+ ", repo='" + repo + '\'' + ", baseRef='" + baseRef + '\'' + ", headRef='" + headRef + '\''
				+ ", releaseVersion='" + releaseVersion + '\'' + ", outputFile='" + outputFile + '\''
				+ ", githubOutput=" + githubOutput + ", outputName='" + outputName + '\'' + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
