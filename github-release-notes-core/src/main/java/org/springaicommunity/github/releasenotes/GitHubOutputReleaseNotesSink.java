package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Publishes release notes as a GitHub Actions step output.
 *
 * <p>
 * The document is appended to the file named by {@code GITHUB_OUTPUT} as a multiline
 * value:
 *
 * <pre>
 * changelog&lt;&lt;ghadelimiter_3f0c...
 * ## What's Changed
 * ...
 * ghadelimiter_3f0c...
 * </pre>
 *
 * The delimiter is random so the document cannot terminate the value early. Outside of
 * GitHub Actions (no {@code GITHUB_OUTPUT}) writing is skipped with a warning.
 */
public class GitHubOutputReleaseNotesSink implements ReleaseNotesSink {

	private static final Logger logger = LoggerFactory.getLogger(GitHubOutputReleaseNotesSink.class);

	static final String DELIMITER_PREFIX = "ghadelimiter_";

	private final @Nullable Path outputFile;

	private final String outputName;

	private final Supplier<String> delimiterSupplier;

	public GitHubOutputReleaseNotesSink(@Nullable Path outputFile, String outputName) {
		this(outputFile, outputName, () -> DELIMITER_PREFIX + UUID.randomUUID());
	}

	GitHubOutputReleaseNotesSink(@Nullable Path outputFile, String outputName, Supplier<String> delimiterSupplier) {
		this.outputFile = outputFile;
		this.outputName = outputName;
		this.delimiterSupplier = delimiterSupplier;
	}

	/**
	 * Create a sink for the output file of the current workflow step.
	 * @param outputName name of the step output
	 * @return a sink writing to {@code $GITHUB_OUTPUT}, or skipping when it is unset
	 */
	public static GitHubOutputReleaseNotesSink fromEnvironment(String outputName) {
		String path = EnvironmentSupport.get(EnvironmentSupport.GITHUB_OUTPUT);
		return new GitHubOutputReleaseNotesSink(path == null || path.isBlank() ? null : Path.of(path), outputName);
	}

	@Override
	public void write(String releaseNotes) {
		if (outputFile == null) {
			logger.warn("GITHUB_OUTPUT is not set, skipping step output '{}'", outputName);
			return;
		}
		String delimiter = delimiterSupplier.get();
		String block = outputName + "<<" + delimiter + "\n" + releaseNotes + "\n" + delimiter + "\n";
		try {
			Files.writeString(outputFile, block, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
			logger.info("Release notes published as step output '{}'", outputName);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to append step output to " + outputFile, e);
		}
	}

}
