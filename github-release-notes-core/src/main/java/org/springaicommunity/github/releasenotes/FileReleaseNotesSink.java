package org.springaicommunity.github.releasenotes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes release notes to a UTF-8 file, replacing any previous content. Missing parent
 * directories are created.
 */
public class FileReleaseNotesSink implements ReleaseNotesSink {

	private static final Logger logger = LoggerFactory.getLogger(FileReleaseNotesSink.class);

	private final Path outputFile;

	public FileReleaseNotesSink(Path outputFile) {
		this.outputFile = outputFile;
	}

	@Override
	public void write(String releaseNotes) {
		try {
			Path parent = outputFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(outputFile, releaseNotes + "\n", StandardCharsets.UTF_8);
			logger.info("Release notes written to {}", outputFile);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write release notes to " + outputFile, e);
		}
	}

	public Path getOutputFile() {
		return outputFile;
	}

}
