package org.springaicommunity.github.releasenotes;

/**
 * Destination of a generated release-note document.
 */
public interface ReleaseNotesSink {

	/**
	 * Write the release notes.
	 * @param releaseNotes the Markdown document
	 * @throws java.io.UncheckedIOException if the destination cannot be written
	 */
	void write(String releaseNotes);

}
