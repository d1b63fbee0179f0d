package org.springaicommunity.github.releasenotes;

import java.io.PrintStream;

/**
 * Prints release notes to a stream, standard output by default.
 */
public class ConsoleReleaseNotesSink implements ReleaseNotesSink {

	private final PrintStream out;

	public ConsoleReleaseNotesSink() {
		this(System.out);
	}

	public ConsoleReleaseNotesSink(PrintStream out) {
		this.out = out;
	}

	@Override
	public void write(String releaseNotes) {
		out.println(releaseNotes);
		out.flush();
	}

}
