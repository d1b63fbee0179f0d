package org.springaicommunity.github.releasenotes;

/**
 * Signals that a release notes run was aborted. No partial document is produced when
 * this is thrown.
 */
public class ReleaseNotesException extends RuntimeException {

	private final ErrorKind kind;

	public ReleaseNotesException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public ReleaseNotesException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

}
