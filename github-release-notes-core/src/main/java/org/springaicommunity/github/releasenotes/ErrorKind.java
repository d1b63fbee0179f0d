package org.springaicommunity.github.releasenotes;

/**
 * Classification of failures raised while talking to GitHub or generating release notes.
 */
public enum ErrorKind {

	/** The requested resource does not exist (HTTP 404). */
	NOT_FOUND,

	/** The API rate limit is exhausted (HTTP 429, or 403 with no remaining requests). */
	RATE_LIMITED,

	/** Server error (5xx), network failure or timeout. */
	TRANSIENT,

	/** Bad credentials or missing permission (401, 403). */
	PERMISSION,

	/** Any other rejected request (4xx). */
	CLIENT_ERROR,

	/** The run was interrupted. */
	CANCELLED,

	/** A failure that fits none of the other kinds. */
	UNEXPECTED;

	/**
	 * Whether a request failing with this kind may succeed when repeated.
	 * @return true for rate limit and transient failures
	 */
	public boolean isRetryable() {
		return this == RATE_LIMITED || this == TRANSIENT;
	}

}
