package com.basecamp.sdk;

/**
 * Categories of failure surfaced by the SDK.
 *
 * <p>
 * Each kind carries a stable machine-readable code and a process exit code, so that
 * command-line tools built on the SDK share the same exit semantics. Exit code 0 is
 * reserved for success.
 */
public enum ErrorKind {

	USAGE("usage", 1),

	NOT_FOUND("not_found", 2),

	AUTH("auth_required", 3),

	FORBIDDEN("forbidden", 4),

	RATE_LIMIT("rate_limit", 5),

	NETWORK("network", 6),

	API("api_error", 7),

	VALIDATION("validation", 1),

	AMBIGUOUS("ambiguous", 8);

	private final String code;

	private final int exitCode;

	ErrorKind(String code, int exitCode) {
		this.code = code;
		this.exitCode = exitCode;
	}

	/**
	 * Returns the machine-readable code, e.g. {@code "rate_limit"}.
	 * @return the error code
	 */
	public String code() {
		return code;
	}

	/**
	 * Returns the process exit code for this kind of failure.
	 * @return exit code, never 0
	 */
	public int exitCode() {
		return exitCode;
	}

}
