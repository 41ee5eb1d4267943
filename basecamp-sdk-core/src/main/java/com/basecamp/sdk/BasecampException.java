package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The single exception type raised by the SDK.
 *
 * <p>
 * Transport failures and non-success HTTP statuses are converted to this type at the
 * pipeline boundary, so callers never see raw {@code IOException}s or bare status codes.
 * The {@link ErrorKind} decides the exit code; {@link #isRetryable()} tells the retry
 * loop whether another attempt may succeed.
 */
public class BasecampException extends RuntimeException {

	/**
	 * Maximum length of a message taken from a response body.
	 */
	static final int MAX_MESSAGE_LENGTH = 500;

	private final ErrorKind kind;

	@Nullable
	private final String hint;

	@Nullable
	private final Integer httpStatus;

	private final boolean retryable;

	@Nullable
	private final Long retryAfterSeconds;

	@Nullable
	private final String requestId;

	public BasecampException(ErrorKind kind, String message) {
		this(kind, message, null, null, false, null, null, null);
	}

	public BasecampException(ErrorKind kind, String message, @Nullable String hint) {
		this(kind, message, hint, null, false, null, null, null);
	}

	public BasecampException(ErrorKind kind, String message, @Nullable String hint, @Nullable Integer httpStatus,
			boolean retryable, @Nullable Long retryAfterSeconds, @Nullable String requestId,
			@Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.hint = hint;
		this.httpStatus = httpStatus;
		this.retryable = retryable;
		this.retryAfterSeconds = retryAfterSeconds;
		this.requestId = requestId;
	}

	public ErrorKind getKind() {
		return kind;
	}

	@Nullable
	public String getHint() {
		return hint;
	}

	@Nullable
	public Integer getHttpStatus() {
		return httpStatus;
	}

	public boolean isRetryable() {
		return retryable;
	}

	/**
	 * Server-provided delay before the next attempt, from the {@code Retry-After} header.
	 * @return delay in seconds, or null when the server did not send one
	 */
	@Nullable
	public Long getRetryAfterSeconds() {
		return retryAfterSeconds;
	}

	@Nullable
	public String getRequestId() {
		return requestId;
	}

	/**
	 * Returns the process exit code for this error.
	 * @return exit code derived from the error kind
	 */
	public int exitCode() {
		return kind.exitCode();
	}

	/**
	 * Returns the text a command-line consumer should print: {@code message: hint} when a
	 * hint is present, otherwise just the message.
	 * @return user-facing message
	 */
	public String getDisplayMessage() {
		if (hint != null && !hint.isEmpty()) {
			return getMessage() + ": " + hint;
		}
		return getMessage();
	}

	// Factories

	public static BasecampException usage(String message) {
		return new BasecampException(ErrorKind.USAGE, message);
	}

	public static BasecampException usage(String message, @Nullable String hint) {
		return new BasecampException(ErrorKind.USAGE, message, hint);
	}

	public static BasecampException auth(String message, @Nullable String hint) {
		return new BasecampException(ErrorKind.AUTH, message, hint, 401, false, null, null, null);
	}

	public static BasecampException notFound(String resource, String identifier) {
		return new BasecampException(ErrorKind.NOT_FOUND, resource + " not found: " + identifier, null, 404, false,
				null, null, null);
	}

	/**
	 * Transport-level failure with no HTTP response. Always retryable.
	 */
	public static BasecampException network(String message, @Nullable Throwable cause) {
		return new BasecampException(ErrorKind.NETWORK, message, "Check your network connection", null, true, null,
				null, cause);
	}

	/**
	 * The calling thread was interrupted during an attempt or a retry delay. Never
	 * retried.
	 */
	public static BasecampException interrupted(InterruptedException cause) {
		return new BasecampException(ErrorKind.NETWORK, "Request interrupted", null, null, false, null, null, cause);
	}

	public static BasecampException api(String message, @Nullable Integer httpStatus) {
		return new BasecampException(ErrorKind.API, message, null, httpStatus, false, null, null, null);
	}

	public static BasecampException api(String message, @Nullable Throwable cause) {
		return new BasecampException(ErrorKind.API, message, null, null, false, null, null, cause);
	}

	/**
	 * A name matched more than one resource.
	 * @param resource resource type, e.g. "project"
	 * @param matches the candidate names
	 */
	public static BasecampException ambiguous(String resource, List<String> matches) {
		String hint = "Be more specific";
		if (!matches.isEmpty() && matches.size() <= 5) {
			hint = "Did you mean: " + String.join(", ", matches);
		}
		return new BasecampException(ErrorKind.AMBIGUOUS, "Ambiguous " + resource, hint);
	}

	/**
	 * Classify a non-success HTTP status.
	 * @param status HTTP status code
	 * @param message message extracted from the response body, or null
	 * @param hint remediation text extracted from the response body, or null
	 * @param retryAfterSeconds parsed {@code Retry-After}, or null
	 * @param requestId value of {@code X-Request-Id}, or null
	 * @param mutation whether the request was a non-GET
	 * @return classified exception
	 */
	public static BasecampException fromHttpStatus(int status, @Nullable String message, @Nullable String hint,
			@Nullable Long retryAfterSeconds, @Nullable String requestId, boolean mutation) {
		String body = message != null && !message.isBlank() ? truncateMessage(message) : null;
		switch (status) {
			case 400, 422:
				return new BasecampException(ErrorKind.VALIDATION, body != null ? body : "Validation failed", hint,
						status, false, null, requestId, null);
			case 401:
				return new BasecampException(ErrorKind.AUTH, body != null ? body : "Authentication required",
						hint != null ? hint : "Check your access token or log in again", status, false, null,
						requestId, null);
			case 403:
				if (mutation) {
					return new BasecampException(ErrorKind.FORBIDDEN,
							body != null ? body : "Access denied: insufficient scope",
							hint != null ? hint : "Re-authenticate with write access", status, false, null, requestId,
							null);
				}
				return new BasecampException(ErrorKind.FORBIDDEN, body != null ? body : "Access denied", hint, status,
						false, null, requestId, null);
			case 404:
				return new BasecampException(ErrorKind.NOT_FOUND, body != null ? body : "Resource not found", hint,
						status, false, null, requestId, null);
			case 429:
				return new BasecampException(ErrorKind.RATE_LIMIT, body != null ? body : "Rate limit exceeded",
						hint != null ? hint : "Slow down and try again later", status, true, retryAfterSeconds,
						requestId, null);
			default:
				boolean serverError = status >= 500 && status < 600;
				return new BasecampException(ErrorKind.API, body != null ? body : "Request failed (HTTP " + status + ")",
						hint, status, serverError, serverError ? retryAfterSeconds : null, requestId, null);
		}
	}

	/**
	 * Bound a message to {@value #MAX_MESSAGE_LENGTH} bytes of UTF-8, ending in "..." when
	 * cut. The cut never splits a code point.
	 * @param message message to truncate
	 * @return the message, or its truncated form
	 */
	public static String truncateMessage(String message) {
		if (message.getBytes(StandardCharsets.UTF_8).length <= MAX_MESSAGE_LENGTH) {
			return message;
		}
		int budget = MAX_MESSAGE_LENGTH - 3;
		int bytes = 0;
		int end = 0;
		while (end < message.length()) {
			int codePoint = message.codePointAt(end);
			int width = utf8Width(codePoint);
			if (bytes + width > budget) {
				break;
			}
			bytes += width;
			end += Character.charCount(codePoint);
		}
		return message.substring(0, end) + "...";
	}

	private static int utf8Width(int codePoint) {
		if (codePoint < 0x80) {
			return 1;
		}
		if (codePoint < 0x800) {
			return 2;
		}
		return codePoint < 0x10000 ? 3 : 4;
	}

}
