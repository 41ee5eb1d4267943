package com.basecamp.sdk;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry settings for one operation.
 *
 * <p>
 * A {@code maxAttempts} of zero or less is coerced to 1, so a misconfigured policy still
 * sends the request once.
 *
 * @param maxAttempts total attempts, including the first
 * @param baseDelayMs delay unit for the backoff formula
 * @param backoff how the delay grows between attempts
 * @param retryOn HTTP statuses that may be retried
 * @param maxJitterMs upper bound of the random delay added to each computed wait
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, Backoff backoff, Set<Integer> retryOn,
		long maxJitterMs) {

	/**
	 * Statuses retried when no per-operation list is given.
	 */
	public static final Set<Integer> DEFAULT_RETRY_ON = Set.of(429, 502, 503, 504);

	/**
	 * Three attempts, exponential backoff from one second, up to 100ms of jitter.
	 */
	public static final RetryPolicy DEFAULT = new RetryPolicy(3, 1000, Backoff.EXPONENTIAL, DEFAULT_RETRY_ON, 100);

	/**
	 * A single attempt.
	 */
	public static final RetryPolicy NONE = new RetryPolicy(1, 0, Backoff.CONSTANT, Set.of(), 0);

	/**
	 * The exponent is capped so large attempt numbers cannot overflow.
	 */
	private static final int MAX_EXPONENT = 20;

	public RetryPolicy {
		maxAttempts = Math.max(1, maxAttempts);
		baseDelayMs = Math.max(0, baseDelayMs);
		maxJitterMs = Math.max(0, maxJitterMs);
		retryOn = Set.copyOf(retryOn);
	}

	/**
	 * Compute the wait before the attempt that follows {@code attempt}.
	 * @param attempt the attempt that just failed, starting at 1
	 * @return delay in milliseconds, jitter included
	 */
	public long delayMillis(int attempt) {
		int n = Math.max(1, attempt);
		long delay = switch (backoff) {
			case CONSTANT -> baseDelayMs;
			case LINEAR -> baseDelayMs * n;
			case EXPONENTIAL -> baseDelayMs * (1L << Math.min(n - 1, MAX_EXPONENT));
		};
		return delay + jitter();
	}

	public boolean retriesStatus(int status) {
		return retryOn.contains(status);
	}

	public RetryPolicy withRetryOn(Set<Integer> statuses) {
		return new RetryPolicy(maxAttempts, baseDelayMs, backoff, statuses, maxJitterMs);
	}

	public RetryPolicy withMaxAttempts(int attempts) {
		return new RetryPolicy(attempts, baseDelayMs, backoff, retryOn, maxJitterMs);
	}

	private long jitter() {
		if (maxJitterMs == 0) {
			return 0;
		}
		return ThreadLocalRandom.current().nextLong(maxJitterMs + 1);
	}

	/**
	 * Delay growth between attempts.
	 */
	public enum Backoff {

		CONSTANT, LINEAR, EXPONENTIAL;

		/**
		 * Parse a behavior-model backoff name. {@code "exp+jitter"} and
		 * {@code "exponential"} both map to {@link #EXPONENTIAL}.
		 * @param value name from the behavior model
		 * @return the backoff kind
		 * @throws IllegalArgumentException for unknown names
		 */
		public static Backoff fromString(String value) {
			String normalized = value.trim().toLowerCase(Locale.ROOT);
			return switch (normalized) {
				case "exp", "exp+jitter", "exponential" -> EXPONENTIAL;
				case "linear" -> LINEAR;
				case "constant", "fixed" -> CONSTANT;
				default -> throw new IllegalArgumentException("Unknown backoff: " + value);
			};
		}

	}

}
