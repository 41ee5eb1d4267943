package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Outcome of one HTTP attempt.
 *
 * @param statusCode HTTP status, 0 when no response was received
 * @param duration time spent on the exchange
 * @param fromCache true when a 304 was answered from the ETag cache
 * @param error the classified failure, or null on success
 */
public record RequestResult(int statusCode, Duration duration, boolean fromCache,
		@Nullable BasecampException error) {

	public boolean isSuccess() {
		return error == null;
	}

}
