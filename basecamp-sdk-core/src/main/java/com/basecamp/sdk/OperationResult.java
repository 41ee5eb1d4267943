package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Outcome of a service operation.
 *
 * @param duration wall time of the whole operation
 * @param error the failure, or null on success
 */
public record OperationResult(Duration duration, @Nullable BasecampException error) {

	public static OperationResult success(Duration duration) {
		return new OperationResult(duration, null);
	}

	public static OperationResult failure(Duration duration, BasecampException error) {
		return new OperationResult(duration, error);
	}

	public boolean isSuccess() {
		return error == null;
	}

}
