package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * Behavior-model entry for one API operation.
 *
 * @param name operation name, e.g. {@code ListProjects}
 * @param readonly whether the operation has no side effects
 * @param idempotent whether repeating the operation is safe
 * @param paginationStyle pagination style (only {@code "link"} is known), or null
 * @param retry explicit retry policy, or null to use the method default
 */
public record OperationMetadata(String name, boolean readonly, boolean idempotent, @Nullable String paginationStyle,
		@Nullable RetryPolicy retry) {

	public boolean isPaginated() {
		return paginationStyle != null;
	}

}
