package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A Basecamp project.
 */
public record Project(long id, @Nullable String status, String name, @Nullable String description,
		@Nullable Instant createdAt, @Nullable Instant updatedAt, @Nullable String url, @Nullable String appUrl) {
}
