package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A to-do item.
 */
public record Todo(long id, @Nullable String status, @Nullable String title, String content,
		@Nullable String description, boolean completed, @Nullable LocalDate startsOn, @Nullable LocalDate dueOn,
		@Nullable List<Person> assignees, @Nullable Instant createdAt, @Nullable Instant updatedAt,
		@Nullable String appUrl, int position) {
}
