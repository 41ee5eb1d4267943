package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of a to-do update. Null fields are left unchanged.
 */
public record UpdateTodoRequest(@Nullable String content, @Nullable String description,
		@Nullable List<Long> assigneeIds, @Nullable LocalDate dueOn) {
}
