package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of a to-do creation.
 *
 * @param content to-do text (required)
 * @param description optional HTML description
 * @param assigneeIds people to assign
 * @param dueOn due date
 */
public record CreateTodoRequest(String content, @Nullable String description, @Nullable List<Long> assigneeIds,
		@Nullable LocalDate dueOn) {

	public static CreateTodoRequest of(String content) {
		return new CreateTodoRequest(content, null, null, null);
	}

}
