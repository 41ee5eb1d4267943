package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * Body of a project update. Null fields are left unchanged.
 */
public record UpdateProjectRequest(@Nullable String name, @Nullable String description) {
}
