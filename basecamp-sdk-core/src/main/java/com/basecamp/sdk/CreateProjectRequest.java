package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * Body of a project creation.
 *
 * @param name project name (required)
 * @param description optional description
 */
public record CreateProjectRequest(String name, @Nullable String description) {
}
