package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * A Basecamp user, as embedded in other resources.
 */
public record Person(long id, String name, @Nullable String emailAddress) {
}
