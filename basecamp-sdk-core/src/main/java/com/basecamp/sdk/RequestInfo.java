package com.basecamp.sdk;

import java.net.URI;

/**
 * One HTTP attempt.
 *
 * @param method HTTP method
 * @param uri resolved URL
 * @param attempt attempt number, starting at 1
 */
public record RequestInfo(HttpMethod method, URI uri, int attempt) {
}
