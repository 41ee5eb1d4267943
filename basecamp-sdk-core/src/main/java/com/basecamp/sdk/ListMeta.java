package com.basecamp.sdk;

/**
 * Metadata for a paginated list.
 *
 * @param totalCount value of {@code X-Total-Count}, 0 when absent
 * @param truncated true if a page or item cap stopped pagination before the server ran
 * out of pages
 */
public record ListMeta(long totalCount, boolean truncated) {
}
