package com.basecamp.sdk;

/**
 * Caller limits for a paginated request. Zero means "no limit" for {@code maxItems} and
 * "client default" for {@code maxPages}.
 *
 * @param maxItems stop once this many items are collected
 * @param maxPages stop after this many pages, overriding the configured cap
 */
public record PaginationOptions(int maxItems, int maxPages) {

	private static final PaginationOptions DEFAULTS = new PaginationOptions(0, 0);

	public PaginationOptions {
		if (maxItems < 0) {
			throw new IllegalArgumentException("maxItems must not be negative: " + maxItems);
		}
		if (maxPages < 0) {
			throw new IllegalArgumentException("maxPages must not be negative: " + maxPages);
		}
	}

	public static PaginationOptions defaults() {
		return DEFAULTS;
	}

	public static PaginationOptions maxItems(int maxItems) {
		return new PaginationOptions(maxItems, 0);
	}

	public PaginationOptions withMaxPages(int pages) {
		return new PaginationOptions(maxItems, pages);
	}

	public boolean hasItemLimit() {
		return maxItems > 0;
	}

}
