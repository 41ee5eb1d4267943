package com.basecamp.sdk;

import java.util.AbstractList;
import java.util.List;

/**
 * Unmodifiable list of items collected across pages, with its {@link ListMeta}.
 *
 * @param <T> item type
 */
public final class ListResult<T> extends AbstractList<T> {

	private final List<T> items;

	private final ListMeta meta;

	public ListResult(List<T> items, ListMeta meta) {
		this.items = List.copyOf(items);
		this.meta = meta;
	}

	@Override
	public T get(int index) {
		return items.get(index);
	}

	@Override
	public int size() {
		return items.size();
	}

	public ListMeta meta() {
		return meta;
	}

	public long totalCount() {
		return meta.totalCount();
	}

	public boolean isTruncated() {
		return meta.truncated();
	}

}
