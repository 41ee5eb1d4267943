package com.basecamp.sdk;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded URL &rarr; (ETag, body) cache for conditional GETs. Safe for concurrent use.
 *
 * <p>
 * Eviction is FIFO by insertion or last update. Storing an existing key moves it to the
 * newest position and never evicts another entry; only a new key inserted at capacity
 * evicts the single oldest entry.
 */
public class ETagCache {

	public static final int DEFAULT_MAX_ENTRIES = 1000;

	private final int maxEntries;

	private final ReentrantLock lock = new ReentrantLock();

	private final LinkedHashMap<String, CachedResponse> entries = new LinkedHashMap<>();

	public ETagCache() {
		this(DEFAULT_MAX_ENTRIES);
	}

	public ETagCache(int maxEntries) {
		if (maxEntries < 1) {
			throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
		}
		this.maxEntries = maxEntries;
	}

	/**
	 * Insert or update an entry.
	 * @param url resolved request URL
	 * @param etag ETag header value
	 * @param body response body
	 */
	public void store(String url, String etag, byte[] body) {
		CachedResponse entry = new CachedResponse(etag, body);
		lock.lock();
		try {
			if (entries.remove(url) == null && entries.size() >= maxEntries) {
				Iterator<Map.Entry<String, CachedResponse>> oldest = entries.entrySet().iterator();
				oldest.next();
				oldest.remove();
			}
			entries.put(url, entry);
		}
		finally {
			lock.unlock();
		}
	}

	public Optional<CachedResponse> load(String url) {
		lock.lock();
		try {
			return Optional.ofNullable(entries.get(url));
		}
		finally {
			lock.unlock();
		}
	}

	public void invalidate(String url) {
		lock.lock();
		try {
			entries.remove(url);
		}
		finally {
			lock.unlock();
		}
	}

	public void removeAll() {
		lock.lock();
		try {
			entries.clear();
		}
		finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return entries.size();
		}
		finally {
			lock.unlock();
		}
	}

	public int maxEntries() {
		return maxEntries;
	}

}
