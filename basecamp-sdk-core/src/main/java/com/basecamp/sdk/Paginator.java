package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Follows {@code Link: <url>; rel="next"} headers to collect list endpoints.
 *
 * <p>
 * Every page goes through the full pipeline (auth, cache, retry), and page N+1 is
 * requested only after page N completed. List bodies are bare JSON arrays. Before a
 * next-link is followed it must share its origin with the first request; otherwise
 * pagination aborts with an {@link ErrorKind#API} error and no request is sent to the
 * foreign host. Reaching the page cap stops pagination and marks the result truncated
 * instead of failing.
 */
public class Paginator {

	private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

	private final BasecampClient client;

	private final ObjectMapper objectMapper;

	private final int maxPages;

	public Paginator(BasecampClient client, ObjectMapper objectMapper, int maxPages) {
		if (maxPages < 1) {
			throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.maxPages = maxPages;
	}

	/**
	 * Fetch all pages (up to the caps) and decode their items.
	 * @param spec request for the first page
	 * @param itemType type of each array element
	 * @param options caller limits
	 * @param <T> item type
	 * @return collected items with total count and truncation flag
	 * @throws BasecampException on request failure, undecodable pages or a cross-origin
	 * next-link
	 */
	public <T> ListResult<T> paginate(RequestSpec spec, Class<T> itemType, PaginationOptions options) {
		JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, itemType);
		int pageCap = options.maxPages() > 0 ? options.maxPages() : maxPages;

		ApiResponse page = client.execute(spec);
		URI origin = page.uri();
		List<T> items = new ArrayList<>(decodePage(page, listType));
		long totalCount = totalCount(page);
		int pages = 1;
		Optional<String> next = nextLink(page);
		boolean truncated = false;

		while (next.isPresent()) {
			if (options.hasItemLimit() && items.size() >= options.maxItems()) {
				truncated = true;
				break;
			}
			if (pages >= pageCap) {
				logger.warn("Pagination capped at {} pages for {}", pageCap, origin);
				truncated = true;
				break;
			}
			URI nextUri = checkedNextUri(origin, page.uri(), next.get());
			page = client.execute(spec.forUrl(nextUri.toString()));
			pages++;
			items.addAll(decodePage(page, listType));
			if (totalCount == 0) {
				totalCount = totalCount(page);
			}
			next = nextLink(page);
		}

		if (options.hasItemLimit() && items.size() > options.maxItems()) {
			items = new ArrayList<>(items.subList(0, options.maxItems()));
			truncated = true;
		}
		logger.debug("Collected {} items from {} pages (total {}, truncated {})", items.size(), pages, totalCount,
				truncated);
		return new ListResult<>(items, new ListMeta(totalCount, truncated));
	}

	/**
	 * Lazily stream items, fetching the next page only when the previous one is consumed.
	 * Applies the same origin check and page cap as {@link #paginate}; hitting the cap
	 * simply ends the stream.
	 * @param spec request for the first page
	 * @param itemType type of each array element
	 * @param <T> item type
	 * @return sequential stream of items
	 */
	public <T> Stream<T> stream(RequestSpec spec, Class<T> itemType) {
		JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, itemType);
		Iterator<T> iterator = new PageIterator<>(spec, listType);
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
	}

	private URI checkedNextUri(URI origin, URI current, String link) {
		URI next;
		try {
			next = LinkHeaders.resolve(current, link);
		}
		catch (IllegalArgumentException e) {
			throw BasecampException.api("Pagination Link header is malformed: " + link, e);
		}
		if (!LinkHeaders.isSameOrigin(origin, next)) {
			throw BasecampException.api("Pagination Link header points to different origin: " + next, (Integer) null);
		}
		return next;
	}

	private <T> List<T> decodePage(ApiResponse page, JavaType listType) {
		if (!page.hasBody()) {
			return List.of();
		}
		try {
			JsonNode node = objectMapper.readTree(page.body());
			if (node == null || node.isNull()) {
				return List.of();
			}
			if (!node.isArray()) {
				throw BasecampException.api("Expected a JSON array from " + page.uri(), page.statusCode());
			}
			return objectMapper.readerFor(listType).readValue(node);
		}
		catch (IOException e) {
			throw BasecampException.api("Failed to parse response from " + page.uri() + ": " + e.getMessage(), e);
		}
	}

	private static long totalCount(ApiResponse page) {
		return LinkHeaders.parseTotalCount(page.header("X-Total-Count").orElse(null));
	}

	private static Optional<String> nextLink(ApiResponse page) {
		// Several Link lines are equivalent to one comma-joined header
		return LinkHeaders.parseNextLink(String.join(",", page.headerValues("Link")));
	}

	private final class PageIterator<T> implements Iterator<T> {

		private final RequestSpec spec;

		private final JavaType listType;

		private final Deque<T> buffer = new ArrayDeque<>();

		@Nullable
		private URI origin;

		@Nullable
		private URI current;

		@Nullable
		private String next;

		private int pages;

		private boolean started;

		PageIterator(RequestSpec spec, JavaType listType) {
			this.spec = spec;
			this.listType = listType;
		}

		@Override
		public boolean hasNext() {
			while (buffer.isEmpty()) {
				if (!fetch()) {
					return false;
				}
			}
			return true;
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return buffer.removeFirst();
		}

		private boolean fetch() {
			ApiResponse page;
			if (!started) {
				started = true;
				page = client.execute(spec);
				origin = page.uri();
			}
			else {
				if (next == null || origin == null || current == null) {
					return false;
				}
				if (pages >= maxPages) {
					logger.warn("Pagination capped at {} pages for {}", maxPages, origin);
					return false;
				}
				page = client.execute(spec.forUrl(checkedNextUri(origin, current, next).toString()));
			}
			pages++;
			current = page.uri();
			next = nextLink(page).orElse(null);
			List<T> items = decodePage(page, listType);
			buffer.addAll(items);
			return true;
		}

	}

}
