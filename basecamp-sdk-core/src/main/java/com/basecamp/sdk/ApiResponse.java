package com.basecamp.sdk;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Successful outcome of the request pipeline.
 *
 * <p>
 * A 304 revalidation is reported as status 200 with the cached body and
 * {@code fromCache = true}, so callers cannot tell it apart from a fresh response.
 *
 * @param uri the resolved request URI
 * @param statusCode 2xx status (200 for cache hits)
 * @param headers response headers, case-insensitive
 * @param body response body, empty for 204
 * @param fromCache whether the body came from the ETag cache
 */
public record ApiResponse(URI uri, int statusCode, Map<String, List<String>> headers, byte[] body,
		boolean fromCache) {

	public Optional<String> header(String name) {
		List<String> values = headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	/**
	 * Returns every value of a header, in the order received. Repeated header lines
	 * such as several {@code Link} lines yield one element each.
	 * @param name header name, any case
	 * @return the values, empty if absent
	 */
	public List<String> headerValues(String name) {
		List<String> values = headers.get(name);
		return values != null ? values : List.of();
	}

	public String bodyAsString() {
		return new String(body, StandardCharsets.UTF_8);
	}

	public boolean hasBody() {
		return body.length > 0;
	}

}
