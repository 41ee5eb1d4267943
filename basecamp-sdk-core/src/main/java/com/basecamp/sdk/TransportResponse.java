package com.basecamp.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw response returned by a {@link BasecampTransport}. Header lookup is
 * case-insensitive.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body response body, empty when there is none
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

	public TransportResponse {
		Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
		headers = Collections.unmodifiableMap(copy);
	}

	/**
	 * Returns the first value of a header.
	 * @param name header name, any case
	 * @return the value, or empty if absent
	 */
	public Optional<String> header(String name) {
		List<String> values = headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	public String bodyAsString() {
		return new String(body, StandardCharsets.UTF_8);
	}

	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

}
