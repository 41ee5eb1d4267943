package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of one logical API call.
 *
 * <p>
 * Retries and pagination reuse the same instance; only the auth header and attempt
 * number change between dispatches.
 *
 * @param method HTTP method
 * @param path path relative to the base URL (e.g. {@code /123/projects.json}) or an
 * absolute URL
 * @param query query parameters, appended in insertion order
 * @param body request body: {@code byte[]} and {@code String} are sent as-is, anything
 * else is serialized as JSON
 * @param contentType content type of the body, or null for JSON
 * @param operationName behavior-model key such as {@code ListProjects}, or null
 */
public record RequestSpec(HttpMethod method, String path, Map<String, String> query, @Nullable Object body,
		@Nullable String contentType, @Nullable String operationName) {

	public static final String JSON = "application/json";

	public RequestSpec {
		query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
	}

	public static RequestSpec get(String path) {
		return new RequestSpec(HttpMethod.GET, path, Map.of(), null, null, null);
	}

	public static RequestSpec post(String path, @Nullable Object body) {
		return new RequestSpec(HttpMethod.POST, path, Map.of(), body, null, null);
	}

	public static RequestSpec put(String path, @Nullable Object body) {
		return new RequestSpec(HttpMethod.PUT, path, Map.of(), body, null, null);
	}

	public static RequestSpec delete(String path) {
		return new RequestSpec(HttpMethod.DELETE, path, Map.of(), null, null, null);
	}

	/**
	 * Binary upload. The content type is sent verbatim.
	 */
	public static RequestSpec upload(String path, byte[] data, String contentType) {
		return new RequestSpec(HttpMethod.POST, path, Map.of(), data, contentType, null);
	}

	/**
	 * Returns a copy with one more query parameter. Null values are skipped.
	 */
	public RequestSpec withQuery(String name, @Nullable Object value) {
		if (value == null) {
			return this;
		}
		Map<String, String> params = new LinkedHashMap<>(query);
		params.put(name, String.valueOf(value));
		return new RequestSpec(method, path, params, body, contentType, operationName);
	}

	public RequestSpec withOperation(String operationName) {
		return new RequestSpec(method, path, query, body, contentType, operationName);
	}

	/**
	 * Returns a GET for an absolute URL (typically a pagination next-link) that keeps this
	 * request's operation name. The URL already carries its own query string.
	 */
	public RequestSpec forUrl(String url) {
		return new RequestSpec(HttpMethod.GET, url, Map.of(), null, null, operationName);
	}

	/**
	 * Content type to send with the body.
	 */
	public String effectiveContentType() {
		return contentType != null ? contentType : JSON;
	}

	public boolean hasBody() {
		return body != null;
	}

}
