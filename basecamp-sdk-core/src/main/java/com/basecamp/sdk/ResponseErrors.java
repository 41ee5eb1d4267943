package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Clock;

/**
 * Converts a non-success {@link TransportResponse} into a {@link BasecampException}.
 *
 * <p>
 * The message is taken from the body's {@code error} or {@code message} field and the
 * hint from {@code error_description}. Non-JSON bodies are used as the message when
 * short and printable.
 */
final class ResponseErrors {

	private static final int MAX_PLAIN_BODY = 200;

	private ResponseErrors() {
	}

	static BasecampException classify(TransportResponse response, HttpMethod method, ObjectMapper objectMapper,
			Clock clock) {
		String message = null;
		String hint = null;
		if (response.body().length > 0) {
			JsonNode json = readJson(response.body(), objectMapper);
			if (json != null && json.isObject()) {
				message = text(json, "error");
				if (message == null) {
					message = text(json, "message");
				}
				hint = text(json, "error_description");
			}
			else if (json == null) {
				String plain = response.bodyAsString().trim();
				if (!plain.isEmpty() && plain.length() <= MAX_PLAIN_BODY && !plain.startsWith("<")) {
					message = plain;
				}
			}
		}
		Long retryAfter = LinkHeaders.parseRetryAfter(response.header("Retry-After").orElse(null), clock);
		String requestId = response.header("X-Request-Id").orElse(null);
		return BasecampException.fromHttpStatus(response.statusCode(), message,
				hint != null ? BasecampException.truncateMessage(hint) : null, retryAfter, requestId,
				method.isMutation());
	}

	@Nullable
	private static JsonNode readJson(byte[] body, ObjectMapper objectMapper) {
		try {
			return objectMapper.readTree(body);
		}
		catch (IOException e) {
			return null;
		}
	}

	@Nullable
	private static String text(JsonNode json, String field) {
		JsonNode node = json.get(field);
		if (node == null || node.isNull()) {
			return null;
		}
		String value = node.isTextual() ? node.asText() : node.toString();
		return value.isBlank() ? null : value;
	}

}
