package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-operation behavior table: retry policy, idempotency, read-only flag and pagination
 * style.
 *
 * <p>
 * The default table is read from {@code behavior-model.json} on the classpath. Its shape
 * is:
 *
 * <pre>
 * {@code
 * {
 *   "operations": {
 *     "ListProjects": {
 *       "readonly": true,
 *       "pagination": { "style": "link" },
 *       "retry": { "max": 3, "base_delay_seconds": 1, "backoff": "exp+jitter" }
 *     }
 *   }
 * }
 * }
 * </pre>
 *
 * A retry block may also carry {@code base_delay_ms} and a {@code retry_on} status list.
 */
public final class BehaviorModel {

	private static final Logger logger = LoggerFactory.getLogger(BehaviorModel.class);

	public static final String RESOURCE = "/behavior-model.json";

	private static final BehaviorModel EMPTY = new BehaviorModel(Map.of());

	private final Map<String, OperationMetadata> operations;

	private BehaviorModel(Map<String, OperationMetadata> operations) {
		this.operations = Collections.unmodifiableMap(operations);
	}

	public static BehaviorModel empty() {
		return EMPTY;
	}

	/**
	 * Load the bundled table from the classpath. A missing resource yields an empty
	 * model.
	 * @param objectMapper mapper used to read the JSON
	 * @return the loaded model
	 */
	public static BehaviorModel loadDefault(ObjectMapper objectMapper) {
		try (InputStream in = BehaviorModel.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.warn("{} not found on classpath, using empty behavior model", RESOURCE);
				return EMPTY;
			}
			BehaviorModel model = parse(objectMapper.readTree(in));
			logger.debug("Loaded behavior model with {} operations", model.size());
			return model;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + RESOURCE, e);
		}
	}

	/**
	 * Build a model from an already parsed JSON tree.
	 * @param root document root
	 * @return the model
	 * @throws IllegalArgumentException if a retry block is malformed
	 */
	public static BehaviorModel parse(JsonNode root) {
		JsonNode ops = root.path("operations");
		Map<String, OperationMetadata> operations = new HashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = ops.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			operations.put(entry.getKey(), parseOperation(entry.getKey(), entry.getValue()));
		}
		return new BehaviorModel(operations);
	}

	private static OperationMetadata parseOperation(String name, JsonNode node) {
		boolean readonly = node.path("readonly").asBoolean(false);
		boolean idempotent = node.path("idempotent").asBoolean(false);
		String pagination = node.path("pagination").hasNonNull("style") ? node.path("pagination").get("style").asText()
				: null;
		RetryPolicy retry = node.hasNonNull("retry") ? parseRetry(name, node.get("retry")) : null;
		return new OperationMetadata(name, readonly, idempotent, pagination, retry);
	}

	private static RetryPolicy parseRetry(String name, JsonNode node) {
		int maxAttempts = node.path("max").asInt(node.path("max_attempts").asInt(1));
		long baseDelayMs;
		if (node.has("base_delay_ms")) {
			baseDelayMs = node.get("base_delay_ms").asLong();
		}
		else {
			baseDelayMs = node.path("base_delay_seconds").asLong(1) * 1000;
		}
		RetryPolicy.Backoff backoff;
		try {
			backoff = RetryPolicy.Backoff.fromString(node.path("backoff").asText("exponential"));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid retry block for " + name + ": " + e.getMessage(), e);
		}
		Set<Integer> retryOn = new LinkedHashSet<>();
		node.path("retry_on").forEach(status -> retryOn.add(status.asInt()));
		if (retryOn.isEmpty()) {
			retryOn.addAll(RetryPolicy.DEFAULT_RETRY_ON);
		}
		return new RetryPolicy(maxAttempts, baseDelayMs, backoff, retryOn, RetryPolicy.DEFAULT.maxJitterMs());
	}

	public Optional<OperationMetadata> find(String operation) {
		return Optional.ofNullable(operations.get(operation));
	}

	public int size() {
		return operations.size();
	}

}
