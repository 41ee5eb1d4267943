package com.basecamp.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Performs exactly one HTTP exchange for a {@link RequestSpec} and classifies the
 * outcome.
 *
 * <p>
 * Per attempt it resolves the URL, asks the {@link AuthStrategy} for fresh credentials,
 * adds {@code If-None-Match} for cached GETs, dispatches through the
 * {@link BasecampTransport} and reports the exchange to {@link BasecampHooks}. A 304 is
 * answered from the {@link ETagCache} and returned as a 200 with
 * {@code fromCache = true}. Failures are thrown as {@link BasecampException}; retrying is
 * left to {@link RetryingBasecampClient}.
 */
public class HttpBasecampClient implements BasecampClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpBasecampClient.class);

	private final BasecampTransport transport;

	private final AuthStrategy authStrategy;

	private final URI baseUrl;

	private final String userAgent;

	@Nullable
	private final ETagCache cache;

	private final BasecampHooks hooks;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	public HttpBasecampClient(BasecampTransport transport, AuthStrategy authStrategy, BasecampConfig config,
			@Nullable ETagCache cache, BasecampHooks hooks, ObjectMapper objectMapper) {
		this(transport, authStrategy, config, cache, hooks, objectMapper, Clock.systemUTC());
	}

	public HttpBasecampClient(BasecampTransport transport, AuthStrategy authStrategy, BasecampConfig config,
			@Nullable ETagCache cache, BasecampHooks hooks, ObjectMapper objectMapper, Clock clock) {
		this.transport = transport;
		this.authStrategy = authStrategy;
		this.baseUrl = URI.create(config.getBaseUrl());
		this.userAgent = config.getUserAgent();
		this.cache = cache;
		this.hooks = hooks;
		this.objectMapper = objectMapper;
		this.clock = clock;
		BasecampConfig.requireSecure(baseUrl, "base URL");
	}

	@Override
	public ApiResponse execute(RequestSpec spec, int attempt) {
		URI uri = resolve(spec);
		byte[] body = encodeBody(spec);

		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("User-Agent", userAgent);
		headers.put("Accept", "application/json");
		if (spec.hasBody()) {
			headers.put("Content-Type", spec.effectiveContentType());
		}
		authStrategy.authenticate(headers);

		boolean cacheable = cache != null && spec.method() == HttpMethod.GET;
		String cacheKey = uri.toString();
		Optional<CachedResponse> cached = cacheable ? cache.load(cacheKey) : Optional.empty();
		cached.ifPresent(entry -> headers.put("If-None-Match", entry.etag()));

		RequestInfo info = new RequestInfo(spec.method(), uri, attempt);
		hooks.onRequestStart(info);
		long start = System.nanoTime();

		TransportResponse response;
		try {
			response = transport.execute(new TransportRequest(spec.method(), uri, headers, body));
		}
		catch (IOException e) {
			BasecampException error = BasecampException.network("Network error: " + describe(e), e);
			hooks.onRequestEnd(info, new RequestResult(0, elapsed(start), false, error));
			throw error;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			BasecampException error = BasecampException.interrupted(e);
			hooks.onRequestEnd(info, new RequestResult(0, elapsed(start), false, error));
			throw error;
		}

		int status = response.statusCode();
		if (status == 304) {
			if (cached.isEmpty()) {
				BasecampException error = BasecampException.api("304 received but no cached response available",
						status);
				hooks.onRequestEnd(info, new RequestResult(status, elapsed(start), false, error));
				throw error;
			}
			logger.debug("{} {} not modified, serving cached body", spec.method(), uri);
			hooks.onRequestEnd(info, new RequestResult(200, elapsed(start), true, null));
			return new ApiResponse(uri, 200, response.headers(), cached.get().body(), true);
		}

		if (response.isSuccess()) {
			byte[] responseBody = status == 204 ? new byte[0] : response.body();
			if (cacheable) {
				response.header("ETag").ifPresent(etag -> cache.store(cacheKey, etag, responseBody));
			}
			hooks.onRequestEnd(info, new RequestResult(status, elapsed(start), false, null));
			return new ApiResponse(uri, status, response.headers(), responseBody, false);
		}

		BasecampException error = ResponseErrors.classify(response, spec.method(), objectMapper, clock);
		logger.debug("{} {} failed with HTTP {}: {}", spec.method(), uri, status, error.getMessage());
		hooks.onRequestEnd(info, new RequestResult(status, elapsed(start), false, error));
		throw error;
	}

	@Override
	public URI resolve(RequestSpec spec) {
		String path = spec.path();
		URI uri;
		try {
			if (path.startsWith("https://") || path.startsWith("http://")) {
				uri = URI.create(path);
				BasecampConfig.requireSecure(uri, "request URL");
			}
			else {
				String base = baseUrl.toString();
				uri = URI.create(base + (path.startsWith("/") ? path : "/" + path));
			}
		}
		catch (IllegalArgumentException e) {
			throw BasecampException.usage("Invalid request path: " + path);
		}
		if (spec.query().isEmpty()) {
			return uri;
		}
		StringBuilder url = new StringBuilder(uri.toString());
		char separator = uri.getRawQuery() == null ? '?' : '&';
		for (Map.Entry<String, String> param : spec.query().entrySet()) {
			url.append(separator).append(encode(param.getKey())).append('=').append(encode(param.getValue()));
			separator = '&';
		}
		return URI.create(url.toString());
	}

	private byte[] encodeBody(RequestSpec spec) {
		Object body = spec.body();
		if (body == null) {
			return new byte[0];
		}
		if (body instanceof byte[] bytes) {
			return bytes;
		}
		if (body instanceof String text) {
			return text.getBytes(StandardCharsets.UTF_8);
		}
		try {
			return objectMapper.writeValueAsBytes(body);
		}
		catch (JsonProcessingException e) {
			throw new BasecampException(ErrorKind.USAGE, "Failed to serialize request body: " + e.getOriginalMessage(),
					null, null, false, null, null, e);
		}
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static Duration elapsed(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	private static String describe(IOException e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

}
