package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link TokenRefresher} that posts a form to the token endpoint.
 *
 * <p>
 * Launchpad accepts either the standard {@code grant_type=refresh_token} form or its
 * legacy {@code type=refresh} form. The endpoint must use HTTPS unless it points at
 * localhost.
 */
public class LaunchpadTokenRefresher implements TokenRefresher {

	private static final Logger logger = LoggerFactory.getLogger(LaunchpadTokenRefresher.class);

	private final BasecampTransport transport;

	private final ObjectMapper objectMapper;

	private final String clientId;

	@Nullable
	private final String clientSecret;

	private final boolean legacyFormat;

	private final Clock clock;

	public LaunchpadTokenRefresher(BasecampTransport transport, ObjectMapper objectMapper, String clientId,
			@Nullable String clientSecret) {
		this(transport, objectMapper, clientId, clientSecret, false, Clock.systemUTC());
	}

	public LaunchpadTokenRefresher(BasecampTransport transport, ObjectMapper objectMapper, String clientId,
			@Nullable String clientSecret, boolean legacyFormat, Clock clock) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.clientId = clientId;
		this.clientSecret = clientSecret;
		this.legacyFormat = legacyFormat;
		this.clock = clock;
	}

	@Override
	public OAuthCredentials refresh(OAuthCredentials credentials) {
		if (!credentials.canRefresh()) {
			throw BasecampException.auth("No refresh token available", "Log in again");
		}
		URI endpoint = URI.create(credentials.tokenEndpoint());
		BasecampConfig.requireSecure(endpoint, "token endpoint");

		Map<String, String> form = new LinkedHashMap<>();
		if (legacyFormat) {
			form.put("type", "refresh");
		}
		else {
			form.put("grant_type", "refresh_token");
		}
		form.put("refresh_token", credentials.refreshToken());
		form.put("client_id", clientId);
		if (clientSecret != null) {
			form.put("client_secret", clientSecret);
		}

		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Type", "application/x-www-form-urlencoded");
		headers.put("Accept", "application/json");
		TransportRequest request = new TransportRequest(HttpMethod.POST, endpoint, headers,
				encodeForm(form).getBytes(StandardCharsets.UTF_8));

		TransportResponse response;
		try {
			response = transport.execute(request);
		}
		catch (IOException e) {
			throw BasecampException.network("Token refresh failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw BasecampException.interrupted(e);
		}

		if (!response.isSuccess()) {
			logger.warn("Token refresh rejected with HTTP {}", response.statusCode());
			throw new BasecampException(ErrorKind.AUTH, "Token refresh failed (HTTP " + response.statusCode() + ")",
					"Log in again", response.statusCode(), false, null, response.header("X-Request-Id").orElse(null),
					null);
		}
		return parse(response, credentials.tokenEndpoint());
	}

	private OAuthCredentials parse(TransportResponse response, String tokenEndpoint) {
		JsonNode json;
		try {
			json = objectMapper.readTree(response.body());
		}
		catch (IOException e) {
			throw BasecampException.api("Failed to parse token response", e);
		}
		String accessToken = json.path("access_token").asText("");
		if (accessToken.isEmpty()) {
			throw BasecampException.api("Token response is missing access_token", response.statusCode());
		}
		String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
		Instant expiresAt = json.hasNonNull("expires_in")
				? clock.instant().plusSeconds(json.get("expires_in").asLong()) : null;
		String scope = json.hasNonNull("scope") ? json.get("scope").asText() : null;
		return new OAuthCredentials(accessToken, refreshToken, expiresAt, tokenEndpoint, scope);
	}

	private static String encodeForm(Map<String, String> form) {
		return form.entrySet()
			.stream()
			.map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
					+ URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
			.collect(Collectors.joining("&"));
	}

}
