package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth tokens for one Basecamp origin.
 *
 * @param accessToken current access token
 * @param refreshToken refresh token, or null if the grant cannot be refreshed
 * @param expiresAt access token expiry, or null if unknown
 * @param tokenEndpoint URL used to refresh the token
 * @param scope granted scope, or null
 */
public record OAuthCredentials(String accessToken, @Nullable String refreshToken, @Nullable Instant expiresAt,
		String tokenEndpoint, @Nullable String scope) {

	/**
	 * Launchpad token endpoint.
	 */
	public static final String LAUNCHPAD_TOKEN_ENDPOINT = "https://launchpad.37signals.com/authorization/token";

	/**
	 * Tokens expiring within this window are refreshed before use.
	 */
	public static final Duration EXPIRY_BUFFER = Duration.ofMinutes(5);

	/**
	 * Returns true if the token expires within {@code buffer} of now. Credentials
	 * without an expiry never expire.
	 */
	public boolean isExpired(Clock clock, Duration buffer) {
		if (expiresAt == null) {
			return false;
		}
		return !clock.instant().plus(buffer).isBefore(expiresAt);
	}

	public boolean canRefresh() {
		return refreshToken != null && !refreshToken.isBlank();
	}

	/**
	 * Merge a refresh response into these credentials. The server may omit the refresh
	 * token, in which case the current one is kept; likewise for scope and endpoint.
	 * @param refreshed tokens returned by the token endpoint
	 * @return the updated credentials
	 */
	public OAuthCredentials merge(OAuthCredentials refreshed) {
		String newRefreshToken = refreshed.canRefresh() ? refreshed.refreshToken() : refreshToken;
		String newScope = refreshed.scope() != null ? refreshed.scope() : scope;
		return new OAuthCredentials(refreshed.accessToken(), newRefreshToken, refreshed.expiresAt(), tokenEndpoint,
				newScope);
	}

}
