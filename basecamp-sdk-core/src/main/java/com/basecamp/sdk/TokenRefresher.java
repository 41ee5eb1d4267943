package com.basecamp.sdk;

/**
 * Exchanges a refresh token for new OAuth credentials.
 */
@FunctionalInterface
public interface TokenRefresher {

	/**
	 * Perform one refresh network call.
	 * @param credentials current credentials; must carry a refresh token
	 * @return the tokens returned by the server (the refresh token may be absent)
	 * @throws BasecampException if the refresh fails
	 */
	OAuthCredentials refresh(OAuthCredentials credentials);

}
