package com.basecamp.sdk;

/**
 * Supplies access tokens.
 */
public interface TokenProvider {

	/**
	 * Returns a current access token, refreshing it first if needed.
	 * @return access token
	 * @throws BasecampException with kind {@link ErrorKind#AUTH} if no token is available
	 */
	String accessToken();

	/**
	 * Force a refresh.
	 * @return true if a new token was obtained
	 */
	default boolean refresh() {
		return false;
	}

}
