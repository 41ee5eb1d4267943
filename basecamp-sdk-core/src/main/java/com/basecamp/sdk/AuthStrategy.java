package com.basecamp.sdk;

import java.util.Map;

/**
 * Attaches credentials to outgoing requests. Called once per attempt, so rotating or
 * refreshing credentials take effect on retries.
 */
public interface AuthStrategy {

	/**
	 * Add authentication headers to a request about to be sent.
	 * @param headers mutable request headers
	 */
	void authenticate(Map<String, String> headers);

	/**
	 * Force a credential refresh after the server rejected the current one with 401.
	 * @return true if new credentials are available and the request may be retried
	 */
	default boolean refresh() {
		return false;
	}

}
