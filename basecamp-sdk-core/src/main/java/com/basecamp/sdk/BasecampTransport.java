package com.basecamp.sdk;

import java.io.IOException;

/**
 * Executes one raw HTTP exchange.
 *
 * <p>
 * Implementations do not interpret status codes and do not retry. Any HTTP response,
 * including 4xx and 5xx, is returned; only failures with no response (connection reset,
 * timeout, DNS) are thrown. Redirects must not be followed automatically, since the
 * request carries a bearer token.
 */
@FunctionalInterface
public interface BasecampTransport {

	/**
	 * Send a request and return the response.
	 * @param request resolved request
	 * @return the HTTP response
	 * @throws IOException if no response was received
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	TransportResponse execute(TransportRequest request) throws IOException, InterruptedException;

}
