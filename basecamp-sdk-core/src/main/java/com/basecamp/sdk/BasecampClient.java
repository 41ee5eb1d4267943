package com.basecamp.sdk;

import java.net.URI;

/**
 * The request pipeline contract.
 *
 * <p>
 * Implementations are layered as decorators: {@link HttpBasecampClient} performs exactly
 * one exchange, {@link RetryingBasecampClient} adds the retry loop around it and the
 * optional {@link ResilientBasecampClient} guards the whole call.
 */
public interface BasecampClient {

	/**
	 * Execute a logical call.
	 * @param spec the request
	 * @return the successful response
	 * @throws BasecampException on any failure
	 */
	default ApiResponse execute(RequestSpec spec) {
		return execute(spec, 1);
	}

	/**
	 * Execute a call, reporting {@code attempt} to hooks.
	 * @param spec the request
	 * @param attempt attempt number, starting at 1
	 * @return the successful response
	 * @throws BasecampException on any failure
	 */
	ApiResponse execute(RequestSpec spec, int attempt);

	/**
	 * Resolve the URL a request will be sent to.
	 * @param spec the request
	 * @return absolute URL, query included
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} for insecure or
	 * malformed URLs
	 */
	URI resolve(RequestSpec spec);

}
