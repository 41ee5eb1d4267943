package com.basecamp.sdk;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully resolved HTTP request handed to a {@link BasecampTransport}.
 *
 * @param method HTTP method
 * @param uri absolute request URI
 * @param headers request headers, auth included
 * @param body encoded body, empty when there is none
 */
public record TransportRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body) {

	public TransportRequest {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	public boolean hasBody() {
		return body.length > 0;
	}

}
