package com.basecamp.sdk;

import java.util.Arrays;

/**
 * A cached GET body together with the ETag it was served with. Equality compares body
 * contents.
 *
 * @param etag ETag header value, stored verbatim
 * @param body response body
 */
public record CachedResponse(String etag, byte[] body) {

	public CachedResponse {
		body = body.clone();
	}

	@Override
	public byte[] body() {
		return body.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CachedResponse other)) {
			return false;
		}
		return etag.equals(other.etag) && Arrays.equals(body, other.body);
	}

	@Override
	public int hashCode() {
		return 31 * etag.hashCode() + Arrays.hashCode(body);
	}

	@Override
	public String toString() {
		return "CachedResponse[etag=" + etag + ", body=" + body.length + " bytes]";
	}

}
