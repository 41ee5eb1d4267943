package com.basecamp.sdk;

import java.util.Map;

/**
 * Sends {@code Authorization: Bearer <token>} using a {@link TokenProvider}.
 */
public class BearerAuth implements AuthStrategy {

	private final TokenProvider tokenProvider;

	public BearerAuth(TokenProvider tokenProvider) {
		this.tokenProvider = tokenProvider;
	}

	@Override
	public void authenticate(Map<String, String> headers) {
		headers.put("Authorization", "Bearer " + tokenProvider.accessToken());
	}

	@Override
	public boolean refresh() {
		return tokenProvider.refresh();
	}

}
