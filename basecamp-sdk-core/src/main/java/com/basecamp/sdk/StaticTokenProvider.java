package com.basecamp.sdk;

/**
 * A fixed token that cannot be refreshed, e.g. a personal access token.
 */
public class StaticTokenProvider implements TokenProvider {

	private final String token;

	public StaticTokenProvider(String token) {
		if (token.isBlank()) {
			throw new IllegalArgumentException("token must not be blank");
		}
		this.token = token;
	}

	@Override
	public String accessToken() {
		return token;
	}

}
