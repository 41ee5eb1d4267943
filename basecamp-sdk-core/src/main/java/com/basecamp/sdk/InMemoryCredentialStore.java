package com.basecamp.sdk;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CredentialStore}. Nothing survives a restart.
 */
public class InMemoryCredentialStore implements CredentialStore {

	private final Map<String, OAuthCredentials> credentials = new ConcurrentHashMap<>();

	@Override
	public Optional<OAuthCredentials> load(String key) {
		return Optional.ofNullable(credentials.get(key));
	}

	@Override
	public void save(String key, OAuthCredentials value) {
		credentials.put(key, value);
	}

	@Override
	public void delete(String key) {
		credentials.remove(key);
	}

}
