package com.basecamp.sdk;

import java.util.Optional;

/**
 * Persists OAuth credentials, keyed by the API origin they belong to.
 */
public interface CredentialStore {

	Optional<OAuthCredentials> load(String key);

	void save(String key, OAuthCredentials credentials);

	void delete(String key);

}
