package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TokenProvider} backed by refreshable OAuth credentials.
 *
 * <p>
 * Tokens within {@link OAuthCredentials#EXPIRY_BUFFER} of expiry are refreshed before
 * use. Concurrent callers that find the token expired share one in-flight refresh: the
 * first caller performs the network call and completes a future the others wait on. No
 * lock is held across the call. The in-flight future is cleared once it settles, so a
 * failed refresh is attempted again by the next caller.
 *
 * <pre>
 * {@code
 * TokenProvider tokens = OAuthTokenProvider.builder()
 *     .credentialStore(FileCredentialStore.inConfigDirectory(mapper))
 *     .storeKey("https://3.basecampapi.com")
 *     .refresher(new LaunchpadTokenRefresher(transport, mapper, clientId, clientSecret))
 *     .build();
 * }
 * </pre>
 */
public final class OAuthTokenProvider implements TokenProvider {

	private static final Logger logger = LoggerFactory.getLogger(OAuthTokenProvider.class);

	private final CredentialStore credentialStore;

	private final String storeKey;

	private final TokenRefresher refresher;

	private final Clock clock;

	private final Duration expiryBuffer;

	private final AtomicReference<CompletableFuture<OAuthCredentials>> inFlight = new AtomicReference<>();

	@Nullable
	private volatile OAuthCredentials current;

	private OAuthTokenProvider(Builder builder) {
		this.credentialStore = builder.credentialStore;
		this.storeKey = builder.storeKey;
		this.refresher = builder.refresher;
		this.clock = builder.clock;
		this.expiryBuffer = builder.expiryBuffer;
		this.current = builder.initialCredentials;
		if (builder.initialCredentials != null) {
			credentialStore.save(storeKey, builder.initialCredentials);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String accessToken() {
		OAuthCredentials credentials = credentials();
		if (credentials.isExpired(clock, expiryBuffer)) {
			if (!credentials.canRefresh()) {
				throw BasecampException.auth("Access token expired", "Log in again");
			}
			credentials = refreshShared(credentials);
		}
		return credentials.accessToken();
	}

	@Override
	public boolean refresh() {
		OAuthCredentials credentials = credentials();
		if (!credentials.canRefresh()) {
			return false;
		}
		try {
			refreshShared(credentials);
			return true;
		}
		catch (BasecampException e) {
			logger.warn("Token refresh failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Forget the credentials, locally and in the store.
	 */
	public void logout() {
		current = null;
		credentialStore.delete(storeKey);
		logger.info("Logged out of {}", storeKey);
	}

	private OAuthCredentials credentials() {
		OAuthCredentials credentials = current;
		if (credentials == null) {
			credentials = credentialStore.load(storeKey)
				.orElseThrow(() -> BasecampException.auth("Not authenticated", "Log in to obtain credentials"));
			current = credentials;
		}
		return credentials;
	}

	private OAuthCredentials refreshShared(OAuthCredentials stale) {
		CompletableFuture<OAuthCredentials> mine = new CompletableFuture<>();
		CompletableFuture<OAuthCredentials> existing = inFlight.compareAndExchange(null, mine);
		if (existing != null) {
			return await(existing);
		}
		try {
			// Another caller may have finished a refresh since we read the stale token
			OAuthCredentials latest = current;
			if (latest != null && latest != stale && !latest.isExpired(clock, expiryBuffer)) {
				mine.complete(latest);
				return latest;
			}
			logger.info("Refreshing access token for {}", storeKey);
			OAuthCredentials refreshed = stale.merge(refresher.refresh(stale));
			credentialStore.save(storeKey, refreshed);
			current = refreshed;
			mine.complete(refreshed);
			return refreshed;
		}
		catch (RuntimeException e) {
			mine.completeExceptionally(e);
			throw e;
		}
		finally {
			inFlight.compareAndSet(mine, null);
		}
	}

	private static OAuthCredentials await(CompletableFuture<OAuthCredentials> future) {
		try {
			return future.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw BasecampException.interrupted(e);
		}
		catch (ExecutionException e) {
			if (e.getCause() instanceof BasecampException basecampException) {
				throw basecampException;
			}
			throw new BasecampException(ErrorKind.AUTH, "Token refresh failed", "Log in again", null, false, null,
					null, e.getCause());
		}
	}

	/**
	 * Builder for {@link OAuthTokenProvider}.
	 */
	public static class Builder {

		private CredentialStore credentialStore = new InMemoryCredentialStore();

		private String storeKey = BasecampConfig.DEFAULT_BASE_URL;

		@Nullable
		private TokenRefresher refresher;

		private Clock clock = Clock.systemUTC();

		private Duration expiryBuffer = OAuthCredentials.EXPIRY_BUFFER;

		@Nullable
		private OAuthCredentials initialCredentials;

		private Builder() {
		}

		public Builder credentialStore(CredentialStore credentialStore) {
			this.credentialStore = credentialStore;
			return this;
		}

		/**
		 * Key the credentials are stored under, normally the API base URL.
		 */
		public Builder storeKey(String storeKey) {
			this.storeKey = storeKey;
			return this;
		}

		public Builder refresher(TokenRefresher refresher) {
			this.refresher = refresher;
			return this;
		}

		/**
		 * Seed the provider with credentials obtained elsewhere. They are saved to the
		 * store.
		 */
		public Builder credentials(OAuthCredentials credentials) {
			this.initialCredentials = credentials;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder expiryBuffer(Duration expiryBuffer) {
			this.expiryBuffer = expiryBuffer;
			return this;
		}

		/**
		 * Build the provider.
		 * @return configured OAuthTokenProvider
		 * @throws IllegalStateException if no refresher was set
		 */
		public OAuthTokenProvider build() {
			if (refresher == null) {
				throw new IllegalStateException("A TokenRefresher is required. Call refresher() first.");
			}
			if (expiryBuffer.isNegative()) {
				throw new IllegalStateException("expiryBuffer must not be negative");
			}
			return new OAuthTokenProvider(this);
		}

	}

}
