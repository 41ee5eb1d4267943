package com.basecamp.sdk;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.exception.AcquirePermissionCancelledException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Decorator that guards a {@link BasecampClient} with a circuit breaker, a bulkhead and a
 * rate limiter (resilience4j).
 *
 * <p>
 * Gates are checked in that order before each call. A rejected call fails fast without
 * reaching the wrapped client:
 * <ul>
 * <li>open circuit: {@link ErrorKind#API} error "Circuit breaker is open"</li>
 * <li>no bulkhead slot within the wait time: {@link ErrorKind#API} error "Too many
 * concurrent requests"</li>
 * <li>no rate limit permit, or a server {@code Retry-After} still pending:
 * {@link ErrorKind#RATE_LIMIT} error</li>
 * </ul>
 *
 * <p>
 * Circuit breakers and bulkheads are scoped per operation name; requests without one
 * share the {@value #DEFAULT_SCOPE} scope. Only server-side failures (5xx and network
 * errors) count against a circuit. Client errors such as 404 or 429 neither open nor
 * close it. The rate limiter is shared by all calls; after a 429 (or a 503 carrying
 * {@code Retry-After}) it rejects calls until the server's delay has passed.
 *
 * <p>
 * Wrap the retrying client so a logical call, with all its retries, passes each gate
 * once:
 *
 * <pre>
 * {@code
 * BasecampClient client = ResilientBasecampClient.builder()
 *     .wrapping(retryingClient)
 *     .config(ResilienceConfig.defaults())
 *     .build();
 * }
 * </pre>
 */
public final class ResilientBasecampClient implements BasecampClient {

	private static final Logger logger = LoggerFactory.getLogger(ResilientBasecampClient.class);

	static final String DEFAULT_SCOPE = "default";

	/**
	 * Pause applied after a 429 that carries no {@code Retry-After}.
	 */
	static final long DEFAULT_RATE_LIMIT_PAUSE_SECONDS = 60;

	private final BasecampClient delegate;

	@Nullable
	private final CircuitBreakerRegistry circuitBreakers;

	@Nullable
	private final BulkheadRegistry bulkheads;

	@Nullable
	private final RateLimiter rateLimiter;

	private final Clock clock;

	private volatile long blockedUntilMillis;

	private ResilientBasecampClient(Builder builder) {
		ResilienceConfig config = builder.config;
		this.delegate = builder.delegate;
		this.circuitBreakers = config.circuitBreaker() != null ? CircuitBreakerRegistry.of(config.circuitBreaker())
				: null;
		this.bulkheads = config.bulkhead() != null ? BulkheadRegistry.of(config.bulkhead()) : null;
		this.rateLimiter = config.rateLimiter() != null ? RateLimiter.of("basecamp", config.rateLimiter()) : null;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse execute(RequestSpec spec, int attempt) {
		String scope = spec.operationName() != null ? spec.operationName() : DEFAULT_SCOPE;
		CircuitBreaker circuitBreaker = circuitBreakers != null ? circuitBreakers.circuitBreaker(scope) : null;
		if (circuitBreaker != null && !circuitBreaker.tryAcquirePermission()) {
			logger.debug("Circuit breaker for {} is {}, rejecting call", scope, circuitBreaker.getState());
			throw new BasecampException(ErrorKind.API, "Circuit breaker is open for " + scope,
					"The Basecamp API is failing; try again later", null, false, null, null, null);
		}

		Bulkhead bulkhead = null;
		try {
			bulkhead = acquireBulkhead(scope);
			acquireRateLimit();
		}
		catch (BasecampException e) {
			if (bulkhead != null) {
				bulkhead.onComplete();
			}
			if (circuitBreaker != null) {
				circuitBreaker.releasePermission();
			}
			throw e;
		}

		long start = circuitBreaker != null ? circuitBreaker.getCurrentTimestamp() : 0;
		try {
			ApiResponse response = delegate.execute(spec, attempt);
			if (circuitBreaker != null) {
				circuitBreaker.onSuccess(circuitBreaker.getCurrentTimestamp() - start,
						circuitBreaker.getTimestampUnit());
			}
			return response;
		}
		catch (BasecampException e) {
			if (circuitBreaker != null) {
				if (isServerFailure(e)) {
					circuitBreaker.onError(circuitBreaker.getCurrentTimestamp() - start,
							circuitBreaker.getTimestampUnit(), e);
				}
				else {
					circuitBreaker.releasePermission();
				}
			}
			pauseForRetryAfter(e);
			throw e;
		}
		finally {
			if (bulkhead != null) {
				bulkhead.onComplete();
			}
		}
	}

	@Override
	public URI resolve(RequestSpec spec) {
		return delegate.resolve(spec);
	}

	/**
	 * Whether a failure indicates an unhealthy service rather than a bad request.
	 * @param error the failure
	 * @return true for network errors and 5xx responses
	 */
	static boolean isServerFailure(Throwable error) {
		if (!(error instanceof BasecampException e)) {
			return true;
		}
		if (e.getKind() == ErrorKind.NETWORK) {
			return e.isRetryable();
		}
		return e.getHttpStatus() != null && e.getHttpStatus() >= 500;
	}

	@Nullable
	private Bulkhead acquireBulkhead(String scope) {
		if (bulkheads == null) {
			return null;
		}
		Bulkhead bulkhead = bulkheads.bulkhead(scope);
		boolean permitted;
		try {
			permitted = bulkhead.tryAcquirePermission();
		}
		catch (AcquirePermissionCancelledException e) {
			throw new BasecampException(ErrorKind.NETWORK, "Request interrupted", null, null, false, null, null, e);
		}
		if (!permitted) {
			throw new BasecampException(ErrorKind.API, "Too many concurrent requests for " + scope,
					"Reduce concurrency or raise the bulkhead limit", null, false, null, null, null);
		}
		return bulkhead;
	}

	private void acquireRateLimit() {
		if (rateLimiter == null) {
			return;
		}
		long remaining = blockedUntilMillis - clock.millis();
		if (remaining > 0) {
			long seconds = TimeUnit.MILLISECONDS.toSeconds(remaining + 999);
			throw new BasecampException(ErrorKind.RATE_LIMIT, "Rate limited by server, retry in " + seconds + "s",
					null, null, false, seconds, null, null);
		}
		if (!rateLimiter.acquirePermission()) {
			throw new BasecampException(ErrorKind.RATE_LIMIT, "Client-side rate limit exceeded",
					"Slow down or raise the rate limit", null, false, null, null, null);
		}
	}

	private void pauseForRetryAfter(BasecampException e) {
		if (rateLimiter == null || e.getHttpStatus() == null) {
			return;
		}
		Long retryAfter = e.getRetryAfterSeconds();
		long pauseSeconds;
		if (e.getHttpStatus() == 429) {
			pauseSeconds = retryAfter != null && retryAfter > 0 ? retryAfter : DEFAULT_RATE_LIMIT_PAUSE_SECONDS;
		}
		else if (e.getHttpStatus() == 503 && retryAfter != null && retryAfter > 0) {
			pauseSeconds = retryAfter;
		}
		else {
			return;
		}
		logger.warn("Server asked to slow down, pausing requests for {} seconds", pauseSeconds);
		blockedUntilMillis = Math.max(blockedUntilMillis, clock.millis() + TimeUnit.SECONDS.toMillis(pauseSeconds));
	}

	/**
	 * Builder for {@link ResilientBasecampClient}. Uses {@link ResilienceConfig#defaults()}
	 * unless another config is set.
	 */
	public static class Builder {

		private BasecampClient delegate;

		private ResilienceConfig config = ResilienceConfig.defaults();

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client to guard.
		 * @param client the BasecampClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(BasecampClient client) {
			this.delegate = client;
			return this;
		}

		public Builder config(ResilienceConfig config) {
			this.config = config;
			return this;
		}

		Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the ResilientBasecampClient.
		 * @return configured ResilientBasecampClient
		 * @throws IllegalStateException if no client to wrap was set
		 */
		public ResilientBasecampClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A BasecampClient to wrap is required. Call wrapping() first.");
			}
			return new ResilientBasecampClient(this);
		}

	}

}
