package com.basecamp.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;

/**
 * Decorator that adds the retry loop to a {@link BasecampClient}.
 *
 * <p>
 * Policy selection, per request:
 * <ul>
 * <li>retry disabled: one attempt</li>
 * <li>the operation has a retry block in the {@link BehaviorModel}: that policy</li>
 * <li>GET, or an operation marked idempotent: the default policy</li>
 * <li>any other mutation: one attempt, so side effects are never duplicated</li>
 * </ul>
 *
 * <p>
 * A failed attempt is retried when the error is retryable, its status is in the policy's
 * {@code retryOn} set (network errors always qualify) and attempts remain. The server's
 * {@code Retry-After} takes precedence over the computed backoff; a wait longer than an
 * hour is not slept through and the error is rethrown instead. Independently of the
 * policy, a 401 triggers one credential refresh and one immediate retry when the
 * {@link AuthStrategy} can refresh.
 *
 * <pre>
 * {@code
 * BasecampClient client = RetryingBasecampClient.builder()
 *     .wrapping(new HttpBasecampClient(transport, auth, config, cache, hooks, mapper))
 *     .authStrategy(auth)
 *     .behaviorModel(BehaviorModel.loadDefault(mapper))
 *     .defaultPolicy(config.defaultRetryPolicy())
 *     .build();
 * }
 * </pre>
 */
public final class RetryingBasecampClient implements BasecampClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingBasecampClient.class);

	/**
	 * Longest server-requested wait slept through (1 hour). A longer {@code Retry-After}
	 * ends the call with the error, which carries the requested wait.
	 */
	private static final long MAX_RETRY_AFTER_SECONDS = 3600;

	private final BasecampClient delegate;

	private final AuthStrategy authStrategy;

	private final BehaviorModel behaviorModel;

	private final RetryPolicy defaultPolicy;

	private final boolean enabled;

	private final BasecampHooks hooks;

	private final Sleeper sleeper;

	private RetryingBasecampClient(Builder builder) {
		this.delegate = builder.delegate;
		this.authStrategy = builder.authStrategy;
		this.behaviorModel = builder.behaviorModel;
		this.defaultPolicy = builder.defaultPolicy;
		this.enabled = builder.enabled;
		this.hooks = builder.hooks;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse execute(RequestSpec spec, int firstAttempt) {
		RetryPolicy policy = policyFor(spec);
		String description = spec.method() + " " + spec.path();
		boolean refreshed = false;
		int attempt = 1;
		int dispatch = firstAttempt;

		while (true) {
			try {
				return delegate.execute(spec, dispatch);
			}
			catch (BasecampException e) {
				if (e.getKind() == ErrorKind.AUTH && e.getHttpStatus() != null && e.getHttpStatus() == 401
						&& !refreshed) {
					refreshed = true;
					if (authStrategy.refresh()) {
						logger.info("{} returned 401, retrying with refreshed credentials", description);
						dispatch++;
						continue;
					}
				}

				if (!isRetryable(e, policy) || attempt >= policy.maxAttempts()) {
					if (attempt > 1) {
						logger.error("{} failed after {} attempts: {}", description, attempt, e.getMessage());
					}
					throw e;
				}

				Long retryAfter = e.getRetryAfterSeconds();
				if (retryAfter != null && retryAfter > MAX_RETRY_AFTER_SECONDS) {
					logger.warn("{} asked to wait {} seconds, more than {}; not retrying", description, retryAfter,
							MAX_RETRY_AFTER_SECONDS);
					throw e;
				}

				long delay = computeDelay(e, policy, attempt);
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt,
						policy.maxAttempts(), e.getMessage(), delay);
				hooks.onRetry(new RequestInfo(spec.method(), resolve(spec), dispatch), dispatch + 1, e, delay);
				sleep(delay);
				attempt++;
				dispatch++;
			}
		}
	}

	@Override
	public URI resolve(RequestSpec spec) {
		return delegate.resolve(spec);
	}

	/**
	 * Select the retry policy for a request.
	 * @param spec the request
	 * @return the policy to apply
	 */
	RetryPolicy policyFor(RequestSpec spec) {
		if (!enabled) {
			return RetryPolicy.NONE;
		}
		Optional<OperationMetadata> metadata = spec.operationName() != null
				? behaviorModel.find(spec.operationName()) : Optional.empty();
		if (metadata.isPresent() && metadata.get().retry() != null) {
			return metadata.get().retry();
		}
		boolean idempotent = metadata.map(OperationMetadata::idempotent).orElse(false);
		if (spec.method() == HttpMethod.GET || idempotent) {
			return defaultPolicy;
		}
		return RetryPolicy.NONE;
	}

	private static boolean isRetryable(BasecampException e, RetryPolicy policy) {
		if (!e.isRetryable()) {
			return false;
		}
		if (e.getKind() == ErrorKind.NETWORK) {
			return true;
		}
		return e.getHttpStatus() != null && policy.retriesStatus(e.getHttpStatus());
	}

	private static long computeDelay(BasecampException e, RetryPolicy policy, int attempt) {
		Long retryAfter = e.getRetryAfterSeconds();
		if (retryAfter != null) {
			return retryAfter * 1000;
		}
		return policy.delayMillis(attempt);
	}

	private void sleep(long millis) {
		try {
			sleeper.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw BasecampException.interrupted(e);
		}
	}

	/**
	 * Blocks between attempts. Replaceable in tests.
	 */
	@FunctionalInterface
	interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryingBasecampClient}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>defaultPolicy: {@link RetryPolicy#DEFAULT}</li>
	 * <li>behaviorModel: empty</li>
	 * <li>authStrategy: one that cannot refresh</li>
	 * </ul>
	 */
	public static class Builder {

		private BasecampClient delegate;

		private AuthStrategy authStrategy = headers -> {
		};

		private BehaviorModel behaviorModel = BehaviorModel.empty();

		private RetryPolicy defaultPolicy = RetryPolicy.DEFAULT;

		private boolean enabled = true;

		private BasecampHooks hooks = BasecampHooks.noop();

		private Sleeper sleeper = Thread::sleep;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the BasecampClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(BasecampClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Auth strategy asked to refresh after a 401.
		 */
		public Builder authStrategy(AuthStrategy authStrategy) {
			this.authStrategy = authStrategy;
			return this;
		}

		public Builder behaviorModel(BehaviorModel behaviorModel) {
			this.behaviorModel = behaviorModel;
			return this;
		}

		/**
		 * Policy for GET and idempotent operations without their own retry block.
		 */
		public Builder defaultPolicy(RetryPolicy policy) {
			this.defaultPolicy = policy;
			return this;
		}

		/**
		 * Disable to send every request exactly once. The 401 refresh retry still
		 * applies.
		 */
		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder hooks(BasecampHooks hooks) {
			this.hooks = hooks;
			return this;
		}

		Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingBasecampClient.
		 * @return configured RetryingBasecampClient
		 * @throws IllegalStateException if no client to wrap was set
		 */
		public RetryingBasecampClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A BasecampClient to wrap is required. Call wrapping() first.");
			}
			return new RetryingBasecampClient(this);
		}

	}

}
