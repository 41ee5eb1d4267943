package com.basecamp.sdk;

import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Settings for {@link ResilientBasecampClient}. A null component disables that guard.
 *
 * <p>
 * Defaults:
 * <ul>
 * <li>circuit breaker: opens at a 50% failure rate over the last 10 calls (at least 5
 * recorded), stays open 30 seconds, closes after 2 successful trial calls</li>
 * <li>bulkhead: 10 concurrent calls per operation, waiting up to 5 seconds for a
 * slot</li>
 * <li>rate limiter: 50 calls per second, failing fast, and honoring the server's
 * {@code Retry-After} after a 429</li>
 * </ul>
 *
 * @param circuitBreaker per-operation circuit breaker settings, or null
 * @param bulkhead per-operation concurrency limit, or null
 * @param rateLimiter client-wide rate limit, or null
 */
public record ResilienceConfig(@Nullable CircuitBreakerConfig circuitBreaker, @Nullable BulkheadConfig bulkhead,
		@Nullable RateLimiterConfig rateLimiter) {

	public static ResilienceConfig defaults() {
		return new ResilienceConfig(defaultCircuitBreaker(), defaultBulkhead(), defaultRateLimiter());
	}

	public static ResilienceConfig circuitBreakerOnly(CircuitBreakerConfig circuitBreaker) {
		return new ResilienceConfig(circuitBreaker, null, null);
	}

	public static ResilienceConfig bulkheadOnly(BulkheadConfig bulkhead) {
		return new ResilienceConfig(null, bulkhead, null);
	}

	public static ResilienceConfig rateLimiterOnly(RateLimiterConfig rateLimiter) {
		return new ResilienceConfig(null, null, rateLimiter);
	}

	public static CircuitBreakerConfig defaultCircuitBreaker() {
		return CircuitBreakerConfig.custom()
			.failureRateThreshold(50)
			.slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
			.slidingWindowSize(10)
			.minimumNumberOfCalls(5)
			.waitDurationInOpenState(Duration.ofSeconds(30))
			.permittedNumberOfCallsInHalfOpenState(2)
			.build();
	}

	public static BulkheadConfig defaultBulkhead() {
		return BulkheadConfig.custom().maxConcurrentCalls(10).maxWaitDuration(Duration.ofSeconds(5)).build();
	}

	public static RateLimiterConfig defaultRateLimiter() {
		return RateLimiterConfig.custom()
			.limitForPeriod(50)
			.limitRefreshPeriod(Duration.ofSeconds(1))
			.timeoutDuration(Duration.ZERO)
			.build();
	}

}
