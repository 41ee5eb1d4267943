package com.basecamp.sdk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

	@Test
	@DisplayName("Should coerce zero attempts to one")
	void shouldCoerceZeroAttempts() {
		RetryPolicy policy = new RetryPolicy(0, 100, RetryPolicy.Backoff.CONSTANT, Set.of(429), 0);

		assertThat(policy.maxAttempts()).isEqualTo(1);
		assertThat(RetryPolicy.DEFAULT.withMaxAttempts(-5).maxAttempts()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should grow exponentially")
	void shouldGrowExponentially() {
		RetryPolicy policy = new RetryPolicy(5, 100, RetryPolicy.Backoff.EXPONENTIAL, Set.of(), 0);

		assertThat(policy.delayMillis(1)).isEqualTo(100);
		assertThat(policy.delayMillis(2)).isEqualTo(200);
		assertThat(policy.delayMillis(3)).isEqualTo(400);
	}

	@Test
	@DisplayName("Should not overflow on large attempt numbers")
	void shouldNotOverflow() {
		RetryPolicy policy = new RetryPolicy(100, 1000, RetryPolicy.Backoff.EXPONENTIAL, Set.of(), 0);

		assertThat(policy.delayMillis(90)).isPositive();
	}

	@Test
	@DisplayName("Should grow linearly and stay constant")
	void shouldSupportLinearAndConstant() {
		RetryPolicy linear = new RetryPolicy(5, 100, RetryPolicy.Backoff.LINEAR, Set.of(), 0);
		RetryPolicy constant = new RetryPolicy(5, 100, RetryPolicy.Backoff.CONSTANT, Set.of(), 0);

		assertThat(linear.delayMillis(3)).isEqualTo(300);
		assertThat(constant.delayMillis(3)).isEqualTo(100);
	}

	@Test
	@DisplayName("Should add bounded jitter")
	void shouldAddBoundedJitter() {
		RetryPolicy policy = new RetryPolicy(3, 1000, RetryPolicy.Backoff.CONSTANT, Set.of(), 100);

		for (int i = 0; i < 50; i++) {
			assertThat(policy.delayMillis(1)).isBetween(1000L, 1100L);
		}
	}

	@Test
	@DisplayName("Should retry default statuses only")
	void shouldRetryDefaultStatuses() {
		assertThat(RetryPolicy.DEFAULT.retriesStatus(429)).isTrue();
		assertThat(RetryPolicy.DEFAULT.retriesStatus(503)).isTrue();
		assertThat(RetryPolicy.DEFAULT.retriesStatus(500)).isFalse();
		assertThat(RetryPolicy.DEFAULT.retriesStatus(404)).isFalse();
		assertThat(RetryPolicy.NONE.retriesStatus(429)).isFalse();
	}

	@Test
	@DisplayName("Should parse backoff names")
	void shouldParseBackoffNames() {
		assertThat(RetryPolicy.Backoff.fromString("exp+jitter")).isEqualTo(RetryPolicy.Backoff.EXPONENTIAL);
		assertThat(RetryPolicy.Backoff.fromString("Exponential")).isEqualTo(RetryPolicy.Backoff.EXPONENTIAL);
		assertThat(RetryPolicy.Backoff.fromString("linear")).isEqualTo(RetryPolicy.Backoff.LINEAR);
		assertThat(RetryPolicy.Backoff.fromString("fixed")).isEqualTo(RetryPolicy.Backoff.CONSTANT);
		assertThatThrownBy(() -> RetryPolicy.Backoff.fromString("random"))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
