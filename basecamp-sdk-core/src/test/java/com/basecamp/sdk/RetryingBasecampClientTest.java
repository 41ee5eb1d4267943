package com.basecamp.sdk;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingBasecampClient}.
 *
 * Tests policy selection, backoff, Retry-After handling and the 401 refresh retry.
 */
@DisplayName("RetryingBasecampClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingBasecampClientTest {

	private static final RetryPolicy FAST = new RetryPolicy(3, 10, RetryPolicy.Backoff.EXPONENTIAL,
			RetryPolicy.DEFAULT_RETRY_ON, 0);

	@Mock
	private BasecampClient delegate;

	private final List<Long> sleeps = new ArrayList<>();

	private final List<Integer> retryEvents = new ArrayList<>();

	private final BasecampHooks hooks = new BasecampHooks() {
		@Override
		public void onRetry(RequestInfo info, int nextAttempt, BasecampException error, long delayMillis) {
			retryEvents.add(nextAttempt);
		}
	};

	private RetryingBasecampClient retryingClient;

	@BeforeEach
	void setUp() {
		lenient().when(delegate.resolve(any())).thenReturn(URI.create("https://3.basecampapi.com/999/p.json"));
		retryingClient = builder().build();
	}

	private RetryingBasecampClient.Builder builder() {
		return RetryingBasecampClient.builder()
			.wrapping(delegate)
			.defaultPolicy(FAST)
			.hooks(hooks)
			.sleeper(sleeps::add);
	}

	private static BasecampException status(int status) {
		return BasecampException.fromHttpStatus(status, null, null, null, null, false);
	}

	private static ApiResponse ok() {
		return new ApiResponse(URI.create("https://3.basecampapi.com/999/p.json"), 200, Map.of(), new byte[0], false);
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should succeed after transient 429s")
		void shouldRetryRateLimits() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(429)).thenThrow(status(429)).thenReturn(ok());

			ApiResponse response = retryingClient.execute(spec);

			assertThat(response.statusCode()).isEqualTo(200);
			verify(delegate).execute(spec, 1);
			verify(delegate).execute(spec, 2);
			verify(delegate).execute(spec, 3);
			assertThat(sleeps).containsExactly(10L, 20L);
		}

		@Test
		@DisplayName("Should stop after max attempts")
		void shouldStopAfterMaxAttempts() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(503));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class)
				.satisfies(e -> assertThat(((BasecampException) e).getHttpStatus()).isEqualTo(503));
			verify(delegate, times(3)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should not fire onRetry after the last attempt")
		void shouldNotFireRetryHookAfterLastAttempt() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(429));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class);
			assertThat(retryEvents).containsExactly(2, 3);
			assertThat(sleeps).hasSize(2);
		}

		@Test
		@DisplayName("Should not retry non-retryable errors")
		void shouldNotRetryNotFound() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(404));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should not retry statuses outside retryOn")
		void shouldNotRetryStatusOutsideRetryOn() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(500));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should retry 500 when the policy lists it")
		void shouldRetry500WhenListed() {
			RetryingBasecampClient client = builder().defaultPolicy(FAST.withRetryOn(Set.of(500))).build();
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(500)).thenReturn(ok());

			client.execute(spec);

			verify(delegate, times(2)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should retry network errors")
		void shouldRetryNetworkErrors() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(BasecampException.network("reset", null))
				.thenReturn(ok());

			retryingClient.execute(spec);

			verify(delegate, times(2)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should send once when max attempts is zero")
		void shouldSendOnceWithZeroAttempts() {
			RetryingBasecampClient client = builder().defaultPolicy(FAST.withMaxAttempts(0)).build();
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(429));

			assertThatThrownBy(() -> client.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should send once when retry is disabled")
		void shouldSendOnceWhenDisabled() {
			RetryingBasecampClient client = builder().enabled(false).build();
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(503));

			assertThatThrownBy(() -> client.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

	}

	@Nested
	@DisplayName("Retry-After Tests")
	class RetryAfterTest {

		@Test
		@DisplayName("Should prefer Retry-After over computed backoff")
		void shouldPreferRetryAfter() {
			RequestSpec spec = RequestSpec.get("/p.json");
			BasecampException limited = BasecampException.fromHttpStatus(429, null, null, 2L, null, false);
			when(delegate.execute(eq(spec), anyInt())).thenThrow(limited).thenReturn(ok());

			retryingClient.execute(spec);

			assertThat(sleeps).containsExactly(2000L);
		}

		@Test
		@DisplayName("Should surface the rate limit when Retry-After exceeds an hour")
		void shouldNotRetryBeforeLongRetryAfter() {
			RequestSpec spec = RequestSpec.get("/p.json");
			BasecampException limited = BasecampException.fromHttpStatus(429, null, null, 7200L, null, false);
			when(delegate.execute(eq(spec), anyInt())).thenThrow(limited);

			assertThatThrownBy(() -> retryingClient.execute(spec)).isSameAs(limited)
				.satisfies(e -> assertThat(((BasecampException) e).getRetryAfterSeconds()).isEqualTo(7200L));
			assertThat(sleeps).isEmpty();
			assertThat(retryEvents).isEmpty();
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

	}

	@Nested
	@DisplayName("Policy Selection Tests")
	class PolicySelectionTest {

		private final BehaviorModel model = BehaviorModel.parse(ObjectMapperFactory.create()
			.valueToTree(Map.of("operations",
					Map.of("UpdateProject", Map.of("idempotent", true), "CreateProject",
							Map.of("retry", Map.of("max", 0)), "GetProject",
							Map.of("retry", Map.of("max", 5, "base_delay_ms", 1, "backoff", "constant"))))));

		@Test
		@DisplayName("Should not retry plain mutations")
		void shouldNotRetryMutations() {
			RequestSpec spec = RequestSpec.post("/p.json", "{}");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(503));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should retry idempotent mutations with the default policy")
		void shouldRetryIdempotentMutations() {
			RetryingBasecampClient client = builder().behaviorModel(model).build();
			RequestSpec spec = RequestSpec.put("/p.json", "{}").withOperation("UpdateProject");

			assertThat(client.policyFor(spec)).isEqualTo(FAST);
		}

		@Test
		@DisplayName("Should use the operation's own retry block")
		void shouldUseOperationRetryBlock() {
			RetryingBasecampClient client = builder().behaviorModel(model).build();

			RetryPolicy get = client.policyFor(RequestSpec.get("/p.json").withOperation("GetProject"));
			RetryPolicy create = client.policyFor(RequestSpec.post("/p.json", "{}").withOperation("CreateProject"));

			assertThat(get.maxAttempts()).isEqualTo(5);
			assertThat(get.backoff()).isEqualTo(RetryPolicy.Backoff.CONSTANT);
			assertThat(create.maxAttempts()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should use the default policy for unknown GET operations")
		void shouldUseDefaultForUnknownGets() {
			assertThat(retryingClient.policyFor(RequestSpec.get("/p.json").withOperation("Unknown"))).isEqualTo(FAST);
		}

	}

	@Nested
	@DisplayName("Credential Refresh Tests")
	class RefreshTest {

		@Mock
		private AuthStrategy auth;

		@Test
		@DisplayName("Should refresh once on 401 and retry immediately")
		void shouldRefreshOnUnauthorized() {
			RetryingBasecampClient client = builder().authStrategy(auth).build();
			RequestSpec spec = RequestSpec.get("/p.json");
			when(auth.refresh()).thenReturn(true);
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(401)).thenReturn(ok());

			client.execute(spec);

			verify(auth, times(1)).refresh();
			verify(delegate).execute(spec, 2);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should surface a second 401 without refreshing again")
		void shouldNotRefreshTwice() {
			RetryingBasecampClient client = builder().authStrategy(auth).build();
			RequestSpec spec = RequestSpec.get("/p.json");
			when(auth.refresh()).thenReturn(true);
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(401));

			assertThatThrownBy(() -> client.execute(spec)).isInstanceOf(BasecampException.class)
				.satisfies(e -> assertThat(((BasecampException) e).getKind()).isEqualTo(ErrorKind.AUTH));
			verify(auth, times(1)).refresh();
			verify(delegate, times(2)).execute(eq(spec), anyInt());
		}

		@Test
		@DisplayName("Should surface 401 when refresh is unavailable")
		void shouldSurfaceWhenRefreshUnavailable() {
			RequestSpec spec = RequestSpec.get("/p.json");
			when(delegate.execute(eq(spec), anyInt())).thenThrow(status(401));

			assertThatThrownBy(() -> retryingClient.execute(spec)).isInstanceOf(BasecampException.class);
			verify(delegate, times(1)).execute(eq(spec), anyInt());
		}

	}

	@Test
	@DisplayName("Should require a client to wrap")
	void shouldRequireDelegate() {
		assertThatThrownBy(() -> RetryingBasecampClient.builder().build()).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("wrapping()");
	}

}
