package com.basecamp.sdk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BasecampBuilder}.
 */
@DisplayName("Basecamp Builder Tests")
class BasecampBuilderTest {

	private final List<TransportRequest> sent = new ArrayList<>();

	private final BasecampTransport stub = request -> {
		sent.add(request);
		return new TransportResponse(200, Map.of("ETag", List.of("\"v1\"")), "[]".getBytes());
	};

	@Nested
	@DisplayName("Authentication")
	class AuthenticationTest {

		@Test
		@DisplayName("Should require an auth source")
		void shouldRequireAuth() {
			assertThatThrownBy(() -> BasecampBuilder.create().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Authentication is required");
		}

		@Test
		@DisplayName("Should reject several auth sources")
		void shouldRejectSeveralSources() {
			BasecampBuilder builder = BasecampBuilder.create()
				.accessToken("a")
				.tokenProvider(new StaticTokenProvider("b"));

			assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Only one of");
		}

		@Test
		@DisplayName("Should send the access token as a bearer header")
		void shouldSendBearerToken() {
			Basecamp basecamp = BasecampBuilder.create().accessToken("test-token").transport(stub).build();

			basecamp.forAccount(999).get("/projects.json");

			assertThat(sent).singleElement().satisfies(request -> {
				assertThat(request.headers()).containsEntry("Authorization", "Bearer test-token");
				assertThat(request.uri()).hasToString("https://3.basecampapi.com/999/projects.json");
			});
		}

		@Test
		@DisplayName("Should use a custom auth strategy")
		void shouldUseCustomStrategy() {
			AuthStrategy apiKey = headers -> headers.put("X-Api-Key", "k");
			Basecamp basecamp = BasecampBuilder.create().authStrategy(apiKey).transport(stub).build();

			basecamp.forAccount(999).get("/projects.json");

			assertThat(sent.get(0).headers()).containsEntry("X-Api-Key", "k").doesNotContainKey("Authorization");
		}

	}

	@Nested
	@DisplayName("Configuration")
	class ConfigurationTest {

		@Test
		@DisplayName("Should validate the configuration")
		void shouldValidateConfig() {
			BasecampConfig config = new BasecampConfig();
			config.setBaseUrl("http://api.example.com");

			assertThatThrownBy(() -> BasecampBuilder.create().accessToken("t").config(config).build())
				.isInstanceOf(BasecampException.class)
				.satisfies(e -> assertThat(((BasecampException) e).getKind()).isEqualTo(ErrorKind.USAGE));
		}

		@Test
		@DisplayName("Should create the cache only when enabled")
		void shouldCreateCacheWhenEnabled() {
			BasecampConfig config = new BasecampConfig();
			config.setCacheEnabled(true);

			Basecamp cached = BasecampBuilder.create().accessToken("t").config(config).transport(stub).build();
			Basecamp uncached = BasecampBuilder.create().accessToken("t").transport(stub).build();

			cached.forAccount(1).get("/people.json");
			assertThat(cached.cache()).hasValueSatisfying(cache -> assertThat(cache.size()).isEqualTo(1));
			assertThat(uncached.cache()).isEmpty();
		}

		@Test
		@DisplayName("Should reject a non-numeric account ID")
		void shouldRejectNonNumericAccount() {
			Basecamp basecamp = BasecampBuilder.create().accessToken("t").transport(stub).build();

			assertThatThrownBy(() -> basecamp.forAccount("abc")).isInstanceOf(BasecampException.class)
				.hasMessageContaining("Account ID must be numeric");
		}

		@Test
		@DisplayName("Should add the resilience guards only when asked")
		void shouldWrapWithResilienceWhenEnabled() {
			BasecampConfig config = new BasecampConfig();
			config.setResilienceEnabled(true);

			Basecamp fromConfig = BasecampBuilder.create().accessToken("t").config(config).transport(stub).build();
			Basecamp explicit = BasecampBuilder.create()
				.accessToken("t")
				.resilience(ResilienceConfig.defaults())
				.transport(stub)
				.build();
			Basecamp plain = BasecampBuilder.create().accessToken("t").transport(stub).build();

			assertThat(fromConfig.client()).isInstanceOf(ResilientBasecampClient.class);
			assertThat(explicit.client()).isInstanceOf(ResilientBasecampClient.class);
			assertThat(plain.client()).isNotInstanceOf(ResilientBasecampClient.class);
			assertThat(explicit.forAccount(1).get("/people.json").statusCode()).isEqualTo(200);
		}

	}

	@Nested
	@DisplayName("Hooks")
	class HooksTest {

		@Test
		@DisplayName("Should call hooks in registration order")
		void shouldChainHooks() {
			List<String> events = new ArrayList<>();
			BasecampHooks first = new BasecampHooks() {
				@Override
				public void onRequestStart(RequestInfo info) {
					events.add("first");
				}
			};
			BasecampHooks second = new BasecampHooks() {
				@Override
				public void onRequestStart(RequestInfo info) {
					events.add("second");
				}
			};

			BasecampBuilder.create().accessToken("t").transport(stub).hooks(first).hooks(second).build()
				.forAccount(1).get("/people.json");

			assertThat(events).containsExactly("first", "second");
		}

	}

}
