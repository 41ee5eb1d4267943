package com.basecamp.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for {@link Basecamp} clients.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Personal access token from BASECAMP_TOKEN
 * Basecamp basecamp = BasecampBuilder.create()
 *     .accessTokenFromEnv()
 *     .build();
 *
 * // OAuth with caching, logging and circuit breaking
 * BasecampConfig config = new BasecampConfig();
 * config.setCacheEnabled(true);
 *
 * Basecamp basecamp = BasecampBuilder.create()
 *     .tokenProvider(oauthTokenProvider)
 *     .config(config)
 *     .hooks(new LoggingHooks())
 *     .resilience(ResilienceConfig.defaults())
 *     .build();
 *
 * // For testing with a stub transport
 * Basecamp testClient = BasecampBuilder.create()
 *     .accessToken("test-token")
 *     .transport(request -> new TransportResponse(200, Map.of(), "[]".getBytes()))
 *     .build();
 * }
 * </pre>
 */
public class BasecampBuilder {

	public static final String TOKEN_VARIABLE = "BASECAMP_TOKEN";

	@Nullable
	private String accessToken;

	@Nullable
	private TokenProvider tokenProvider;

	@Nullable
	private AuthStrategy authStrategy;

	private BasecampConfig config = new BasecampConfig();

	@Nullable
	private BasecampTransport transport;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private BehaviorModel behaviorModel;

	@Nullable
	private ResilienceConfig resilience;

	private final List<BasecampHooks> hooks = new ArrayList<>();

	private BasecampBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new BasecampBuilder
	 */
	public static BasecampBuilder create() {
		return new BasecampBuilder();
	}

	/**
	 * Authenticate with a fixed bearer token.
	 * @param accessToken personal access token or OAuth access token
	 * @return this builder
	 */
	public BasecampBuilder accessToken(String accessToken) {
		this.accessToken = accessToken;
		return this;
	}

	/**
	 * Read the token from {@code BASECAMP_TOKEN} (environment or {@code .env}).
	 * @return this builder
	 * @throws IllegalStateException if BASECAMP_TOKEN is not set
	 */
	public BasecampBuilder accessTokenFromEnv() {
		String token = EnvironmentSupport.get(TOKEN_VARIABLE);
		if (token == null) {
			throw new IllegalStateException(
					TOKEN_VARIABLE + " environment variable is required. Set it to your Basecamp access token.");
		}
		this.accessToken = token;
		return this;
	}

	/**
	 * Authenticate with bearer tokens from a provider, such as
	 * {@link OAuthTokenProvider}.
	 * @param tokenProvider token source
	 * @return this builder
	 */
	public BasecampBuilder tokenProvider(TokenProvider tokenProvider) {
		this.tokenProvider = tokenProvider;
		return this;
	}

	/**
	 * Use a custom authentication scheme.
	 * @param authStrategy strategy that sets the request headers
	 * @return this builder
	 */
	public BasecampBuilder authStrategy(AuthStrategy authStrategy) {
		this.authStrategy = authStrategy;
		return this;
	}

	/**
	 * Set client configuration.
	 * @param config configuration (null to use defaults)
	 * @return this builder
	 */
	public BasecampBuilder config(@Nullable BasecampConfig config) {
		if (config != null) {
			this.config = config;
		}
		return this;
	}

	/**
	 * Set a custom transport. Useful for testing or for another HTTP library.
	 * @param transport transport (null to use {@link JdkHttpTransport})
	 * @return this builder
	 */
	public BasecampBuilder transport(@Nullable BasecampTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Add hooks. May be called repeatedly; hooks are chained in call order.
	 * @param hooks hooks to add
	 * @return this builder
	 */
	public BasecampBuilder hooks(BasecampHooks... hooks) {
		this.hooks.addAll(Arrays.asList(hooks));
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use
	 * {@link ObjectMapperFactory#create()})
	 * @return this builder
	 */
	public BasecampBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Replace the bundled behavior model.
	 * @param behaviorModel per-operation behavior (null to load {@code behavior-model.json})
	 * @return this builder
	 */
	public BasecampBuilder behaviorModel(@Nullable BehaviorModel behaviorModel) {
		this.behaviorModel = behaviorModel;
		return this;
	}

	/**
	 * Guard calls with a circuit breaker, bulkhead and rate limiter. Without this call the
	 * defaults apply only when {@link BasecampConfig#isResilienceEnabled()} is set.
	 * @param resilience guard settings (null to follow the configuration)
	 * @return this builder
	 */
	public BasecampBuilder resilience(@Nullable ResilienceConfig resilience) {
		this.resilience = resilience;
		return this;
	}

	/**
	 * Build the client.
	 * @return configured Basecamp client
	 * @throws IllegalStateException if zero or several auth sources were given
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} on invalid configuration
	 */
	public Basecamp build() {
		config.validate();
		AuthStrategy auth = resolveAuth();
		Components components = buildComponents(auth);
		return new Basecamp(config, components.client(), components.paginator(), components.hooks(),
				components.objectMapper(), components.cache());
	}

	private AuthStrategy resolveAuth() {
		int sources = (accessToken != null ? 1 : 0) + (tokenProvider != null ? 1 : 0) + (authStrategy != null ? 1 : 0);
		if (sources == 0) {
			throw new IllegalStateException(
					"Authentication is required. Call accessToken(), accessTokenFromEnv(), tokenProvider() or authStrategy() first.");
		}
		if (sources > 1) {
			throw new IllegalStateException("Only one of accessToken, tokenProvider or authStrategy may be set");
		}
		if (authStrategy != null) {
			return authStrategy;
		}
		if (tokenProvider != null) {
			return new BearerAuth(tokenProvider);
		}
		return new BearerAuth(new StaticTokenProvider(accessToken));
	}

	private Components buildComponents(AuthStrategy auth) {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		BasecampTransport httpTransport = this.transport != null ? this.transport
				: new JdkHttpTransport(config.getTimeout());
		BehaviorModel model = this.behaviorModel != null ? this.behaviorModel : BehaviorModel.loadDefault(mapper);
		ETagCache cache = config.isCacheEnabled() ? new ETagCache(config.getCacheMaxEntries()) : null;
		BasecampHooks chained = BasecampHooks.chain(hooks);

		HttpBasecampClient httpClient = new HttpBasecampClient(httpTransport, auth, config, cache, chained, mapper);
		BasecampClient client = RetryingBasecampClient.builder()
			.wrapping(httpClient)
			.authStrategy(auth)
			.behaviorModel(model)
			.defaultPolicy(config.defaultRetryPolicy())
			.enabled(config.isRetryEnabled())
			.hooks(chained)
			.build();
		ResilienceConfig guards = this.resilience != null ? this.resilience
				: config.isResilienceEnabled() ? ResilienceConfig.defaults() : null;
		if (guards != null) {
			client = ResilientBasecampClient.builder().wrapping(client).config(guards).build();
		}
		Paginator paginator = new Paginator(client, mapper, config.getMaxPages());

		return new Components(client, paginator, chained, mapper, cache);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(BasecampClient client, Paginator paginator, BasecampHooks hooks,
			ObjectMapper objectMapper, @Nullable ETagCache cache) {
	}

}
