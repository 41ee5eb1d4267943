package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration for a {@link Basecamp} client.
 *
 * <p>
 * Values can be set directly via setters, loaded in layers by
 * {@link BasecampConfigLoader}, or left at their defaults, which suit most callers.
 */
public class BasecampConfig {

	public static final String DEFAULT_BASE_URL = "https://3.basecampapi.com";

	public static final String VERSION = "0.1.0";

	public static final String DEFAULT_USER_AGENT = "basecamp-sdk-java/" + VERSION;

	/**
	 * API base URL. Must use HTTPS unless it points at localhost.
	 */
	private String baseUrl = DEFAULT_BASE_URL;

	/**
	 * Default account ID for command-line use.
	 */
	@Nullable
	private String accountId;

	/**
	 * Value of the {@code User-Agent} header.
	 */
	private String userAgent = DEFAULT_USER_AGENT;

	/**
	 * Connect and request timeout.
	 */
	private Duration timeout = Duration.ofSeconds(30);

	/**
	 * Enable the ETag cache for GET requests.
	 */
	private boolean cacheEnabled = false;

	/**
	 * Maximum number of cached responses.
	 */
	private int cacheMaxEntries = ETagCache.DEFAULT_MAX_ENTRIES;

	/**
	 * Retry failed requests. When false every request is sent once.
	 */
	private boolean retryEnabled = true;

	/**
	 * Attempts per request for operations without their own retry policy.
	 */
	private int maxRetries = 3;

	/**
	 * Base delay for exponential backoff, in milliseconds.
	 */
	private long baseDelayMs = 1000;

	/**
	 * Upper bound of the random jitter added to each backoff delay, in milliseconds.
	 */
	private long maxJitterMs = 100;

	/**
	 * Maximum number of pages fetched by one paginated call.
	 */
	private int maxPages = 10_000;

	/**
	 * Also retry 500 Internal Server Error for operations using the default policy.
	 */
	private boolean retryServerErrors = false;

	/**
	 * Guard calls with the default circuit breaker, bulkhead and rate limiter.
	 */
	private boolean resilienceEnabled = false;

	public String getBaseUrl() {
		return baseUrl;
	}

	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	@Nullable
	public String getAccountId() {
		return accountId;
	}

	public void setAccountId(@Nullable String accountId) {
		this.accountId = accountId;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public Duration getTimeout() {
		return timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = timeout;
	}

	public boolean isCacheEnabled() {
		return cacheEnabled;
	}

	public void setCacheEnabled(boolean cacheEnabled) {
		this.cacheEnabled = cacheEnabled;
	}

	public int getCacheMaxEntries() {
		return cacheMaxEntries;
	}

	public void setCacheMaxEntries(int cacheMaxEntries) {
		this.cacheMaxEntries = cacheMaxEntries;
	}

	public boolean isRetryEnabled() {
		return retryEnabled;
	}

	public void setRetryEnabled(boolean retryEnabled) {
		this.retryEnabled = retryEnabled;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getBaseDelayMs() {
		return baseDelayMs;
	}

	public void setBaseDelayMs(long baseDelayMs) {
		this.baseDelayMs = baseDelayMs;
	}

	public long getMaxJitterMs() {
		return maxJitterMs;
	}

	public void setMaxJitterMs(long maxJitterMs) {
		this.maxJitterMs = maxJitterMs;
	}

	public int getMaxPages() {
		return maxPages;
	}

	public void setMaxPages(int maxPages) {
		this.maxPages = maxPages;
	}

	public boolean isRetryServerErrors() {
		return retryServerErrors;
	}

	public void setRetryServerErrors(boolean retryServerErrors) {
		this.retryServerErrors = retryServerErrors;
	}

	public boolean isResilienceEnabled() {
		return resilienceEnabled;
	}

	public void setResilienceEnabled(boolean resilienceEnabled) {
		this.resilienceEnabled = resilienceEnabled;
	}

	/**
	 * The retry policy applied to GET and idempotent operations that carry no policy of
	 * their own.
	 * @return policy derived from these settings
	 */
	public RetryPolicy defaultRetryPolicy() {
		Set<Integer> retryOn = new LinkedHashSet<>(RetryPolicy.DEFAULT_RETRY_ON);
		if (retryServerErrors) {
			retryOn.add(500);
		}
		return new RetryPolicy(maxRetries, baseDelayMs, RetryPolicy.Backoff.EXPONENTIAL, retryOn, maxJitterMs);
	}

	/**
	 * Check the settings.
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} on invalid values
	 */
	public void validate() {
		URI uri;
		try {
			uri = URI.create(baseUrl);
		}
		catch (IllegalArgumentException e) {
			throw BasecampException.usage("Invalid base URL: " + baseUrl);
		}
		requireSecure(uri, "base URL");
		if (cacheMaxEntries < 1) {
			throw BasecampException.usage("cache_max_entries must be positive: " + cacheMaxEntries);
		}
		if (maxPages < 1) {
			throw BasecampException.usage("max_pages must be positive: " + maxPages);
		}
		if (timeout.isNegative() || timeout.isZero()) {
			throw BasecampException.usage("timeout must be positive: " + timeout);
		}
		if (accountId != null && !isNumeric(accountId)) {
			throw BasecampException.usage("Account ID must be numeric: " + accountId);
		}
	}

	/**
	 * Reject plain-HTTP URLs except for local development hosts, so tokens are never sent
	 * in clear text.
	 * @param uri URL to check
	 * @param what description used in the error message
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} if the URL is not secure
	 */
	public static void requireSecure(URI uri, String what) {
		String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
		if (scheme.equals("https")) {
			return;
		}
		if (scheme.equals("http") && isLocalhost(uri.getHost())) {
			return;
		}
		throw BasecampException.usage("The " + what + " must use HTTPS: " + uri,
				"Use an https:// URL (plain http is allowed only for localhost)");
	}

	static boolean isLocalhost(@Nullable String host) {
		if (host == null) {
			return false;
		}
		String h = host.toLowerCase(Locale.ROOT);
		return h.equals("localhost") || h.equals("127.0.0.1") || h.equals("[::1]") || h.equals("::1")
				|| h.endsWith(".localhost");
	}

	static boolean isNumeric(String value) {
		return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
	}

}
