package com.basecamp.sdk.cli;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of parsing the command line. Unset options stay null so that configuration files
 * and environment variables apply.
 */
public class ParsedCommand {

	public String command = "help";

	@Nullable
	public String path;

	public boolean paginate = false;

	public int maxItems = 0;

	public int maxPages = 0;

	@Nullable
	public String accountId;

	@Nullable
	public String baseUrl;

	@Nullable
	public Boolean cache;

	@Nullable
	public Boolean retry;

	public boolean verbose = false;

	/**
	 * Options given on the command line, as config overrides.
	 * @return snake_case config keys mapped to values
	 */
	public Map<String, String> configOverrides() {
		Map<String, String> overrides = new LinkedHashMap<>();
		if (baseUrl != null) {
			overrides.put("base_url", baseUrl);
		}
		if (accountId != null) {
			overrides.put("account_id", accountId);
		}
		if (cache != null) {
			overrides.put("cache_enabled", cache.toString());
		}
		if (retry != null) {
			overrides.put("enable_retry", retry.toString());
		}
		if (maxPages > 0) {
			overrides.put("max_pages", Integer.toString(maxPages));
		}
		return overrides;
	}

}
