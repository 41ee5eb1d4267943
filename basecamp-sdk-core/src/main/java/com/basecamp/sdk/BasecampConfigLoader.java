package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds a {@link BasecampConfig} from layered sources. Later layers win:
 * <ol>
 * <li>built-in defaults</li>
 * <li>global file: {@code $XDG_CONFIG_HOME/basecamp/config.json}, or
 * {@code ~/.config/basecamp/config.json}</li>
 * <li>local file: {@code .basecamp/config.json} in the working directory</li>
 * <li>{@code BASECAMP_*} environment variables (see {@link EnvironmentSupport})</li>
 * <li>explicit overrides, typically command-line flags</li>
 * </ol>
 *
 * <p>
 * Files use the snake_case keys listed in {@link #KEYS}. The layer each value came from
 * is available from {@link #sources()} after loading.
 */
public class BasecampConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(BasecampConfigLoader.class);

	public static final String CONFIG_FILE = "config.json";

	public static final List<String> KEYS = List.of("base_url", "account_id", "user_agent", "timeout_seconds",
			"cache_enabled", "cache_max_entries", "enable_retry", "max_retries", "base_delay_ms", "max_jitter_ms",
			"max_pages", "retry_server_errors", "resilience_enabled");

	private final ObjectMapper objectMapper;

	private final Function<String, @Nullable String> environment;

	@Nullable
	private final Path globalFile;

	@Nullable
	private final Path localFile;

	private final Map<String, String> sources = new LinkedHashMap<>();

	public BasecampConfigLoader(ObjectMapper objectMapper) {
		this(objectMapper, EnvironmentSupport::get, globalConfigDirectory().resolve(CONFIG_FILE),
				Paths.get(".basecamp", CONFIG_FILE));
	}

	public BasecampConfigLoader(ObjectMapper objectMapper, Function<String, @Nullable String> environment,
			@Nullable Path globalFile, @Nullable Path localFile) {
		this.objectMapper = objectMapper;
		this.environment = environment;
		this.globalFile = globalFile;
		this.localFile = localFile;
	}

	/**
	 * Directory holding the global config file and stored credentials.
	 * @return {@code $XDG_CONFIG_HOME/basecamp} or {@code ~/.config/basecamp}
	 */
	public static Path globalConfigDirectory() {
		String xdg = System.getenv("XDG_CONFIG_HOME");
		if (xdg != null && !xdg.isBlank()) {
			return Paths.get(xdg, "basecamp");
		}
		return Paths.get(System.getProperty("user.home"), ".config", "basecamp");
	}

	public BasecampConfig load() {
		return load(Map.of());
	}

	/**
	 * Load all layers.
	 * @param overrides highest-precedence values keyed like the config file
	 * @return validated configuration
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} on unknown keys,
	 * unparseable values or an unreadable config file
	 */
	public BasecampConfig load(Map<String, String> overrides) {
		BasecampConfig config = new BasecampConfig();
		sources.clear();
		KEYS.forEach(key -> sources.put(key, "default"));

		applyFile(config, globalFile, "global");
		applyFile(config, localFile, "local");

		for (String key : KEYS) {
			String value = environment.apply(EnvironmentSupport.variableFor(key));
			if (value != null) {
				apply(config, key, value, "env");
			}
		}

		overrides.forEach((key, value) -> apply(config, key, value, "flag"));

		config.validate();
		return config;
	}

	/**
	 * Layer each setting was taken from: {@code default}, {@code global}, {@code local},
	 * {@code env} or {@code flag}.
	 */
	public Map<String, String> sources() {
		return Collections.unmodifiableMap(sources);
	}

	private void applyFile(BasecampConfig config, @Nullable Path file, String source) {
		if (file == null || !Files.isRegularFile(file)) {
			return;
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(file.toFile());
		}
		catch (IOException e) {
			throw new BasecampException(ErrorKind.USAGE, "Invalid config file: " + file, e.getMessage(), null, false,
					null, null, e);
		}
		if (root == null || !root.isObject()) {
			throw BasecampException.usage("Invalid config file: " + file, "Expected a JSON object");
		}
		logger.debug("Loading {} config from {}", source, file);
		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!KEYS.contains(field.getKey())) {
				logger.debug("Ignoring unknown config key '{}' in {}", field.getKey(), file);
				continue;
			}
			if (!field.getValue().isNull()) {
				apply(config, field.getKey(), field.getValue().asText(), source);
			}
		}
	}

	private void apply(BasecampConfig config, String key, String value, String source) {
		switch (key) {
			case "base_url" -> config.setBaseUrl(value.trim());
			case "account_id" -> config.setAccountId(value.trim());
			case "user_agent" -> config.setUserAgent(value.trim());
			case "timeout_seconds" -> config.setTimeout(Duration.ofSeconds(parseLong(key, value)));
			case "cache_enabled" -> config.setCacheEnabled(parseBoolean(key, value));
			case "cache_max_entries" -> config.setCacheMaxEntries((int) parseLong(key, value));
			case "enable_retry" -> config.setRetryEnabled(parseBoolean(key, value));
			case "max_retries" -> config.setMaxRetries((int) parseLong(key, value));
			case "base_delay_ms" -> config.setBaseDelayMs(parseLong(key, value));
			case "max_jitter_ms" -> config.setMaxJitterMs(parseLong(key, value));
			case "max_pages" -> config.setMaxPages((int) parseLong(key, value));
			case "retry_server_errors" -> config.setRetryServerErrors(parseBoolean(key, value));
			case "resilience_enabled" -> config.setResilienceEnabled(parseBoolean(key, value));
			default -> throw BasecampException.usage("Unknown config key: " + key,
					"Valid keys: " + String.join(", ", KEYS));
		}
		sources.put(key, source);
	}

	private static long parseLong(String key, String value) {
		try {
			return Long.parseLong(value.trim());
		}
		catch (NumberFormatException e) {
			throw BasecampException.usage("Invalid value for " + key + ": '" + value + "'", "Expected an integer");
		}
	}

	private static boolean parseBoolean(String key, String value) {
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "true", "1", "yes", "on" -> true;
			case "false", "0", "no", "off" -> false;
			default -> throw BasecampException.usage("Invalid value for " + key + ": '" + value + "'",
					"Expected true or false");
		};
	}

}
