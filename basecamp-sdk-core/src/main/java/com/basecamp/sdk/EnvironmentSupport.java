package com.basecamp.sdk;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Resolves {@code BASECAMP_*} settings from the environment. {@code .env} files are
 * loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the current working directory</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Prefix shared by all SDK environment variables.
	 */
	public static final String PREFIX = "BASECAMP_";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name, e.g. {@code BASECAMP_TOKEN}
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

	/**
	 * Map a config key to its environment variable name: {@code max_pages} becomes
	 * {@code BASECAMP_MAX_PAGES}.
	 */
	public static String variableFor(String configKey) {
		return PREFIX + configKey.toUpperCase(Locale.ROOT);
	}

}
