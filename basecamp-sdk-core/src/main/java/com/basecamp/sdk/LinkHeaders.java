package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsing helpers for the response headers the pipeline acts on: {@code Link},
 * {@code X-Total-Count} and {@code Retry-After}, plus the same-origin check used before
 * following a pagination link.
 */
public final class LinkHeaders {

	private LinkHeaders() {
	}

	/**
	 * Extract the {@code rel="next"} target from an RFC 5988 {@code Link} header.
	 *
	 * <p>
	 * The {@code rel} parameter is matched case-insensitively, may be unquoted and may
	 * list several space-separated relation types.
	 * @param header header value, or null
	 * @return the next URL as written by the server (possibly relative)
	 */
	public static Optional<String> parseNextLink(@Nullable String header) {
		if (header == null || header.isBlank()) {
			return Optional.empty();
		}
		for (String part : splitLinks(header)) {
			int open = part.indexOf('<');
			int close = part.indexOf('>', open + 1);
			if (open < 0 || close < 0) {
				continue;
			}
			String target = part.substring(open + 1, close).trim();
			for (String param : part.substring(close + 1).split(";")) {
				int eq = param.indexOf('=');
				if (eq < 0) {
					continue;
				}
				String name = param.substring(0, eq).trim();
				if (!name.equalsIgnoreCase("rel")) {
					continue;
				}
				String value = unquote(param.substring(eq + 1).trim());
				for (String rel : value.split("\\s+")) {
					if (rel.equalsIgnoreCase("next") && !target.isEmpty()) {
						return Optional.of(target);
					}
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolve a possibly relative link against the URL of the page that returned it.
	 */
	public static URI resolve(URI base, String link) {
		return base.resolve(link.trim());
	}

	/**
	 * Compare scheme, host and port. Hosts compare case-insensitively and an explicit
	 * default port (80 for http, 443 for https) equals the absent port.
	 * @param a first URI
	 * @param b second URI
	 * @return true if both URIs share an origin
	 */
	public static boolean isSameOrigin(URI a, URI b) {
		if (a.getScheme() == null || b.getScheme() == null || a.getHost() == null || b.getHost() == null) {
			return false;
		}
		return a.getScheme().equalsIgnoreCase(b.getScheme()) && a.getHost().equalsIgnoreCase(b.getHost())
				&& effectivePort(a) == effectivePort(b);
	}

	/**
	 * Parse {@code X-Total-Count}. Absent or unparseable values yield 0.
	 */
	public static long parseTotalCount(@Nullable String header) {
		if (header == null) {
			return 0;
		}
		try {
			long value = Long.parseLong(header.trim());
			return Math.max(0, value);
		}
		catch (NumberFormatException e) {
			return 0;
		}
	}

	/**
	 * Parse {@code Retry-After} as delta seconds or as an HTTP-date.
	 * @param header header value, or null
	 * @param clock clock used to convert a date into seconds from now
	 * @return positive number of seconds, or null when absent, unparseable or not in the
	 * future
	 */
	@Nullable
	public static Long parseRetryAfter(@Nullable String header, Clock clock) {
		if (header == null || header.isBlank()) {
			return null;
		}
		String value = header.trim();
		if (value.matches("-?\\d+")) {
			try {
				long seconds = Long.parseLong(value);
				return seconds > 0 ? seconds : null;
			}
			catch (NumberFormatException e) {
				return null;
			}
		}
		try {
			ZonedDateTime date = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
			long millis = Duration.between(clock.instant(), date.toInstant()).toMillis();
			if (millis <= 0) {
				return null;
			}
			return (millis + 999) / 1000;
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

	private static int effectivePort(URI uri) {
		if (uri.getPort() != -1) {
			return uri.getPort();
		}
		String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		return switch (scheme) {
			case "http" -> 80;
			case "https" -> 443;
			default -> -1;
		};
	}

	// Split on commas that are not inside <...>
	private static List<String> splitLinks(String header) {
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < header.length(); i++) {
			char c = header.charAt(i);
			if (c == '<') {
				depth++;
			}
			else if (c == '>') {
				depth = Math.max(0, depth - 1);
			}
			else if (c == ',' && depth == 0) {
				parts.add(header.substring(start, i));
				start = i + 1;
			}
		}
		parts.add(header.substring(start));
		return parts;
	}

	private static String unquote(String value) {
		if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
			return value.substring(1, value.length() - 1).trim();
		}
		return value;
	}

}
