package com.basecamp.sdk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BasecampException Tests")
class BasecampExceptionTest {

	@Nested
	@DisplayName("HTTP Status Classification")
	class StatusClassificationTest {

		@ParameterizedTest(name = "HTTP {0} -> {1}")
		@CsvSource({ "400, VALIDATION, false", "422, VALIDATION, false", "401, AUTH, false", "403, FORBIDDEN, false",
				"404, NOT_FOUND, false", "429, RATE_LIMIT, true", "500, API, true", "502, API, true",
				"503, API, true", "504, API, true", "418, API, false" })
		void shouldClassifyStatus(int status, ErrorKind kind, boolean retryable) {
			BasecampException e = BasecampException.fromHttpStatus(status, null, null, null, null, false);

			assertThat(e.getKind()).isEqualTo(kind);
			assertThat(e.isRetryable()).isEqualTo(retryable);
			assertThat(e.getHttpStatus()).isEqualTo(status);
		}

		@Test
		@DisplayName("Should carry Retry-After on rate limits")
		void shouldCarryRetryAfter() {
			BasecampException e = BasecampException.fromHttpStatus(429, null, null, 30L, "req-1", false);

			assertThat(e.getRetryAfterSeconds()).isEqualTo(30L);
			assertThat(e.getRequestId()).isEqualTo("req-1");
		}

		@Test
		@DisplayName("Should describe insufficient scope for forbidden mutations")
		void shouldDescribeInsufficientScope() {
			BasecampException e = BasecampException.fromHttpStatus(403, null, null, null, null, true);

			assertThat(e.getMessage()).isEqualTo("Access denied: insufficient scope");
			assertThat(e.getHint()).isEqualTo("Re-authenticate with write access");
		}

		@Test
		@DisplayName("Should use body message and default hint on 401")
		void shouldUseBodyMessage() {
			BasecampException e = BasecampException.fromHttpStatus(401, "Token expired", null, null, null, false);

			assertThat(e.getMessage()).isEqualTo("Token expired");
			assertThat(e.getHint()).isNotBlank();
		}

		@Test
		@DisplayName("Should default the message for unexpected statuses")
		void shouldDefaultMessage() {
			assertThat(BasecampException.fromHttpStatus(502, " ", null, null, null, false).getMessage())
				.isEqualTo("Request failed (HTTP 502)");
		}

	}

	@Test
	@DisplayName("Should truncate long body messages to 500 characters")
	void shouldTruncateLongMessages() {
		String longMessage = "x".repeat(600);

		BasecampException e = BasecampException.fromHttpStatus(500, longMessage, null, null, null, false);

		assertThat(e.getMessage()).hasSize(500).endsWith("...");
		assertThat(BasecampException.truncateMessage("short")).isEqualTo("short");
	}

	@Test
	@DisplayName("Should truncate multibyte messages to 500 UTF-8 bytes")
	void shouldTruncateOnUtf8Bytes() {
		String accented = "\u00e9".repeat(300);
		String emoji = "\uD83D\uDE00".repeat(200);

		String cutAccented = BasecampException.truncateMessage(accented);
		String cutEmoji = BasecampException.truncateMessage(emoji);

		assertThat(cutAccented.getBytes(StandardCharsets.UTF_8)).hasSize(499);
		assertThat(cutAccented).isEqualTo("\u00e9".repeat(248) + "...");
		assertThat(cutEmoji.getBytes(StandardCharsets.UTF_8)).hasSize(499);
		assertThat(cutEmoji).isEqualTo("\uD83D\uDE00".repeat(124) + "...");
		assertThat(BasecampException.truncateMessage("\u00e9".repeat(250))).isEqualTo("\u00e9".repeat(250));
	}

	@ParameterizedTest(name = "{0} exits with {1}")
	@DisplayName("Should map kinds to exit codes")
	@CsvSource({ "USAGE, 1", "NOT_FOUND, 2", "AUTH, 3", "FORBIDDEN, 4", "RATE_LIMIT, 5", "NETWORK, 6", "API, 7",
			"VALIDATION, 1", "AMBIGUOUS, 8" })
	void shouldMapExitCodes(ErrorKind kind, int exitCode) {
		assertThat(new BasecampException(kind, "failed").exitCode()).isEqualTo(exitCode);
	}

	@Test
	@DisplayName("Should join message and hint for display")
	void shouldJoinMessageAndHint() {
		assertThat(BasecampException.usage("Account ID is required", "Pass --account").getDisplayMessage())
			.isEqualTo("Account ID is required: Pass --account");
		assertThat(BasecampException.usage("Bad flag").getDisplayMessage()).isEqualTo("Bad flag");
	}

	@Nested
	@DisplayName("Factory Tests")
	class FactoryTest {

		@Test
		@DisplayName("Network errors should be retryable and keep their cause")
		void networkShouldBeRetryable() {
			IOException cause = new IOException("connection reset");

			BasecampException e = BasecampException.network("Network error", cause);

			assertThat(e.getKind()).isEqualTo(ErrorKind.NETWORK);
			assertThat(e.isRetryable()).isTrue();
			assertThat(e).hasCause(cause);
		}

		@Test
		@DisplayName("Interruption should not be retryable")
		void interruptionShouldNotBeRetryable() {
			BasecampException e = BasecampException.interrupted(new InterruptedException());

			assertThat(e.getKind()).isEqualTo(ErrorKind.NETWORK);
			assertThat(e.isRetryable()).isFalse();
		}

		@Test
		@DisplayName("Ambiguous errors should suggest a few matches")
		void ambiguousShouldSuggestMatches() {
			assertThat(BasecampException.ambiguous("project", List.of("Alpha", "Alpine")).getHint())
				.isEqualTo("Did you mean: Alpha, Alpine");
			assertThat(BasecampException.ambiguous("project", List.of("a", "b", "c", "d", "e", "f")).getHint())
				.isEqualTo("Be more specific");
		}

		@Test
		@DisplayName("Not found should name the resource")
		void notFoundShouldNameResource() {
			BasecampException e = BasecampException.notFound("Project", "42");

			assertThat(e.getMessage()).isEqualTo("Project not found: 42");
			assertThat(e.exitCode()).isEqualTo(2);
		}

	}

}
