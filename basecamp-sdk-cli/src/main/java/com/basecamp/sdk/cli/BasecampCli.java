package com.basecamp.sdk.cli;

import com.basecamp.sdk.AccountClient;
import com.basecamp.sdk.ApiResponse;
import com.basecamp.sdk.Basecamp;
import com.basecamp.sdk.BasecampBuilder;
import com.basecamp.sdk.BasecampConfig;
import com.basecamp.sdk.BasecampConfigLoader;
import com.basecamp.sdk.BasecampException;
import com.basecamp.sdk.EnvironmentSupport;
import com.basecamp.sdk.ErrorKind;
import com.basecamp.sdk.ListResult;
import com.basecamp.sdk.ObjectMapperFactory;
import com.basecamp.sdk.PaginationOptions;
import com.basecamp.sdk.Project;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Basecamp CLI
 *
 * Plain Java command-line client for the Basecamp API. Every request goes through the
 * SDK pipeline (auth, cache, retry, pagination) and failures map to stable exit codes.
 *
 * Usage: java -jar basecamp-sdk-cli.jar <command> [OPTIONS]
 *
 * Environment Variables: BASECAMP_TOKEN - access token, BASECAMP_ACCOUNT_ID - default
 * account
 *
 * Examples: java -jar basecamp-sdk-cli.jar get /projects.json --paginate java -jar
 * basecamp-sdk-cli.jar projects --account 999 --max-items 20
 */
public class BasecampCli {

	private static final Logger logger = LoggerFactory.getLogger(BasecampCli.class);

	private final PrintStream out;

	private final PrintStream err;

	private final Function<String, @Nullable String> environment;

	private final BasecampConfigLoader configLoader;

	private final ObjectMapper objectMapper;

	public BasecampCli(PrintStream out, PrintStream err, Function<String, @Nullable String> environment,
			BasecampConfigLoader configLoader) {
		this.out = out;
		this.err = err;
		this.environment = environment;
		this.configLoader = configLoader;
		this.objectMapper = ObjectMapperFactory.create().enable(SerializationFeature.INDENT_OUTPUT);
	}

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Command failed: {}", e.getMessage());
			System.exit(ErrorKind.API.exitCode());
		}
	}

	public static int run(String[] args) {
		ObjectMapper mapper = ObjectMapperFactory.create();
		return new BasecampCli(System.out, System.err, EnvironmentSupport::get, new BasecampConfigLoader(mapper))
			.execute(args);
	}

	/**
	 * Run one command.
	 * @param args command-line arguments
	 * @return process exit code
	 */
	public int execute(String[] args) {
		CommandLineParser parser = new CommandLineParser();
		ParsedCommand command;
		try {
			command = parser.parse(args);
		}
		catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			err.println("Run with --help for usage.");
			return ErrorKind.USAGE.exitCode();
		}

		try {
			switch (command.command) {
				case "get":
					return get(command);
				case "projects":
					return projects(command);
				case "config":
					return showConfig(command);
				default:
					out.print(parser.generateHelpText());
					return 0;
			}
		}
		catch (BasecampException e) {
			logger.debug("Command failed with {}", e.getKind(), e);
			err.println("Error: " + e.getDisplayMessage());
			return e.exitCode();
		}
	}

	private int get(ParsedCommand command) {
		AccountClient account = connect(command);
		String path = Objects.requireNonNull(command.path);
		if (command.paginate) {
			ListResult<JsonNode> items = account.getAll(path, paginationOptions(command));
			print(items);
			reportList(items);
		}
		else {
			ApiResponse response = account.get(path);
			printBody(response);
		}
		return 0;
	}

	private int projects(ParsedCommand command) {
		AccountClient account = connect(command);
		ListResult<Project> projects = account.projects().list(null, paginationOptions(command));
		print(projects);
		reportList(projects);
		return 0;
	}

	private int showConfig(ParsedCommand command) {
		BasecampConfig config = configLoader.load(command.configOverrides());
		Map<String, String> sources = configLoader.sources();
		describe(config).forEach((key, value) -> out.printf("%s = %s (%s)%n", key, value, sources.get(key)));
		return 0;
	}

	private AccountClient connect(ParsedCommand command) {
		BasecampConfig config = configLoader.load(command.configOverrides());
		String accountId = config.getAccountId();
		if (accountId == null) {
			throw BasecampException.usage("Account ID is required", "Pass --account or set BASECAMP_ACCOUNT_ID");
		}
		String token = environment.apply(BasecampBuilder.TOKEN_VARIABLE);
		if (token == null) {
			throw BasecampException.auth("Not authenticated", "Set " + BasecampBuilder.TOKEN_VARIABLE);
		}

		BasecampBuilder builder = BasecampBuilder.create().accessToken(token).config(config);
		if (command.verbose) {
			builder.hooks(new VerboseHooks(err));
		}
		Basecamp basecamp = builder.build();
		logger.debug("Using {} for account {}", config.getBaseUrl(), accountId);
		return basecamp.forAccount(accountId);
	}

	private static PaginationOptions paginationOptions(ParsedCommand command) {
		return new PaginationOptions(command.maxItems, command.maxPages);
	}

	private void reportList(ListResult<?> items) {
		if (items.isTruncated()) {
			err.printf("Showing %d of %s items (truncated)%n", items.size(),
					items.totalCount() > 0 ? Long.toString(items.totalCount()) : "more");
		}
	}

	private void printBody(ApiResponse response) {
		if (!response.hasBody()) {
			return;
		}
		String body = response.bodyAsString();
		try {
			print(objectMapper.readTree(body));
		}
		catch (JsonProcessingException e) {
			out.println(body);
		}
	}

	private void print(Object value) {
		try {
			out.println(objectMapper.writeValueAsString(value));
		}
		catch (JsonProcessingException e) {
			throw BasecampException.api("Failed to render response: " + e.getMessage(), e);
		}
	}

	private static Map<String, Object> describe(BasecampConfig config) {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("base_url", config.getBaseUrl());
		values.put("account_id", config.getAccountId() != null ? config.getAccountId() : "");
		values.put("user_agent", config.getUserAgent());
		values.put("timeout_seconds", config.getTimeout().toSeconds());
		values.put("cache_enabled", config.isCacheEnabled());
		values.put("cache_max_entries", config.getCacheMaxEntries());
		values.put("enable_retry", config.isRetryEnabled());
		values.put("max_retries", config.getMaxRetries());
		values.put("base_delay_ms", config.getBaseDelayMs());
		values.put("max_jitter_ms", config.getMaxJitterMs());
		values.put("max_pages", config.getMaxPages());
		values.put("retry_server_errors", config.isRetryServerErrors());
		values.put("resilience_enabled", config.isResilienceEnabled());
		return values;
	}

}
