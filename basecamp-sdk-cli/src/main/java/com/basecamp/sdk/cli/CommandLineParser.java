package com.basecamp.sdk.cli;

import java.util.List;

/**
 * Command-line argument parser. Plain Java with no framework, for testability.
 */
public class CommandLineParser {

	static final List<String> COMMANDS = List.of("get", "projects", "config", "help");

	/**
	 * Parse command-line arguments.
	 * @param args command-line arguments
	 * @return parsed command
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedCommand parse(String[] args) {
		ParsedCommand parsed = new ParsedCommand();
		boolean commandSeen = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-a", "--account":
					parsed.accountId = getRequiredValue(args, i, "account");
					i++;
					break;

				case "--base-url":
					parsed.baseUrl = getRequiredValue(args, i, "base-url");
					i++;
					break;

				case "-p", "--paginate":
					parsed.paginate = true;
					break;

				case "--max-items":
					parsed.maxItems = parsePositive(getRequiredValue(args, i, "max-items"), "max items");
					i++;
					break;

				case "--max-pages":
					parsed.maxPages = parsePositive(getRequiredValue(args, i, "max-pages"), "max pages");
					i++;
					break;

				case "--cache":
					parsed.cache = true;
					break;

				case "--no-cache":
					parsed.cache = false;
					break;

				case "--no-retry":
					parsed.retry = false;
					break;

				case "-v", "--verbose":
					parsed.verbose = true;
					break;

				case "-h", "--help":
					parsed.command = "help";
					return parsed;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (!commandSeen) {
						if (!COMMANDS.contains(arg)) {
							throw new IllegalArgumentException(
									"Unknown command '" + arg + "': must be one of " + String.join(", ", COMMANDS));
						}
						parsed.command = arg;
						commandSeen = true;
					}
					else if (parsed.path == null) {
						parsed.path = arg;
					}
					else {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		if (parsed.command.equals("get") && parsed.path == null) {
			throw new IllegalArgumentException("The get command requires a path, e.g. get /projects.json");
		}
		return parsed;
	}

	/**
	 * Generate help text.
	 * @return usage text
	 */
	public String generateHelpText() {
		return """
				Usage: basecamp <command> [options]

				Commands:
				  get <path>          GET an account-relative path and print the JSON body
				  projects            List projects
				  config              Show the effective configuration and where each value came from
				  help                Show this help

				Options:
				  -a, --account ID    Account ID (default: BASECAMP_ACCOUNT_ID)
				  -p, --paginate      Follow Link headers and print all items
				      --max-items N   Stop after N items
				      --max-pages N   Stop after N pages
				      --base-url URL  API base URL (default: https://3.basecampapi.com)
				      --cache         Enable the ETag cache
				      --no-cache      Disable the ETag cache
				      --no-retry      Send each request once
				  -v, --verbose       Print each HTTP request to stderr
				  -h, --help          Show this help

				Environment:
				  BASECAMP_TOKEN      Access token (required for get and projects)
				  BASECAMP_*          Any config key, e.g. BASECAMP_MAX_PAGES

				Exit codes:
				  0 success, 1 usage or validation, 2 not found, 3 auth, 4 forbidden,
				  5 rate limited, 6 network, 7 API error, 8 ambiguous
				""";
	}

	private static String getRequiredValue(String[] args, int index, String option) {
		if (index + 1 >= args.length || args[index + 1].startsWith("-")) {
			throw new IllegalArgumentException("Option --" + option + " requires a value");
		}
		return args[index + 1];
	}

	private static int parsePositive(String value, String name) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

}
