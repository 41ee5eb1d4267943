package com.basecamp.sdk.cli;

import com.basecamp.sdk.BasecampException;
import com.basecamp.sdk.BasecampHooks;
import com.basecamp.sdk.RequestInfo;
import com.basecamp.sdk.RequestResult;

import java.io.PrintStream;

/**
 * Prints one line per HTTP attempt and retry to stderr for {@code --verbose}.
 */
class VerboseHooks implements BasecampHooks {

	private final PrintStream err;

	VerboseHooks(PrintStream err) {
		this.err = err;
	}

	@Override
	public void onRequestEnd(RequestInfo info, RequestResult result) {
		err.printf("%s %s -> %d (%dms%s)%n", info.method(), info.uri(), result.statusCode(),
				result.duration().toMillis(), result.fromCache() ? ", cached" : "");
	}

	@Override
	public void onRetry(RequestInfo info, int nextAttempt, BasecampException error, long delayMillis) {
		err.printf("retrying %s %s in %dms (attempt %d): %s%n", info.method(), info.uri(), delayMillis, nextAttempt,
				error.getMessage());
	}

}
