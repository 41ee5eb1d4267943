package com.basecamp.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes SDK events to SLF4J: operations and requests at DEBUG, failures and retries at
 * WARN.
 */
public class LoggingHooks implements BasecampHooks {

	private static final Logger logger = LoggerFactory.getLogger(LoggingHooks.class);

	@Override
	public void onOperationStart(OperationInfo info) {
		logger.debug("-> {}.{}", info.service(), info.operation());
	}

	@Override
	public void onOperationEnd(OperationInfo info, OperationResult result) {
		if (result.isSuccess()) {
			logger.debug("<- {}.{} ({}ms)", info.service(), info.operation(), result.duration().toMillis());
		}
		else {
			logger.warn("<- {}.{} failed after {}ms: {}", info.service(), info.operation(),
					result.duration().toMillis(), result.error().getMessage());
		}
	}

	@Override
	public void onRequestStart(RequestInfo info) {
		logger.debug("-> {} {} (attempt {})", info.method(), info.uri(), info.attempt());
	}

	@Override
	public void onRequestEnd(RequestInfo info, RequestResult result) {
		logger.debug("<- {} {} {} ({}ms{})", info.method(), info.uri(), result.statusCode(),
				result.duration().toMillis(), result.fromCache() ? ", cached" : "");
	}

	@Override
	public void onRetry(RequestInfo info, int nextAttempt, BasecampException error, long delayMillis) {
		logger.warn("Retrying {} {} (attempt {}) in {}ms: {}", info.method(), info.uri(), nextAttempt, delayMillis,
				error.getMessage());
	}

}
