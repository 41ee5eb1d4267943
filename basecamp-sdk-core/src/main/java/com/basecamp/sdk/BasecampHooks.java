package com.basecamp.sdk;

import java.util.Arrays;
import java.util.List;

/**
 * Observer for SDK activity. Every method has a no-op default, so implementations
 * override only the events they need.
 *
 * <p>
 * Hooks never affect control flow. When installed through {@link #chain}, an exception
 * thrown by a hook is logged and discarded.
 */
public interface BasecampHooks {

	/**
	 * A service operation (one logical call, possibly spanning retries and pages) starts.
	 */
	default void onOperationStart(OperationInfo info) {
	}

	default void onOperationEnd(OperationInfo info, OperationResult result) {
	}

	/**
	 * One HTTP attempt is about to be sent.
	 */
	default void onRequestStart(RequestInfo info) {
	}

	default void onRequestEnd(RequestInfo info, RequestResult result) {
	}

	/**
	 * A failed attempt will be retried after {@code delayMillis}. Not called after the
	 * final attempt.
	 * @param info the attempt that failed
	 * @param nextAttempt number of the attempt about to be made
	 * @param error the failure
	 * @param delayMillis wait before the next attempt
	 */
	default void onRetry(RequestInfo info, int nextAttempt, BasecampException error, long delayMillis) {
	}

	static BasecampHooks noop() {
		return NoopHooks.INSTANCE;
	}

	/**
	 * Combine hooks. No-op hooks are dropped; the result isolates failures of each
	 * delegate.
	 * @param hooks hooks to combine, in start-event order
	 * @return a {@link ChainHooks}, or the no-op hooks if nothing remains
	 */
	static BasecampHooks chain(BasecampHooks... hooks) {
		return chain(Arrays.asList(hooks));
	}

	static BasecampHooks chain(List<BasecampHooks> hooks) {
		List<BasecampHooks> active = hooks.stream().filter(h -> !(h instanceof NoopHooks)).toList();
		if (active.isEmpty()) {
			return noop();
		}
		return new ChainHooks(active);
	}

}
