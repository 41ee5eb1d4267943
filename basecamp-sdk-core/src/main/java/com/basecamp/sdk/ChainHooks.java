package com.basecamp.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans events out to several hooks. Start events go out in registration order and end
 * events in reverse order, so the first hook's start/end pair wraps all the others. An
 * exception from one hook is logged and does not reach the other hooks or the caller.
 */
public final class ChainHooks implements BasecampHooks {

	private static final Logger logger = LoggerFactory.getLogger(ChainHooks.class);

	private final List<BasecampHooks> hooks;

	public ChainHooks(List<BasecampHooks> hooks) {
		this.hooks = List.copyOf(hooks);
	}

	@Override
	public void onOperationStart(OperationInfo info) {
		forward("onOperationStart", hook -> hook.onOperationStart(info));
	}

	@Override
	public void onOperationEnd(OperationInfo info, OperationResult result) {
		reverse("onOperationEnd", hook -> hook.onOperationEnd(info, result));
	}

	@Override
	public void onRequestStart(RequestInfo info) {
		forward("onRequestStart", hook -> hook.onRequestStart(info));
	}

	@Override
	public void onRequestEnd(RequestInfo info, RequestResult result) {
		reverse("onRequestEnd", hook -> hook.onRequestEnd(info, result));
	}

	@Override
	public void onRetry(RequestInfo info, int nextAttempt, BasecampException error, long delayMillis) {
		forward("onRetry", hook -> hook.onRetry(info, nextAttempt, error, delayMillis));
	}

	public List<BasecampHooks> hooks() {
		return hooks;
	}

	private void forward(String event, Consumer<BasecampHooks> call) {
		for (BasecampHooks hook : hooks) {
			invoke(event, hook, call);
		}
	}

	private void reverse(String event, Consumer<BasecampHooks> call) {
		for (int i = hooks.size() - 1; i >= 0; i--) {
			invoke(event, hooks.get(i), call);
		}
	}

	private static void invoke(String event, BasecampHooks hook, Consumer<BasecampHooks> call) {
		try {
			call.accept(hook);
		}
		catch (RuntimeException e) {
			logger.warn("Hook {}.{} failed: {}", hook.getClass().getSimpleName(), event, e.toString());
		}
	}

}
