package com.basecamp.sdk;

/**
 * Hooks that ignore every event.
 */
public final class NoopHooks implements BasecampHooks {

	public static final NoopHooks INSTANCE = new NoopHooks();

	private NoopHooks() {
	}

}
