package com.basecamp.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Collaborators shared by the services of one account.
 *
 * @param client request pipeline
 * @param paginator paginator over the same pipeline
 * @param hooks operation hooks
 * @param objectMapper JSON mapper
 * @param accountId numeric Basecamp account ID
 */
public record ServiceContext(BasecampClient client, Paginator paginator, BasecampHooks hooks,
		ObjectMapper objectMapper, String accountId) {

	/**
	 * Prefix a path with the account ID. Absolute URLs and paths that already start with
	 * the account segment are returned unchanged.
	 * @param path API path such as {@code /projects.json}
	 * @return account-scoped path such as {@code /999/projects.json}
	 */
	public String accountPath(String path) {
		if (path.startsWith("https://") || path.startsWith("http://")) {
			return path;
		}
		String normalized = path.startsWith("/") ? path : "/" + path;
		String prefix = "/" + accountId;
		if (normalized.equals(prefix) || normalized.startsWith(prefix + "/")) {
			return normalized;
		}
		return prefix + normalized;
	}

}
