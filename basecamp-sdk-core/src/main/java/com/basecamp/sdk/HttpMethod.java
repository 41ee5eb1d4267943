package com.basecamp.sdk;

/**
 * HTTP methods used by the Basecamp API.
 */
public enum HttpMethod {

	GET, POST, PUT, PATCH, DELETE;

	/**
	 * Any method other than GET may have side effects and is not retried by default.
	 * @return true for non-GET methods
	 */
	public boolean isMutation() {
		return this != GET;
	}

}
