package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * Describes a service operation for {@link BasecampHooks}.
 *
 * @param service service name, e.g. {@code Projects}
 * @param operation behavior-model operation name, e.g. {@code ListProjects}
 * @param resourceType resource kind, e.g. {@code project}
 * @param mutation whether the operation changes state
 * @param resourceId ID of the resource acted on, or null
 */
public record OperationInfo(String service, String operation, String resourceType, boolean mutation,
		@Nullable Long resourceId) {

	public static OperationInfo read(String service, String operation, String resourceType,
			@Nullable Long resourceId) {
		return new OperationInfo(service, operation, resourceType, false, resourceId);
	}

	public static OperationInfo write(String service, String operation, String resourceType,
			@Nullable Long resourceId) {
		return new OperationInfo(service, operation, resourceType, true, resourceId);
	}

}
