package com.basecamp.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Base class for API services.
 *
 * <p>
 * Provides the three pipeline entry points used by service methods:
 * {@link #request}, {@link #requestVoid} and {@link #requestPaginated}. Each reports the
 * call to {@link BasecampHooks} as one operation and tags the request with the
 * operation name so the behavior model can select its retry policy.
 */
public abstract class BaseService {

	protected final ServiceContext context;

	private final String serviceName;

	protected BaseService(ServiceContext context, String serviceName) {
		this.context = context;
		this.serviceName = serviceName;
	}

	protected OperationInfo readOperation(String operation, String resourceType, @Nullable Long resourceId) {
		return OperationInfo.read(serviceName, operation, resourceType, resourceId);
	}

	protected OperationInfo writeOperation(String operation, String resourceType, @Nullable Long resourceId) {
		return OperationInfo.write(serviceName, operation, resourceType, resourceId);
	}

	protected String path(String path) {
		return context.accountPath(path);
	}

	/**
	 * Execute a request and decode the JSON object it returns.
	 */
	protected <T> T request(OperationInfo operation, RequestSpec spec, Class<T> type) {
		return withOperation(operation, () -> {
			ApiResponse response = context.client().execute(spec.withOperation(operation.operation()));
			return decode(response, type);
		});
	}

	/**
	 * Execute a request whose response body is ignored.
	 */
	protected void requestVoid(OperationInfo operation, RequestSpec spec) {
		withOperation(operation, () -> context.client().execute(spec.withOperation(operation.operation())));
	}

	/**
	 * Execute a list request, following pagination links.
	 */
	protected <T> ListResult<T> requestPaginated(OperationInfo operation, RequestSpec spec, Class<T> type,
			PaginationOptions options) {
		return withOperation(operation,
				() -> context.paginator().paginate(spec.withOperation(operation.operation()), type, options));
	}

	protected static void requireNonBlank(@Nullable String value, String message) {
		if (value == null || value.isBlank()) {
			throw BasecampException.usage(message);
		}
	}

	private <R> R withOperation(OperationInfo operation, Supplier<R> call) {
		BasecampHooks hooks = context.hooks();
		hooks.onOperationStart(operation);
		long start = System.nanoTime();
		try {
			R result = call.get();
			hooks.onOperationEnd(operation, OperationResult.success(Duration.ofNanos(System.nanoTime() - start)));
			return result;
		}
		catch (BasecampException e) {
			hooks.onOperationEnd(operation, OperationResult.failure(Duration.ofNanos(System.nanoTime() - start), e));
			throw e;
		}
	}

	private <T> T decode(ApiResponse response, Class<T> type) {
		if (!response.hasBody()) {
			throw BasecampException.api("Empty response from " + response.uri(), response.statusCode());
		}
		ObjectMapper mapper = context.objectMapper();
		try {
			return mapper.readValue(response.body(), type);
		}
		catch (IOException e) {
			throw BasecampException.api("Failed to parse response from " + response.uri() + ": " + e.getMessage(),
					e);
		}
	}

}
