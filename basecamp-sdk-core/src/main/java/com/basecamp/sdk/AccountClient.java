package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Entry point for one Basecamp account. Services are created on first use.
 */
public class AccountClient {

	private final ServiceContext context;

	@Nullable
	private ProjectsService projects;

	@Nullable
	private TodosService todos;

	@Nullable
	private AttachmentsService attachments;

	AccountClient(ServiceContext context) {
		this.context = context;
	}

	public String accountId() {
		return context.accountId();
	}

	public synchronized ProjectsService projects() {
		if (projects == null) {
			projects = new ProjectsService(context);
		}
		return projects;
	}

	public synchronized TodosService todos() {
		if (todos == null) {
			todos = new TodosService(context);
		}
		return todos;
	}

	public synchronized AttachmentsService attachments() {
		if (attachments == null) {
			attachments = new AttachmentsService(context);
		}
		return attachments;
	}

	/**
	 * GET an account-relative path through the pipeline.
	 * @param path path such as {@code /projects.json}; absolute URLs are used as-is
	 * @return the response
	 */
	public ApiResponse get(String path) {
		return context.client().execute(RequestSpec.get(context.accountPath(path)));
	}

	/**
	 * GET a list endpoint and follow its pagination links.
	 * @param path account-relative list path
	 * @param options pagination limits
	 * @return raw JSON items with list metadata
	 */
	public ListResult<JsonNode> getAll(String path, PaginationOptions options) {
		return context.paginator().paginate(RequestSpec.get(context.accountPath(path)), JsonNode.class, options);
	}

}
