package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * To-do operations. To-dos live in a to-do list inside a project (bucket).
 */
public class TodosService extends BaseService {

	public TodosService(ServiceContext context) {
		super(context, "Todos");
	}

	/**
	 * List the to-dos of a list.
	 * @param projectId project (bucket) ID
	 * @param todolistId to-do list ID
	 * @param status {@code completed} or {@code pending}, or null for all
	 * @param options pagination limits
	 * @return to-dos with list metadata
	 */
	public ListResult<Todo> list(long projectId, long todolistId, @Nullable String status,
			PaginationOptions options) {
		RequestSpec spec = RequestSpec.get(path("/buckets/" + projectId + "/todolists/" + todolistId + "/todos.json"))
			.withQuery("status", status);
		return requestPaginated(readOperation("ListTodos", "todo", todolistId), spec, Todo.class, options);
	}

	public Todo get(long projectId, long todoId) {
		return request(readOperation("GetTodo", "todo", todoId),
				RequestSpec.get(path("/buckets/" + projectId + "/todos/" + todoId + ".json")), Todo.class);
	}

	public Todo create(long projectId, long todolistId, CreateTodoRequest request) {
		requireNonBlank(request.content(), "Todo content is required");
		return request(writeOperation("CreateTodo", "todo", null),
				RequestSpec.post(path("/buckets/" + projectId + "/todolists/" + todolistId + "/todos.json"), request),
				Todo.class);
	}

	public Todo update(long projectId, long todoId, UpdateTodoRequest request) {
		return request(writeOperation("UpdateTodo", "todo", todoId),
				RequestSpec.put(path("/buckets/" + projectId + "/todos/" + todoId + ".json"), request), Todo.class);
	}

	public void complete(long projectId, long todoId) {
		requestVoid(writeOperation("CompleteTodo", "todo", todoId),
				RequestSpec.post(path(completionPath(projectId, todoId)), null));
	}

	public void uncomplete(long projectId, long todoId) {
		requestVoid(writeOperation("UncompleteTodo", "todo", todoId),
				RequestSpec.delete(path(completionPath(projectId, todoId))));
	}

	private static String completionPath(long projectId, long todoId) {
		return "/buckets/" + projectId + "/todos/" + todoId + "/completion.json";
	}

}
