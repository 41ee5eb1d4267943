package com.basecamp.sdk;

import org.jspecify.annotations.Nullable;

/**
 * Project operations.
 */
public class ProjectsService extends BaseService {

	public ProjectsService(ServiceContext context) {
		super(context, "Projects");
	}

	/**
	 * List active projects, following pagination.
	 * @param status {@code archived} or {@code trashed} to list those instead, or null
	 * @param options pagination limits
	 * @return projects with list metadata
	 */
	public ListResult<Project> list(@Nullable String status, PaginationOptions options) {
		RequestSpec spec = RequestSpec.get(path("/projects.json")).withQuery("status", status);
		return requestPaginated(readOperation("ListProjects", "project", null), spec, Project.class, options);
	}

	public ListResult<Project> list() {
		return list(null, PaginationOptions.defaults());
	}

	public Project get(long projectId) {
		return request(readOperation("GetProject", "project", projectId),
				RequestSpec.get(path("/projects/" + projectId + ".json")), Project.class);
	}

	public Project create(CreateProjectRequest request) {
		requireNonBlank(request.name(), "Project name is required");
		return request(writeOperation("CreateProject", "project", null), RequestSpec.post(path("/projects.json"), request),
				Project.class);
	}

	public Project update(long projectId, UpdateProjectRequest request) {
		return request(writeOperation("UpdateProject", "project", projectId),
				RequestSpec.put(path("/projects/" + projectId + ".json"), request), Project.class);
	}

	/**
	 * Move a project to the trash. Trashed projects are deleted after 30 days.
	 */
	public void trash(long projectId) {
		requestVoid(writeOperation("TrashProject", "project", projectId),
				RequestSpec.delete(path("/projects/" + projectId + ".json")));
	}

}
