package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Project;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Projects and their scheduling details.
 *
 * <p>Category: core. Operations: create, get, update, patch, list.
 */
public class Projects extends BaseEntity<Project>
        implements Creatable<Project>, Retrievable<Project>, Updatable<Project>, Patchable<Project>, Listable<Project> {
    public static final String ENDPOINT = "/Projects";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Projects",
        ENDPOINT,
        "Projects and their scheduling details",
        "core",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Projects(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Project.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Project>> create(Project project) {
        logger.debug("Creating Projects record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(project);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Project>> get(long id) {
        logger.debug("Getting Projects id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Project>> update(long id, Project project) {
        logger.debug("Updating Projects id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(project);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Project>> patch(long id, Project project) {
        logger.debug("Patching Projects id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(project);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Project>>> list(QueryOptions query) {
        logger.debug("Listing Projects query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
