package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Task;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Project tasks.
 *
 * <p>Category: core. Operations: create, get, update, patch, list.
 */
public class Tasks extends BaseEntity<Task>
        implements Creatable<Task>, Retrievable<Task>, Updatable<Task>, Patchable<Task>, Listable<Task> {
    public static final String ENDPOINT = "/Tasks";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Tasks",
        ENDPOINT,
        "Project tasks",
        "core",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Tasks(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Task.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Task>> create(Task task) {
        logger.debug("Creating Tasks record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(task);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Task>> get(long id) {
        logger.debug("Getting Tasks id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Task>> update(long id, Task task) {
        logger.debug("Updating Tasks id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(task);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Task>> patch(long id, Task task) {
        logger.debug("Patching Tasks id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(task);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Task>>> list(QueryOptions query) {
        logger.debug("Listing Tasks query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
