package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.TimeEntry;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Time logged by resources against tickets, tasks and projects.
 *
 * <p>Category: time. Operations: create, get, update, patch, delete, list.
 */
public class TimeEntries extends BaseEntity<TimeEntry>
        implements Creatable<TimeEntry>, Retrievable<TimeEntry>, Updatable<TimeEntry>, Patchable<TimeEntry>, Deletable, Listable<TimeEntry> {
    public static final String ENDPOINT = "/TimeEntries";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "TimeEntries",
        ENDPOINT,
        "Time logged by resources against tickets, tasks and projects",
        "time",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.DELETE, EntityOperation.LIST)
    );

    public TimeEntries(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, TimeEntry.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<TimeEntry>> create(TimeEntry timeEntry) {
        logger.debug("Creating TimeEntries record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(timeEntry);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<TimeEntry>> get(long id) {
        logger.debug("Getting TimeEntries id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<TimeEntry>> update(long id, TimeEntry timeEntry) {
        logger.debug("Updating TimeEntries id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(timeEntry);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<TimeEntry>> patch(long id, TimeEntry timeEntry) {
        logger.debug("Patching TimeEntries id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(timeEntry);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<Void> delete(long id) {
        logger.debug("Deleting TimeEntries id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.delete(path);
        return executeDeleteRequest(() -> httpClient.send(request), path);
    }

    @Override
    public CompletableFuture<ApiResponse<List<TimeEntry>>> list(QueryOptions query) {
        logger.debug("Listing TimeEntries query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
