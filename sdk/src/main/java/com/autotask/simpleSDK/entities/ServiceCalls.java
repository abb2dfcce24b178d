package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.ServiceCall;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scheduled on-site or remote service calls.
 *
 * <p>Category: ticketing. Operations: create, get, update, patch, delete, list.
 */
public class ServiceCalls extends BaseEntity<ServiceCall>
        implements Creatable<ServiceCall>, Retrievable<ServiceCall>, Updatable<ServiceCall>, Patchable<ServiceCall>, Deletable, Listable<ServiceCall> {
    public static final String ENDPOINT = "/ServiceCalls";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "ServiceCalls",
        ENDPOINT,
        "Scheduled on-site or remote service calls",
        "ticketing",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.DELETE, EntityOperation.LIST)
    );

    public ServiceCalls(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, ServiceCall.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<ServiceCall>> create(ServiceCall serviceCall) {
        logger.debug("Creating ServiceCalls record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(serviceCall);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<ServiceCall>> get(long id) {
        logger.debug("Getting ServiceCalls id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<ServiceCall>> update(long id, ServiceCall serviceCall) {
        logger.debug("Updating ServiceCalls id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(serviceCall);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<ServiceCall>> patch(long id, ServiceCall serviceCall) {
        logger.debug("Patching ServiceCalls id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(serviceCall);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<Void> delete(long id) {
        logger.debug("Deleting ServiceCalls id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.delete(path);
        return executeDeleteRequest(() -> httpClient.send(request), path);
    }

    @Override
    public CompletableFuture<ApiResponse<List<ServiceCall>>> list(QueryOptions query) {
        logger.debug("Listing ServiceCalls query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
