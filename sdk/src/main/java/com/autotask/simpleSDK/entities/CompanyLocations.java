package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.CompanyLocation;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Physical locations associated with companies.
 *
 * <p>Category: organizational. Operations: create, get, update, patch, delete, list.
 */
public class CompanyLocations extends BaseEntity<CompanyLocation>
        implements Creatable<CompanyLocation>, Retrievable<CompanyLocation>, Updatable<CompanyLocation>, Patchable<CompanyLocation>, Deletable, Listable<CompanyLocation> {
    public static final String ENDPOINT = "/CompanyLocations";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "CompanyLocations",
        ENDPOINT,
        "Physical locations associated with companies",
        "organizational",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.DELETE, EntityOperation.LIST)
    );

    public CompanyLocations(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, CompanyLocation.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<CompanyLocation>> create(CompanyLocation companyLocation) {
        logger.debug("Creating CompanyLocations record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(companyLocation);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<CompanyLocation>> get(long id) {
        logger.debug("Getting CompanyLocations id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<CompanyLocation>> update(long id, CompanyLocation companyLocation) {
        logger.debug("Updating CompanyLocations id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(companyLocation);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<CompanyLocation>> patch(long id, CompanyLocation companyLocation) {
        logger.debug("Patching CompanyLocations id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(companyLocation);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<Void> delete(long id) {
        logger.debug("Deleting CompanyLocations id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.delete(path);
        return executeDeleteRequest(() -> httpClient.send(request), path);
    }

    @Override
    public CompletableFuture<ApiResponse<List<CompanyLocation>>> list(QueryOptions query) {
        logger.debug("Listing CompanyLocations query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
