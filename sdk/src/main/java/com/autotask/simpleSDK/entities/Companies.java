package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Company;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Customer, prospect and vendor organizations.
 *
 * <p>Category: core. Operations: create, get, update, patch, list.
 */
public class Companies extends BaseEntity<Company>
        implements Creatable<Company>, Retrievable<Company>, Updatable<Company>, Patchable<Company>, Listable<Company> {
    public static final String ENDPOINT = "/Companies";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Companies",
        ENDPOINT,
        "Customer, prospect and vendor organizations",
        "core",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Companies(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Company.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Company>> create(Company company) {
        logger.debug("Creating Companies record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(company);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Company>> get(long id) {
        logger.debug("Getting Companies id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Company>> update(long id, Company company) {
        logger.debug("Updating Companies id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(company);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Company>> patch(long id, Company company) {
        logger.debug("Patching Companies id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(company);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Company>>> list(QueryOptions query) {
        logger.debug("Listing Companies query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
