package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Contract;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Service agreements with companies.
 *
 * <p>Category: contracts. Operations: create, get, update, patch, list.
 */
public class Contracts extends BaseEntity<Contract>
        implements Creatable<Contract>, Retrievable<Contract>, Updatable<Contract>, Patchable<Contract>, Listable<Contract> {
    public static final String ENDPOINT = "/Contracts";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Contracts",
        ENDPOINT,
        "Service agreements with companies",
        "contracts",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Contracts(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Contract.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Contract>> create(Contract contract) {
        logger.debug("Creating Contracts record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(contract);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Contract>> get(long id) {
        logger.debug("Getting Contracts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Contract>> update(long id, Contract contract) {
        logger.debug("Updating Contracts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(contract);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Contract>> patch(long id, Contract contract) {
        logger.debug("Patching Contracts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(contract);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Contract>>> list(QueryOptions query) {
        logger.debug("Listing Contracts query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
