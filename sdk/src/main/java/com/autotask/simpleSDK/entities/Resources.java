package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Resource;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Users and technicians of the Autotask instance.
 *
 * <p>Category: core. Operations: get, list.
 */
public class Resources extends BaseEntity<Resource>
        implements Retrievable<Resource>, Listable<Resource> {
    public static final String ENDPOINT = "/Resources";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Resources",
        ENDPOINT,
        "Users and technicians of the Autotask instance",
        "core",
        EnumSet.of(EntityOperation.GET, EntityOperation.LIST)
    );

    public Resources(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Resource.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Resource>> get(long id) {
        logger.debug("Getting Resources id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Resource>>> list(QueryOptions query) {
        logger.debug("Listing Resources query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
