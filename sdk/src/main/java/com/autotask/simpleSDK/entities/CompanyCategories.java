package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.CompanyCategory;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Categories used to group companies.
 *
 * <p>Category: organizational. Operations: get, list.
 */
public class CompanyCategories extends BaseEntity<CompanyCategory>
        implements Retrievable<CompanyCategory>, Listable<CompanyCategory> {
    public static final String ENDPOINT = "/CompanyCategories";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "CompanyCategories",
        ENDPOINT,
        "Categories used to group companies",
        "organizational",
        EnumSet.of(EntityOperation.GET, EntityOperation.LIST)
    );

    public CompanyCategories(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, CompanyCategory.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<CompanyCategory>> get(long id) {
        logger.debug("Getting CompanyCategories id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<List<CompanyCategory>>> list(QueryOptions query) {
        logger.debug("Listing CompanyCategories query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
