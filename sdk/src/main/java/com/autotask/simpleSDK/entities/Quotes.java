package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Quote;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sales quotes for opportunities.
 *
 * <p>Category: financial. Operations: create, get, update, patch, list.
 */
public class Quotes extends BaseEntity<Quote>
        implements Creatable<Quote>, Retrievable<Quote>, Updatable<Quote>, Patchable<Quote>, Listable<Quote> {
    public static final String ENDPOINT = "/Quotes";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Quotes",
        ENDPOINT,
        "Sales quotes for opportunities",
        "financial",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Quotes(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Quote.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Quote>> create(Quote quote) {
        logger.debug("Creating Quotes record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(quote);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Quote>> get(long id) {
        logger.debug("Getting Quotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Quote>> update(long id, Quote quote) {
        logger.debug("Updating Quotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(quote);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Quote>> patch(long id, Quote quote) {
        logger.debug("Patching Quotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(quote);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Quote>>> list(QueryOptions query) {
        logger.debug("Listing Quotes query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
