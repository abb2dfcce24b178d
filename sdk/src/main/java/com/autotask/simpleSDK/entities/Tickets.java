package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Ticket;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Service desk tickets.
 *
 * <p>Category: core. Operations: create, get, update, patch, list.
 */
public class Tickets extends BaseEntity<Ticket>
        implements Creatable<Ticket>, Retrievable<Ticket>, Updatable<Ticket>, Patchable<Ticket>, Listable<Ticket> {
    public static final String ENDPOINT = "/Tickets";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Tickets",
        ENDPOINT,
        "Service desk tickets",
        "core",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Tickets(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Ticket.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Ticket>> create(Ticket ticket) {
        logger.debug("Creating Tickets record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(ticket);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Ticket>> get(long id) {
        logger.debug("Getting Tickets id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Ticket>> update(long id, Ticket ticket) {
        logger.debug("Updating Tickets id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(ticket);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Ticket>> patch(long id, Ticket ticket) {
        logger.debug("Patching Tickets id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(ticket);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Ticket>>> list(QueryOptions query) {
        logger.debug("Listing Tickets query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
