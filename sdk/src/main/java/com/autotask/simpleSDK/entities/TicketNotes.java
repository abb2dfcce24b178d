package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.TicketNote;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Notes attached to tickets.
 *
 * <p>Category: ticketing. Operations: create, get, update, patch, list.
 */
public class TicketNotes extends BaseEntity<TicketNote>
        implements Creatable<TicketNote>, Retrievable<TicketNote>, Updatable<TicketNote>, Patchable<TicketNote>, Listable<TicketNote> {
    public static final String ENDPOINT = "/TicketNotes";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "TicketNotes",
        ENDPOINT,
        "Notes attached to tickets",
        "ticketing",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public TicketNotes(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, TicketNote.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<TicketNote>> create(TicketNote ticketNote) {
        logger.debug("Creating TicketNotes record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(ticketNote);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<TicketNote>> get(long id) {
        logger.debug("Getting TicketNotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<TicketNote>> update(long id, TicketNote ticketNote) {
        logger.debug("Updating TicketNotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(ticketNote);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<TicketNote>> patch(long id, TicketNote ticketNote) {
        logger.debug("Patching TicketNotes id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(ticketNote);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<TicketNote>>> list(QueryOptions query) {
        logger.debug("Listing TicketNotes query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
