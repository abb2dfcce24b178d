package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Appointment;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scheduled appointments for resources.
 *
 * <p>Category: ticketing. Operations: create, get, update, patch, delete, list.
 */
public class Appointments extends BaseEntity<Appointment>
        implements Creatable<Appointment>, Retrievable<Appointment>, Updatable<Appointment>, Patchable<Appointment>, Deletable, Listable<Appointment> {
    public static final String ENDPOINT = "/Appointments";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Appointments",
        ENDPOINT,
        "Scheduled appointments for resources",
        "ticketing",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.DELETE, EntityOperation.LIST)
    );

    public Appointments(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Appointment.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Appointment>> create(Appointment appointment) {
        logger.debug("Creating Appointments record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(appointment);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Appointment>> get(long id) {
        logger.debug("Getting Appointments id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Appointment>> update(long id, Appointment appointment) {
        logger.debug("Updating Appointments id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(appointment);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Appointment>> patch(long id, Appointment appointment) {
        logger.debug("Patching Appointments id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(appointment);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<Void> delete(long id) {
        logger.debug("Deleting Appointments id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.delete(path);
        return executeDeleteRequest(() -> httpClient.send(request), path);
    }

    @Override
    public CompletableFuture<ApiResponse<List<Appointment>>> list(QueryOptions query) {
        logger.debug("Listing Appointments query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
