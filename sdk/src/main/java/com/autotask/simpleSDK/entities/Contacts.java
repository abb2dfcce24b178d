package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.Contact;
import com.autotask.simpleSDK.query.QueryFilters;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * People associated with companies.
 *
 * <p>Category: core. Operations: create, get, update, patch, list.
 */
public class Contacts extends BaseEntity<Contact>
        implements Creatable<Contact>, Retrievable<Contact>, Updatable<Contact>, Patchable<Contact>, Listable<Contact> {
    public static final String ENDPOINT = "/Contacts";
    public static final EntityMetadata METADATA = new EntityMetadata(
        "Contacts",
        ENDPOINT,
        "People associated with companies",
        "core",
        EnumSet.of(EntityOperation.CREATE, EntityOperation.GET, EntityOperation.UPDATE, EntityOperation.PATCH, EntityOperation.LIST)
    );

    public Contacts(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        super(httpClient, requestHandler, Contact.class, METADATA);
    }

    @Override
    public CompletableFuture<ApiResponse<Contact>> create(Contact contact) {
        logger.debug("Creating Contacts record");
        AutotaskRequest request = httpClient.post(ENDPOINT).body(contact);
        return executeRequest(() -> httpClient.send(request), ENDPOINT, "POST");
    }

    @Override
    public CompletableFuture<ApiResponse<Contact>> get(long id) {
        logger.debug("Getting Contacts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.get(path);
        return executeRequest(() -> httpClient.send(request), path, "GET");
    }

    @Override
    public CompletableFuture<ApiResponse<Contact>> update(long id, Contact contact) {
        logger.debug("Updating Contacts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.put(path).body(contact);
        return executeRequest(() -> httpClient.send(request), path, "PUT");
    }

    @Override
    public CompletableFuture<ApiResponse<Contact>> patch(long id, Contact contact) {
        logger.debug("Patching Contacts id={}", id);
        String path = ENDPOINT + "/" + id;
        AutotaskRequest request = httpClient.patch(path).body(contact);
        return executeRequest(() -> httpClient.send(request), path, "PATCH");
    }

    @Override
    public CompletableFuture<ApiResponse<List<Contact>>> list(QueryOptions query) {
        logger.debug("Listing Contacts query={}", query);
        String path = ENDPOINT + "/query";
        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);
    }
}
