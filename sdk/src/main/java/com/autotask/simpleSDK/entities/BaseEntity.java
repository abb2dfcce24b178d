package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.HttpCallResult;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.http.RequestOptions;
import com.autotask.simpleSDK.http.exceptions.AutotaskResponseFormatException;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Shared plumbing for the generated entity classes: runs calls through the {@link RequestHandler} and
 * unwraps the Autotask response envelopes into {@link ApiResponse}.
 *
 * <p>Single-record calls accept {@code {"item": {...}}} or a bare object; list calls accept
 * {@code {"items": [...]}} or a bare array. An empty body yields {@code data == null}. An object holding
 * nothing but an {@code items} array is a list envelope, never a single record.
 */
public abstract class BaseEntity<T extends AutotaskRecord> {
    private static final String ITEM = "item";
    private static final String ITEMS = "items";
    private static final RequestOptions QUERY_OPTIONS = RequestOptions.builder().idempotent(true).build();

    protected final AutotaskHttpClient httpClient;
    protected final RequestHandler requestHandler;
    protected final Logger logger;
    private final Class<T> recordType;
    private final EntityMetadata metadata;
    private final ObjectMapper objectMapper;

    protected BaseEntity(AutotaskHttpClient httpClient, RequestHandler requestHandler, Class<T> recordType,
                         EntityMetadata metadata) {
        this.httpClient = httpClient;
        this.requestHandler = requestHandler;
        this.logger = requestHandler.getLogger();
        this.recordType = recordType;
        this.metadata = metadata;
        this.objectMapper = httpClient.getObjectMapper();
    }

    public EntityMetadata getMetadata() {
        return metadata;
    }

    public Class<T> getRecordType() {
        return recordType;
    }

    /** Creates a record of this entity's type holding the given fields. */
    public T newRecord(Map<String, ?> fields) {
        return objectMapper.convertValue(fields == null ? Collections.emptyMap() : fields, recordType);
    }

    protected CompletableFuture<ApiResponse<T>> executeRequest(Supplier<CompletableFuture<HttpCallResult>> call,
                                                              String endpoint, String method) {
        return requestHandler.executeRequest(call, endpoint, method)
            .thenApply(result -> new ApiResponse<>(readSingle(result, endpoint)));
    }

    /** List queries are POSTs that change nothing on the server, so they are sent as idempotent. */
    protected CompletableFuture<ApiResponse<List<T>>> executeQueryRequest(Supplier<CompletableFuture<HttpCallResult>> call,
                                                                         String endpoint) {
        return requestHandler.executeRequest(call, endpoint, "POST", QUERY_OPTIONS)
            .thenApply(result -> new ApiResponse<>(readList(result, endpoint)));
    }

    protected CompletableFuture<Void> executeDeleteRequest(Supplier<CompletableFuture<HttpCallResult>> call,
                                                          String endpoint) {
        return requestHandler.executeRequest(call, endpoint, "DELETE")
            .thenApply(result -> null);
    }

    private T readSingle(HttpCallResult result, String endpoint) {
        if (!result.hasBody()) {
            return null;
        }
        JsonNode root = parse(result, endpoint);
        JsonNode node = root.isObject() && root.has(ITEM) ? root.get(ITEM) : root;
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject() || (node == root && isListEnvelope(root))) {
            throw formatError("Expected a single " + metadata.name() + " record", endpoint, result, null);
        }
        return toRecord(node, endpoint, result);
    }

    private List<T> readList(HttpCallResult result, String endpoint) {
        if (!result.hasBody()) {
            return List.of();
        }
        JsonNode root = parse(result, endpoint);
        JsonNode node = root.isObject() ? root.get(ITEMS) : root;
        if (node == null || !node.isArray()) {
            throw formatError("Expected a list of " + metadata.name() + " records", endpoint, result, null);
        }
        List<T> records = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw formatError("Expected " + metadata.name() + " list entries to be objects", endpoint, result, null);
            }
            records.add(toRecord(element, endpoint, result));
        }
        return Collections.unmodifiableList(records);
    }

    private static boolean isListEnvelope(JsonNode node) {
        return node.size() == 1 && node.path(ITEMS).isArray();
    }

    private JsonNode parse(HttpCallResult result, String endpoint) {
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw formatError("Response is not valid JSON", endpoint, result, e);
        }
    }

    private T toRecord(JsonNode node, String endpoint, HttpCallResult result) {
        try {
            return objectMapper.treeToValue(node, recordType);
        } catch (JsonProcessingException e) {
            throw formatError("Could not read " + metadata.name() + " record", endpoint, result, e);
        }
    }

    private CompletionException formatError(String message, String endpoint, HttpCallResult result, Throwable cause) {
        return new CompletionException(new AutotaskResponseFormatException(message, endpoint, result.body(), cause));
    }
}
