package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;
import com.autotask.simpleSDK.query.QueryOptions;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface Listable<T extends AutotaskRecord> {
    /**
     * Queries records with {@code POST {endpoint}/query}. Without a filter every record with
     * {@code id >= 0} matches.
     */
    CompletableFuture<ApiResponse<List<T>>> list(QueryOptions query);

    default CompletableFuture<ApiResponse<List<T>>> list() {
        return list(QueryOptions.none());
    }
}
