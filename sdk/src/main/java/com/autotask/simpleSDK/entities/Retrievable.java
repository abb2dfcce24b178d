package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;

import java.util.concurrent.CompletableFuture;

public interface Retrievable<T extends AutotaskRecord> {
    /** Reads one record with {@code GET {endpoint}/{id}}. */
    CompletableFuture<ApiResponse<T>> get(long id);
}
