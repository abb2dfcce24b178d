package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;

import java.util.concurrent.CompletableFuture;

public interface Updatable<T extends AutotaskRecord> {
    /** Replaces a record with {@code PUT {endpoint}/{id}}. */
    CompletableFuture<ApiResponse<T>> update(long id, T record);
}
