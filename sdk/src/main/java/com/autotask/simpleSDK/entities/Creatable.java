package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;

import java.util.concurrent.CompletableFuture;

public interface Creatable<T extends AutotaskRecord> {
    /** Creates a record with {@code POST {endpoint}}. */
    CompletableFuture<ApiResponse<T>> create(T record);
}
