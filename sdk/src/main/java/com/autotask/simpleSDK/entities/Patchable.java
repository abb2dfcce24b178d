package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;

import java.util.concurrent.CompletableFuture;

public interface Patchable<T extends AutotaskRecord> {
    /** Changes the given fields of a record with {@code PATCH {endpoint}/{id}}. */
    CompletableFuture<ApiResponse<T>> patch(long id, T record);
}
