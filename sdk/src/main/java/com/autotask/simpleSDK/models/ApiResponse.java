package com.autotask.simpleSDK.models;

/**
 * Normalized result of an entity call. {@code data} is the record, the list of records, or {@code null}
 * when the API answered with an empty body.
 */
public record ApiResponse<T>(T data) {
}
