package com.autotask.simpleSDK.entities;

import java.util.concurrent.CompletableFuture;

public interface Deletable {
    /** Deletes a record with {@code DELETE {endpoint}/{id}}; the response body is ignored. */
    CompletableFuture<Void> delete(long id);
}
