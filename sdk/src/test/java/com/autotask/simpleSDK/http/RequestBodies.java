package com.autotask.simpleSDK.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Reads back what a built {@link HttpRequest} would put on the wire.
 */
public final class RequestBodies {
    private RequestBodies() {
    }

    public static String asString(HttpRequest request) throws Exception {
        if (request.bodyPublisher().isEmpty()) {
            return null;
        }
        HttpRequest.BodyPublisher publisher = request.bodyPublisher().get();
        if (publisher.contentLength() == 0) {
            return "";
        }

        CompletableFuture<String> done = new CompletableFuture<>();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        publisher.subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] chunk = new byte[item.remaining()];
                item.get(chunk);
                bytes.write(chunk, 0, chunk.length);
            }

            @Override
            public void onError(Throwable throwable) {
                done.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                done.complete(bytes.toString(StandardCharsets.UTF_8));
            }
        });
        return done.get(5, TimeUnit.SECONDS);
    }
}
