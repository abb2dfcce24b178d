package com.autotask.simpleSDK.http;

import com.autotask.simpleSDK.http.auth.AutotaskCredentials;
import com.autotask.simpleSDK.http.exceptions.AutotaskAuthenticationException;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.autotask.simpleSDK.http.exceptions.AutotaskNetworkException;
import com.autotask.simpleSDK.http.exceptions.AutotaskRateLimitException;
import com.autotask.simpleSDK.http.exceptions.AutotaskResourceNotFoundException;
import com.autotask.simpleSDK.http.exceptions.AutotaskServiceException;
import com.autotask.simpleSDK.http.exceptions.AutotaskValidationException;
import com.autotask.simpleSDK.http.recording.HttpInteractionRecorder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Sends {@link AutotaskRequest}s to the zone base URL. Each call is a single attempt; retries belong to
 * {@link RequestHandler}.
 */
public class AutotaskHttpClient {
    private static final Logger log = LoggerFactory.getLogger(AutotaskHttpClient.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final AutotaskCredentials credentials;
    private final ObjectMapper objectMapper;
    private final HttpInteractionRecorder recorder;
    private final Duration requestTimeout;

    public AutotaskHttpClient(String baseUrl, AutotaskCredentials credentials) {
        this(baseUrl, credentials, null);
    }

    public AutotaskHttpClient(String baseUrl, AutotaskCredentials credentials, HttpInteractionRecorder recorder) {
        this(baseUrl, credentials, recorder, HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build());
    }

    public AutotaskHttpClient(String baseUrl, AutotaskCredentials credentials, HttpInteractionRecorder recorder,
                              HttpClient httpClient) {
        this(baseUrl, credentials, recorder, httpClient, DEFAULT_TIMEOUT);
    }

    /**
     * @param requestTimeout default timeout applied to every request created by this client
     */
    public AutotaskHttpClient(String baseUrl, AutotaskCredentials credentials, HttpInteractionRecorder recorder,
                              HttpClient httpClient, Duration requestTimeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.credentials = credentials;
        this.recorder = recorder;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_TIMEOUT;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public AutotaskRequest get(String path) {
        return newRequest("GET", path);
    }

    public AutotaskRequest post(String path) {
        return newRequest("POST", path);
    }

    public AutotaskRequest put(String path) {
        return newRequest("PUT", path);
    }

    public AutotaskRequest patch(String path) {
        return newRequest("PATCH", path);
    }

    public AutotaskRequest delete(String path) {
        return newRequest("DELETE", path);
    }

    private AutotaskRequest newRequest(String method, String path) {
        return new AutotaskRequest(method, path, buildFullUrl(path), credentials, objectMapper)
            .timeout(requestTimeout);
    }

    String buildFullUrl(String path) {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }

    /**
     * Sends the request once. The future completes with the response for 2xx/3xx statuses and fails with
     * an {@link AutotaskServiceException} subtype for 4xx/5xx, or {@link AutotaskNetworkException} when the
     * transport fails.
     */
    public CompletableFuture<HttpCallResult> send(AutotaskRequest autotaskRequest) {
        HttpRequest request;
        try {
            request = autotaskRequest.build();
        } catch (AutotaskException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (recorder != null && recorder.isPlayback()) {
            try {
                return completeResult(autotaskRequest, recorder.playback(autotaskRequest));
            } catch (AutotaskException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        CompletableFuture<HttpCallResult> sent;
        try {
            sent = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(HttpCallResult::fromHttpResponse);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new AutotaskNetworkException("Network error", e));
        }

        return sent.handle((result, error) -> {
            if (error != null) {
                throw new CompletionException(translateTransportError(error));
            }
            if (recorder != null && recorder.isRecording()) {
                try {
                    recorder.record(autotaskRequest, result);
                } catch (AutotaskException e) {
                    throw new CompletionException(e);
                }
            }
            return result;
        }).thenCompose(result -> completeResult(autotaskRequest, result));
    }

    private CompletableFuture<HttpCallResult> completeResult(AutotaskRequest request, HttpCallResult result) {
        if (result.statusCode() >= 400) {
            return CompletableFuture.failedFuture(createServiceException(request, result));
        }
        return CompletableFuture.completedFuture(result);
    }

    private Throwable translateTransportError(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof HttpTimeoutException) {
            return new AutotaskNetworkException("Request timeout", true, cause);
        }
        if (cause instanceof IOException) {
            return new AutotaskNetworkException("Network error", cause);
        }
        return cause;
    }

    AutotaskServiceException createServiceException(AutotaskRequest request, HttpCallResult result) {
        int statusCode = result.statusCode();
        Map<String, String> headers = result.headers();
        String responseBody = result.body();
        List<String> errors = parseErrors(responseBody);
        String detail = errors.isEmpty() ? "HTTP " + statusCode : String.join("; ", errors);
        String endpoint = request.getPath();
        String method = request.getMethod();

        switch (statusCode) {
            case 400:
                return new AutotaskValidationException("Bad Request: " + detail, statusCode, headers, errors, responseBody, endpoint, method);
            case 401:
                return new AutotaskAuthenticationException("Authentication failed: " + detail, statusCode, headers, errors, responseBody, endpoint, method);
            case 403:
                return new AutotaskAuthenticationException("Access forbidden: " + detail, statusCode, headers, errors, responseBody, endpoint, method);
            case 404:
                return new AutotaskResourceNotFoundException("Resource not found: " + detail, headers, errors, responseBody, endpoint, method);
            case 422:
                return new AutotaskValidationException("Validation failed: " + detail, statusCode, headers, errors, responseBody, endpoint, method);
            case 429:
                return new AutotaskRateLimitException("Rate limit exceeded: " + detail, headers, errors, responseBody, endpoint, method);
            default:
                String prefix = statusCode >= 500 ? "Server error: " : "Request failed: ";
                return new AutotaskServiceException(prefix + detail, statusCode, headers, errors, responseBody, endpoint, method);
        }
    }

    private List<String> parseErrors(String responseBody) {
        List<String> errors = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return errors;
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode errorsNode = root.get("errors");
            if (errorsNode != null && errorsNode.isArray()) {
                for (JsonNode error : errorsNode) {
                    errors.add(error.isTextual() ? error.asText() : error.path("message").asText(error.toString()));
                }
            } else if (root.hasNonNull("message")) {
                errors.add(root.get("message").asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("Error response body is not JSON, keeping raw body only: {}", e.getOriginalMessage());
        }
        return errors;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpInteractionRecorder getRecorder() {
        return recorder;
    }
}
