package com.autotask.simpleSDK.http;

import com.autotask.simpleSDK.http.auth.AutotaskCredentials;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class AutotaskRequest {
    private final String method;
    private final String path;
    private final String url;
    private final Map<String, String> headers;
    private final Map<String, String> queryParameters;
    private Object body;
    private String serializedBody;
    private Duration timeout;
    private final AutotaskCredentials credentials;
    private final ObjectMapper objectMapper;

    public AutotaskRequest(String method, String path, String url, AutotaskCredentials credentials, ObjectMapper objectMapper) {
        this.method = method.toUpperCase(Locale.ROOT);
        this.path = path;
        this.url = url;
        this.credentials = credentials;
        this.objectMapper = objectMapper;
        this.headers = new LinkedHashMap<>();
        this.queryParameters = new LinkedHashMap<>();
        this.timeout = Duration.ofSeconds(30);

        setDefaultHeaders();
    }

    private void setDefaultHeaders() {
        headers.put("Accept", "application/json");
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", "autotask-simple-sdk/1.0.0");
    }

    public AutotaskRequest header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public AutotaskRequest headers(Map<String, String> headers) {
        this.headers.putAll(headers);
        return this;
    }

    public AutotaskRequest queryParam(String name, Object value) {
        if (value != null) {
            queryParameters.put(name, String.valueOf(value));
        }
        return this;
    }

    public AutotaskRequest queryParams(Map<String, ?> queryParams) {
        queryParams.forEach(this::queryParam);
        return this;
    }

    public AutotaskRequest body(Object body) {
        this.body = body;
        this.serializedBody = null;
        return this;
    }

    public AutotaskRequest timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * The JSON text sent on the wire, or {@code null} when the request has no body.
     */
    public String getSerializedBody() throws AutotaskException {
        if (body == null) {
            return null;
        }
        if (serializedBody == null) {
            if (body instanceof String) {
                serializedBody = (String) body;
            } else {
                try {
                    serializedBody = objectMapper.writeValueAsString(body);
                } catch (JsonProcessingException e) {
                    throw new AutotaskException("Failed to serialize request body for " + method + " " + path, e);
                }
            }
        }
        return serializedBody;
    }

    public HttpRequest build() throws AutotaskException {
        String jsonBody = getSerializedBody();
        try {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(buildUrlWithQuery()))
                .timeout(timeout);

            Map<String, String> allHeaders = new LinkedHashMap<>(headers);
            if (credentials != null) {
                allHeaders.putAll(credentials.getAuthenticationHeaders());
            }
            for (Map.Entry<String, String> header : allHeaders.entrySet()) {
                requestBuilder.header(header.getKey(), header.getValue());
            }

            HttpRequest.BodyPublisher bodyPublisher = jsonBody != null
                ? HttpRequest.BodyPublishers.ofString(jsonBody)
                : HttpRequest.BodyPublishers.noBody();

            switch (method) {
                case "GET":
                    requestBuilder.GET();
                    break;
                case "POST":
                    requestBuilder.POST(bodyPublisher);
                    break;
                case "PUT":
                    requestBuilder.PUT(bodyPublisher);
                    break;
                case "DELETE":
                    requestBuilder.DELETE();
                    break;
                case "PATCH":
                    requestBuilder.method("PATCH", bodyPublisher);
                    break;
                case "HEAD":
                    requestBuilder.method("HEAD", HttpRequest.BodyPublishers.noBody());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported HTTP method: " + method);
            }

            return requestBuilder.build();
        } catch (IllegalArgumentException e) {
            throw new AutotaskException("Failed to build HTTP request for " + method + " " + url, e);
        }
    }

    private String buildUrlWithQuery() {
        if (queryParameters.isEmpty()) {
            return url;
        }

        StringBuilder urlBuilder = new StringBuilder(url);
        urlBuilder.append(url.contains("?") ? "&" : "?");

        boolean first = true;
        for (Map.Entry<String, String> param : queryParameters.entrySet()) {
            if (!first) {
                urlBuilder.append("&");
            }
            urlBuilder.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                .append("=")
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            first = false;
        }

        return urlBuilder.toString();
    }

    public String getMethod() {
        return method;
    }

    /**
     * The logical endpoint path this request was created for, e.g. {@code /Tickets/42}.
     */
    public String getPath() {
        return path;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return Map.copyOf(headers);
    }

    public Map<String, String> getQueryParameters() {
        return Map.copyOf(queryParameters);
    }

    public Object getBody() {
        return body;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
