package com.autotask.simpleSDK.http.exceptions;

import java.util.List;
import java.util.Map;

public class AutotaskServiceException extends AutotaskException {
    private final int statusCode;
    private final Map<String, String> headers;
    private final List<String> errors;
    private final String responseBody;
    private final String endpoint;
    private final String method;

    public AutotaskServiceException(String message, int statusCode, Map<String, String> headers, List<String> errors,
                                    String responseBody, String endpoint, String method) {
        super(message);
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.responseBody = responseBody;
        this.endpoint = endpoint;
        this.method = method;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey().equalsIgnoreCase(name)) {
                return header.getValue();
            }
        }
        return null;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getMethod() {
        return method;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
}
