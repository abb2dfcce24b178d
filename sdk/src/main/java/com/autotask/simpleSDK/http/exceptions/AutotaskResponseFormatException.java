package com.autotask.simpleSDK.http.exceptions;

/**
 * Raised when a response body does not carry the envelope an operation expects.
 */
public class AutotaskResponseFormatException extends AutotaskException {
    private final String endpoint;
    private final String responseBody;

    public AutotaskResponseFormatException(String message, String endpoint, String responseBody) {
        super(message);
        this.endpoint = endpoint;
        this.responseBody = responseBody;
    }

    public AutotaskResponseFormatException(String message, String endpoint, String responseBody, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.responseBody = responseBody;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
