package com.autotask.simpleSDK.http.exceptions;

import java.util.List;
import java.util.Map;

public class AutotaskRateLimitException extends AutotaskServiceException {
    public AutotaskRateLimitException(String message, Map<String, String> headers, List<String> errors,
                                      String responseBody, String endpoint, String method) {
        super(message, 429, headers, errors, responseBody, endpoint, method);
    }

    public String getRetryAfter() {
        return getHeader("Retry-After");
    }
}
