package com.autotask.simpleSDK.http.exceptions;

import java.util.List;
import java.util.Map;

public class AutotaskValidationException extends AutotaskServiceException {
    public AutotaskValidationException(String message, int statusCode, Map<String, String> headers, List<String> errors,
                                       String responseBody, String endpoint, String method) {
        super(message, statusCode, headers, errors, responseBody, endpoint, method);
    }
}
