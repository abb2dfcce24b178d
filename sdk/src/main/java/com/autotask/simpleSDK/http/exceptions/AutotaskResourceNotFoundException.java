package com.autotask.simpleSDK.http.exceptions;

import java.util.List;
import java.util.Map;

public class AutotaskResourceNotFoundException extends AutotaskServiceException {
    public AutotaskResourceNotFoundException(String message, Map<String, String> headers, List<String> errors,
                                             String responseBody, String endpoint, String method) {
        super(message, 404, headers, errors, responseBody, endpoint, method);
    }

    /**
     * Resource type taken from the first path segment, e.g. {@code Tickets} for {@code /Tickets/42}.
     */
    public String getResourceType() {
        String endpoint = getEndpoint();
        if (endpoint == null) {
            return null;
        }
        for (String segment : endpoint.split("/")) {
            if (!segment.isEmpty()) {
                return segment;
            }
        }
        return null;
    }
}
