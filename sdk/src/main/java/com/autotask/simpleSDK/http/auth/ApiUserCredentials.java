package com.autotask.simpleSDK.http.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API-user credentials: basic authentication plus the tracking identifier the vendor issues per integration.
 */
public class ApiUserCredentials implements AutotaskCredentials {
    private final String username;
    private final String integrationCode;
    private final String secret;

    public ApiUserCredentials(String username, String integrationCode, String secret) {
        this.username = username;
        this.integrationCode = integrationCode;
        this.secret = secret;
    }

    @Override
    public Map<String, String> getAuthenticationHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        String token = Base64.getEncoder()
            .encodeToString((username + ":" + secret).getBytes(StandardCharsets.UTF_8));
        headers.put("Authorization", "Basic " + token);
        headers.put("ApiIntegrationcode", integrationCode);
        return headers;
    }

    @Override
    public String getUsername() {
        return username;
    }

    public String getIntegrationCode() {
        return integrationCode;
    }

    @Override
    public String toString() {
        return "ApiUserCredentials{username=" + username + "}";
    }
}
