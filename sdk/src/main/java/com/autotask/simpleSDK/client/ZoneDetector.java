package com.autotask.simpleSDK.client;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.HttpCallResult;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.http.exceptions.AutotaskConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Finds the API base URL of the zone (datacenter) an API user belongs to.
 *
 * <p>The zone information endpoint answers {@code {"url": "https://webservicesN.autotask.net/ATServicesRest/", ...}};
 * the REST base URL is that URL followed by {@code V1.0}.
 */
public class ZoneDetector {
    public static final String ZONE_INFORMATION_URL = "https://webservices.autotask.net/ATServicesRest/V1.0/zoneInformation";
    static final String API_VERSION_PATH = "V1.0";

    private static final String FAILURE_MESSAGE = "Failed to auto-detect API URL. Please provide apiUrl in config.";

    private final AutotaskHttpClient httpClient;
    private final RequestHandler requestHandler;
    private final String zoneInformationUrl;

    public ZoneDetector(AutotaskHttpClient httpClient, RequestHandler requestHandler) {
        this(httpClient, requestHandler, ZONE_INFORMATION_URL);
    }

    public ZoneDetector(AutotaskHttpClient httpClient, RequestHandler requestHandler, String zoneInformationUrl) {
        this.httpClient = httpClient;
        this.requestHandler = requestHandler;
        this.zoneInformationUrl = zoneInformationUrl;
    }

    /**
     * Resolves the zone base URL for {@code username}. Fails with {@link AutotaskConfigurationException}
     * (field {@code apiUrl}) when the lookup fails or the answer has no URL.
     */
    public CompletableFuture<String> detectApiUrl(String username) {
        requestHandler.getLogger().info("Detecting Autotask zone for API URL user={}", username);
        AutotaskRequest request = httpClient.get(zoneInformationUrl).queryParam("user", username);

        return requestHandler.executeRequest(() -> httpClient.send(request), "/zoneInformation", "GET")
            .handle((result, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    throw new CompletionException(new AutotaskConfigurationException(FAILURE_MESSAGE, "apiUrl", cause));
                }
                String apiUrl = toApiUrl(readZoneUrl(result));
                requestHandler.getLogger().info("Auto-detected API URL: {}", apiUrl);
                return apiUrl;
            });
    }

    private String readZoneUrl(HttpCallResult result) {
        try {
            JsonNode root = httpClient.getObjectMapper().readTree(result.hasBody() ? result.body() : "{}");
            JsonNode url = root.get("url");
            if (url == null || !url.isTextual() || url.asText().isBlank()) {
                throw new CompletionException(new AutotaskConfigurationException(FAILURE_MESSAGE + " Zone information has no url.", "apiUrl"));
            }
            return url.asText();
        } catch (JsonProcessingException e) {
            throw new CompletionException(new AutotaskConfigurationException(FAILURE_MESSAGE, "apiUrl", e));
        }
    }

    static String toApiUrl(String zoneUrl) {
        String base = zoneUrl.trim();
        return (base.endsWith("/") ? base : base + "/") + API_VERSION_PATH;
    }
}
