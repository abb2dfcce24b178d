package com.autotask.simpleSDK.client;

import com.autotask.simpleSDK.http.RequestOptions;
import com.autotask.simpleSDK.http.auth.ApiUserCredentials;
import com.autotask.simpleSDK.http.exceptions.AutotaskConfigurationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Connection settings for an Autotask API user. Without an explicit API URL the zone is looked up
 * from the username.
 */
public final class AutotaskConfig {
    public static final String ENV_USERNAME = "AUTOTASK_USERNAME";
    public static final String ENV_INTEGRATION_CODE = "AUTOTASK_INTEGRATION_CODE";
    public static final String ENV_SECRET = "AUTOTASK_SECRET";
    public static final String ENV_API_URL = "AUTOTASK_API_URL";

    public static final String PROP_USERNAME = "autotask.username";
    public static final String PROP_INTEGRATION_CODE = "autotask.integration-code";
    public static final String PROP_SECRET = "autotask.secret";
    public static final String PROP_API_URL = "autotask.api-url";
    public static final String PROP_TIMEOUT = "autotask.timeout";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String username;
    private final String integrationCode;
    private final String secret;
    private final String apiUrl;
    private final Duration timeout;
    private final RequestOptions requestOptions;

    private AutotaskConfig(Builder builder) {
        this.username = builder.username;
        this.integrationCode = builder.integrationCode;
        this.secret = builder.secret;
        this.apiUrl = builder.apiUrl;
        this.timeout = builder.timeout;
        this.requestOptions = builder.requestOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AutotaskConfig fromEnvironment() throws AutotaskConfigurationException {
        return fromEnvironment(System.getenv());
    }

    static AutotaskConfig fromEnvironment(Map<String, String> environment) throws AutotaskConfigurationException {
        return builder()
            .username(environment.get(ENV_USERNAME))
            .integrationCode(environment.get(ENV_INTEGRATION_CODE))
            .secret(environment.get(ENV_SECRET))
            .apiUrl(environment.get(ENV_API_URL))
            .build();
    }

    public static AutotaskConfig fromProperties(Properties properties) throws AutotaskConfigurationException {
        Builder builder = builder()
            .username(properties.getProperty(PROP_USERNAME))
            .integrationCode(properties.getProperty(PROP_INTEGRATION_CODE))
            .secret(properties.getProperty(PROP_SECRET))
            .apiUrl(properties.getProperty(PROP_API_URL));

        String timeout = properties.getProperty(PROP_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            try {
                builder.timeout(Duration.parse(timeout.trim()));
            } catch (DateTimeParseException e) {
                throw new AutotaskConfigurationException("Invalid timeout '" + timeout + "', expected an ISO-8601 duration such as PT30S",
                    PROP_TIMEOUT, e);
            }
        }
        return builder.build();
    }

    public ApiUserCredentials toCredentials() {
        return new ApiUserCredentials(username, integrationCode, secret);
    }

    public String getUsername() {
        return username;
    }

    public String getIntegrationCode() {
        return integrationCode;
    }

    public String getSecret() {
        return secret;
    }

    public Optional<String> getApiUrl() {
        return Optional.ofNullable(apiUrl);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public RequestOptions getRequestOptions() {
        return requestOptions;
    }

    @Override
    public String toString() {
        return "AutotaskConfig{username='" + username + "', apiUrl=" + apiUrl + ", timeout=" + timeout + "}";
    }

    public static class Builder {
        private String username;
        private String integrationCode;
        private String secret;
        private String apiUrl;
        private Duration timeout = DEFAULT_TIMEOUT;
        private RequestOptions requestOptions = RequestOptions.defaults();

        public Builder username(String username) {
            this.username = trimToNull(username);
            return this;
        }

        public Builder integrationCode(String integrationCode) {
            this.integrationCode = trimToNull(integrationCode);
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret == null || secret.isEmpty() ? null : secret;
            return this;
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = trimToNull(apiUrl);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder requestOptions(RequestOptions requestOptions) {
            this.requestOptions = requestOptions == null ? RequestOptions.defaults() : requestOptions;
            return this;
        }

        public AutotaskConfig build() throws AutotaskConfigurationException {
            require(username, "username");
            require(integrationCode, "integrationCode");
            require(secret, "secret");
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new AutotaskConfigurationException("Timeout must be positive", "timeout");
            }
            if (apiUrl != null && !apiUrl.startsWith("http://") && !apiUrl.startsWith("https://")) {
                throw new AutotaskConfigurationException("API URL must be an http(s) URL: " + apiUrl, "apiUrl");
            }
            return new AutotaskConfig(this);
        }

        private static void require(String value, String field) throws AutotaskConfigurationException {
            if (value == null) {
                throw new AutotaskConfigurationException("Missing required Autotask setting: " + field, field);
            }
        }

        private static String trimToNull(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            return value.trim();
        }
    }
}
