package com.autotask.simpleSDK.client;

import com.autotask.simpleSDK.http.exceptions.AutotaskConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AutotaskConfigTest {

    @Test
    void testReadsEnvironment() throws Exception {
        AutotaskConfig config = AutotaskConfig.fromEnvironment(Map.of(
            AutotaskConfig.ENV_USERNAME, "api@example.com",
            AutotaskConfig.ENV_INTEGRATION_CODE, "CODE",
            AutotaskConfig.ENV_SECRET, "secret",
            AutotaskConfig.ENV_API_URL, "https://webservices2.autotask.net/ATServicesRest/V1.0"
        ));

        assertEquals("api@example.com", config.getUsername());
        assertEquals("CODE", config.getIntegrationCode());
        assertEquals(Optional.of("https://webservices2.autotask.net/ATServicesRest/V1.0"), config.getApiUrl());
        assertEquals(AutotaskConfig.DEFAULT_TIMEOUT, config.getTimeout());
    }

    @Test
    void testApiUrlIsOptional() throws Exception {
        AutotaskConfig config = AutotaskConfig.fromEnvironment(Map.of(
            AutotaskConfig.ENV_USERNAME, "api@example.com",
            AutotaskConfig.ENV_INTEGRATION_CODE, "CODE",
            AutotaskConfig.ENV_SECRET, "secret",
            AutotaskConfig.ENV_API_URL, "  "
        ));

        assertTrue(config.getApiUrl().isEmpty());
    }

    @Test
    void testMissingSettingNamesTheField() {
        AutotaskConfigurationException error = assertThrows(AutotaskConfigurationException.class,
            () -> AutotaskConfig.fromEnvironment(Map.of(
                AutotaskConfig.ENV_USERNAME, "api@example.com",
                AutotaskConfig.ENV_SECRET, "secret"
            )));

        assertEquals("integrationCode", error.getConfigField());
        assertEquals("Missing required Autotask setting: integrationCode", error.getMessage());
    }

    @Test
    void testReadsPropertiesWithTimeout() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(AutotaskConfig.PROP_USERNAME, "api@example.com");
        properties.setProperty(AutotaskConfig.PROP_INTEGRATION_CODE, "CODE");
        properties.setProperty(AutotaskConfig.PROP_SECRET, "secret");
        properties.setProperty(AutotaskConfig.PROP_TIMEOUT, "PT45S");

        AutotaskConfig config = AutotaskConfig.fromProperties(properties);

        assertEquals(Duration.ofSeconds(45), config.getTimeout());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void testRejectsUnreadableTimeout() {
        Properties properties = new Properties();
        properties.setProperty(AutotaskConfig.PROP_USERNAME, "api@example.com");
        properties.setProperty(AutotaskConfig.PROP_INTEGRATION_CODE, "CODE");
        properties.setProperty(AutotaskConfig.PROP_SECRET, "secret");
        properties.setProperty(AutotaskConfig.PROP_TIMEOUT, "30 seconds");

        AutotaskConfigurationException error = assertThrows(AutotaskConfigurationException.class,
            () -> AutotaskConfig.fromProperties(properties));
        assertEquals(AutotaskConfig.PROP_TIMEOUT, error.getConfigField());
    }

    @Test
    void testRejectsNonHttpApiUrlAndNonPositiveTimeout() {
        AutotaskConfigurationException badUrl = assertThrows(AutotaskConfigurationException.class,
            () -> validBuilder().apiUrl("ftp://example.com").build());
        assertEquals("apiUrl", badUrl.getConfigField());

        AutotaskConfigurationException badTimeout = assertThrows(AutotaskConfigurationException.class,
            () -> validBuilder().timeout(Duration.ZERO).build());
        assertEquals("timeout", badTimeout.getConfigField());
    }

    @Test
    void testCredentialsCarryUserAndIntegrationCode() throws Exception {
        Map<String, String> headers = validBuilder().build().toCredentials().getAuthenticationHeaders();

        assertEquals("CODE", headers.get("ApiIntegrationcode"));
        assertTrue(headers.get("Authorization").startsWith("Basic "));
    }

    private static AutotaskConfig.Builder validBuilder() {
        return AutotaskConfig.builder()
            .username("api@example.com")
            .integrationCode("CODE")
            .secret("secret");
    }
}
