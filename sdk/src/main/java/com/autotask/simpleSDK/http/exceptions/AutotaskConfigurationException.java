package com.autotask.simpleSDK.http.exceptions;

public class AutotaskConfigurationException extends AutotaskException {
    private final String configField;

    public AutotaskConfigurationException(String message, String configField) {
        super(message);
        this.configField = configField;
    }

    public AutotaskConfigurationException(String message, String configField, Throwable cause) {
        super(message, cause);
        this.configField = configField;
    }

    public String getConfigField() {
        return configField;
    }
}
