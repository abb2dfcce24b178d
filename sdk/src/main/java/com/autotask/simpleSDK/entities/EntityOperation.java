package com.autotask.simpleSDK.entities;

import java.util.Locale;

/**
 * The operations an entity class can expose, with the HTTP verb each one is sent with.
 */
public enum EntityOperation {
    CREATE("POST"),
    GET("GET"),
    UPDATE("PUT"),
    PATCH("PATCH"),
    DELETE("DELETE"),
    LIST("POST");

    private final String httpMethod;

    EntityOperation(String httpMethod) {
        this.httpMethod = httpMethod;
    }

    public String getHttpMethod() {
        return httpMethod;
    }

    /** Lower-case name as used in the entity catalog and on the command line. */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntityOperation fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Operation name is required");
        }
        for (EntityOperation operation : values()) {
            if (operation.getName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown entity operation: " + name);
    }
}
