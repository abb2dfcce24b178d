package com.autotask.simpleSDK.entities;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Describes an entity class: its name, REST endpoint, category and supported operations.
 */
public record EntityMetadata(String name, String endpoint, String description, String category,
                             Set<EntityOperation> operations) {

    public EntityMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name is required");
        }
        if (endpoint == null || !endpoint.startsWith("/")) {
            throw new IllegalArgumentException("Entity endpoint must start with '/': " + endpoint);
        }
        operations = operations == null || operations.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(EntityOperation.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(operations));
    }

    public boolean supports(EntityOperation operation) {
        return operations.contains(operation);
    }
}
