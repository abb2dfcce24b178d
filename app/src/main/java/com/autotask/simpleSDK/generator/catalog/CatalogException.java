package com.autotask.simpleSDK.generator.catalog;

/**
 * Raised when the entity catalog cannot be read or describes something the generator cannot emit.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
