package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Quotes record.
 */
public class Quote extends AutotaskRecord {
    public Quote() {
    }

    public Quote(Map<String, ?> fields) {
        super(fields);
    }
}
