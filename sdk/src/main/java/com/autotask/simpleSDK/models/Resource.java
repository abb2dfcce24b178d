package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Resources record.
 */
public class Resource extends AutotaskRecord {
    public Resource() {
    }

    public Resource(Map<String, ?> fields) {
        super(fields);
    }
}
