package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Tasks record.
 */
public class Task extends AutotaskRecord {
    public Task() {
    }

    public Task(Map<String, ?> fields) {
        super(fields);
    }
}
