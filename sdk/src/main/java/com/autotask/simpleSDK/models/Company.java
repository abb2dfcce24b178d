package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Companies record.
 */
public class Company extends AutotaskRecord {
    public Company() {
    }

    public Company(Map<String, ?> fields) {
        super(fields);
    }
}
