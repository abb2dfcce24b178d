package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Projects record.
 */
public class Project extends AutotaskRecord {
    public Project() {
    }

    public Project(Map<String, ?> fields) {
        super(fields);
    }
}
