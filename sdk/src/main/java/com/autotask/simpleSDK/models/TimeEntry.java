package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single TimeEntries record.
 */
public class TimeEntry extends AutotaskRecord {
    public TimeEntry() {
    }

    public TimeEntry(Map<String, ?> fields) {
        super(fields);
    }
}
