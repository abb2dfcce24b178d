package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Contracts record.
 */
public class Contract extends AutotaskRecord {
    public Contract() {
    }

    public Contract(Map<String, ?> fields) {
        super(fields);
    }
}
