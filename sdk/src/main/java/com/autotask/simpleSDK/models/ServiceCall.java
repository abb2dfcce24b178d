package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single ServiceCalls record.
 */
public class ServiceCall extends AutotaskRecord {
    public ServiceCall() {
    }

    public ServiceCall(Map<String, ?> fields) {
        super(fields);
    }
}
