package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single CompanyLocations record.
 */
public class CompanyLocation extends AutotaskRecord {
    public CompanyLocation() {
    }

    public CompanyLocation(Map<String, ?> fields) {
        super(fields);
    }
}
