package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single CompanyCategories record.
 */
public class CompanyCategory extends AutotaskRecord {
    public CompanyCategory() {
    }

    public CompanyCategory(Map<String, ?> fields) {
        super(fields);
    }
}
