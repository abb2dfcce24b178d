package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Contacts record.
 */
public class Contact extends AutotaskRecord {
    public Contact() {
    }

    public Contact(Map<String, ?> fields) {
        super(fields);
    }
}
