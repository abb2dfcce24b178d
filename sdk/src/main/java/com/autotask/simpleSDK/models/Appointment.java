package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Appointments record.
 */
public class Appointment extends AutotaskRecord {
    public Appointment() {
    }

    public Appointment(Map<String, ?> fields) {
        super(fields);
    }
}
