package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single Tickets record.
 */
public class Ticket extends AutotaskRecord {
    public Ticket() {
    }

    public Ticket(Map<String, ?> fields) {
        super(fields);
    }
}
