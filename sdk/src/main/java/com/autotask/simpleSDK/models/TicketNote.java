package com.autotask.simpleSDK.models;

import java.util.Map;

/**
 * A single TicketNotes record.
 */
public class TicketNote extends AutotaskRecord {
    public TicketNote() {
    }

    public TicketNote(Map<String, ?> fields) {
        super(fields);
    }
}
