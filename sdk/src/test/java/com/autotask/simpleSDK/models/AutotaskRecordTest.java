package com.autotask.simpleSDK.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AutotaskRecordTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testReadsEveryFieldInResponseOrder() throws Exception {
        Ticket ticket = objectMapper.readValue("""
            {
              "id": 12,
              "title": "Printer down",
              "status": 1,
              "userDefinedFields": [{"name": "Region", "value": "EMEA"}]
            }
            """, Ticket.class);

        assertEquals(List.of("id", "title", "status", "userDefinedFields"), List.copyOf(ticket.getFields().keySet()));
        assertEquals("Printer down", ticket.get("title"));
        assertEquals(Optional.of(12L), ticket.getId());
        assertInstanceOf(List.class, ticket.get("userDefinedFields"));
    }

    @Test
    void testWritesOnlyItsFields() throws Exception {
        Ticket ticket = new Ticket();
        ticket.set("title", "Printer down").set("companyID", 1);

        assertEquals("{\"title\":\"Printer down\",\"companyID\":1}", objectMapper.writeValueAsString(ticket));
    }

    @Test
    void testIdFallsBackToItemId() {
        assertEquals(Optional.of(101L), new Ticket(Map.of("itemId", 101)).getId());
        assertEquals(Optional.of(5L), new Ticket(Map.of("id", "5")).getId());
        assertEquals(Optional.empty(), new Ticket(Map.of("id", "n/a")).getId());
        assertEquals(Optional.empty(), new Ticket().getId());
    }

    @Test
    void testEqualityDependsOnTypeAndFields() {
        assertEquals(new Ticket(Map.of("id", 1)), new Ticket(Map.of("id", 1)));
        assertNotEquals(new Ticket(Map.of("id", 1)), new Ticket(Map.of("id", 2)));
        assertNotEquals(new Ticket(Map.of("id", 1)), new Task(Map.of("id", 1)));
        assertEquals("Ticket{id=1}", new Ticket(Map.of("id", 1)).toString());
    }

    @Test
    void testFieldsViewIsReadOnly() {
        Ticket ticket = new Ticket(Map.of("id", 1));

        assertThrows(UnsupportedOperationException.class, () -> ticket.getFields().put("title", "x"));
        assertEquals(1, ticket.remove("id"));
        assertFalse(ticket.has("id"));
    }
}
