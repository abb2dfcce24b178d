package com.autotask.simpleSDK.generator.catalog;

import com.autotask.simpleSDK.entities.EntityOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledCatalogListsEveryEntity() throws Exception {
        EntityCatalog catalog = EntityCatalog.loadDefault();

        assertThat(catalog.getEntities())
            .extracting(EntityDefinition::pluralName)
            .containsExactly("Appointments", "Companies", "CompanyCategories", "CompanyLocations", "Contacts",
                "Contracts", "Projects", "Quotes", "Resources", "ServiceCalls", "Tasks", "TicketNotes",
                "Tickets", "TimeEntries");
    }

    @Test
    void testHttpVerbsMapToOperations() throws Exception {
        EntityDefinition readOnly = new EntityDefinition("Resource", "Resources", "Users", "core", List.of("GET"));
        EntityDefinition full = new EntityDefinition("TimeEntry", "TimeEntries", "Time", "time",
            List.of("GET", "POST", "PUT", "PATCH", "DELETE"));

        assertThat(readOnly.operations()).containsExactly(EntityOperation.GET, EntityOperation.LIST);
        assertThat(full.operations()).containsExactly(EntityOperation.values());
        assertThat(full.endpoint()).isEqualTo("/TimeEntries");
    }

    @Test
    void testOperationNamesAreAccepted() throws Exception {
        EntityDefinition entity = new EntityDefinition("Note", "Notes", "Notes", "core", List.of("create", "list"));

        assertThat(entity.operations()).containsExactly(EntityOperation.CREATE, EntityOperation.LIST);
    }

    @Test
    void testUnknownOperationIsRejected() {
        EntityDefinition entity = new EntityDefinition("Note", "Notes", "Notes", "core", List.of("GET", "MERGE"));

        assertThatThrownBy(entity::operations)
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("MERGE");
    }

    @Test
    void testSelectMatchesPluralOrRecordNameIgnoringCase() throws Exception {
        EntityCatalog selected = EntityCatalog.loadDefault().select(List.of("tickets", "TimeEntry", "Tickets"));

        assertThat(selected.getEntities())
            .extracting(EntityDefinition::pluralName)
            .containsExactly("Tickets", "TimeEntries");
    }

    @Test
    void testSelectRejectsUnknownEntity() {
        assertThatThrownBy(() -> EntityCatalog.loadDefault().select(List.of("Invoices")))
            .isInstanceOf(CatalogException.class)
            .hasMessage("Entity not found in catalog: Invoices");
    }

    @Test
    void testLoadsCatalogFile() throws Exception {
        Path file = tempDir.resolve("entities.json");
        Files.writeString(file, """
            {
              "version": 2,
              "entities": [
                {
                  "name": "Invoice",
                  "pluralName": "Invoices",
                  "description": "Billing invoices",
                  "category": "financial",
                  "supportedOperations": ["GET"],
                  "fieldCount": 31
                }
              ]
            }
            """);

        EntityCatalog catalog = EntityCatalog.load(file);

        assertThat(catalog.getEntities()).hasSize(1);
        assertThat(catalog.getEntities().get(0).category()).isEqualTo("financial");
    }

    @Test
    void testRejectsInvalidEntries() {
        assertThatThrownBy(() -> new EntityCatalog(List.of(
            new EntityDefinition("ticket", "Tickets", "", "core", List.of("GET")))))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("Invalid entity name");

        assertThatThrownBy(() -> new EntityCatalog(List.of(
            new EntityDefinition("Ticket", "Tickets", "", "core", List.of("GET")),
            new EntityDefinition("Ticket", "Tickets", "", "core", List.of("GET")))))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("Duplicate entity");

        assertThatThrownBy(() -> new EntityCatalog(List.of(
            new EntityDefinition("Ticket", "Tickets", "", "core", List.of()))))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("supports no operations");

        assertThatThrownBy(() -> new EntityCatalog(List.of(
            new EntityDefinition("Staff", "Staff", "", "core", List.of("GET")))))
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("plural name");
    }

    @Test
    void testMissingCatalogFile() {
        assertThatThrownBy(() -> EntityCatalog.load(tempDir.resolve("missing.json")))
            .isInstanceOf(CatalogException.class)
            .hasMessageStartingWith("Entity catalog not found");
    }
}
