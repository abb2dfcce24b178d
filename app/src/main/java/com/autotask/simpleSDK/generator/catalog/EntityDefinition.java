package com.autotask.simpleSDK.generator.catalog;

import com.autotask.simpleSDK.entities.EntityOperation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One entry of the entity catalog.
 *
 * @param name                singular record name, e.g. {@code TimeEntry}
 * @param pluralName          entity class name and REST path segment, e.g. {@code TimeEntries}
 * @param description         one-line description carried into Javadoc and metadata
 * @param category            grouping used by the catalog, e.g. {@code ticketing}
 * @param supportedOperations HTTP verbs ({@code GET}, {@code POST}, {@code PUT}, {@code PATCH},
 *                            {@code DELETE}) or operation names ({@code create}, {@code list}, ...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("pluralName") String pluralName,
    @JsonProperty("description") String description,
    @JsonProperty("category") String category,
    @JsonProperty("supportedOperations") List<String> supportedOperations
) {

    public String endpoint() {
        return "/" + pluralName;
    }

    /**
     * Maps the catalog's operation list to entity operations. {@code GET} grants both single reads and
     * list queries.
     */
    public Set<EntityOperation> operations() throws CatalogException {
        Set<EntityOperation> operations = EnumSet.noneOf(EntityOperation.class);
        if (supportedOperations == null) {
            return operations;
        }
        for (String supported : supportedOperations) {
            String value = supported == null ? "" : supported.trim();
            switch (value.toUpperCase(Locale.ROOT)) {
                case "GET":
                    operations.add(EntityOperation.GET);
                    operations.add(EntityOperation.LIST);
                    break;
                case "POST":
                    operations.add(EntityOperation.CREATE);
                    break;
                case "PUT":
                    operations.add(EntityOperation.UPDATE);
                    break;
                case "PATCH":
                    operations.add(EntityOperation.PATCH);
                    break;
                case "DELETE":
                    operations.add(EntityOperation.DELETE);
                    break;
                default:
                    try {
                        operations.add(EntityOperation.fromName(value));
                    } catch (IllegalArgumentException e) {
                        throw new CatalogException("Entity " + pluralName + " lists unknown operation '" + supported + "'", e);
                    }
            }
        }
        return operations;
    }
}
