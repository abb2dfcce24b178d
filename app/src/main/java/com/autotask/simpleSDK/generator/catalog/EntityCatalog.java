package com.autotask.simpleSDK.generator.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The list of Autotask entities to generate, read from {@code entities.json}.
 */
public class EntityCatalog {
    public static final String DEFAULT_RESOURCE = "/entities.json";

    private static final Pattern JAVA_IDENTIFIER = Pattern.compile("[A-Z][A-Za-z0-9]*");

    private final List<EntityDefinition> entities;

    public EntityCatalog(List<EntityDefinition> entities) throws CatalogException {
        this.entities = List.copyOf(entities);
        validate();
    }

    public static EntityCatalog load(Path catalogFile) throws CatalogException {
        if (!Files.isRegularFile(catalogFile)) {
            throw new CatalogException("Entity catalog not found: " + catalogFile);
        }
        try (InputStream input = Files.newInputStream(catalogFile)) {
            return read(input, catalogFile.toString());
        } catch (IOException e) {
            throw new CatalogException("Failed to read entity catalog " + catalogFile, e);
        }
    }

    public static EntityCatalog loadDefault() throws CatalogException {
        try (InputStream input = EntityCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new CatalogException("Bundled entity catalog " + DEFAULT_RESOURCE + " is missing");
            }
            return read(input, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new CatalogException("Failed to read bundled entity catalog", e);
        }
    }

    private static EntityCatalog read(InputStream input, String source) throws IOException, CatalogException {
        CatalogFile file = new ObjectMapper().readValue(input, CatalogFile.class);
        if (file.entities == null) {
            throw new CatalogException("Entity catalog " + source + " has no 'entities' array");
        }
        return new EntityCatalog(file.entities);
    }

    public List<EntityDefinition> getEntities() {
        return entities;
    }

    /**
     * Keeps only the named entities (matched on plural or singular name, ignoring case). An empty
     * selection keeps everything.
     */
    public EntityCatalog select(Collection<String> names) throws CatalogException {
        if (names == null || names.isEmpty()) {
            return this;
        }
        List<EntityDefinition> selected = new ArrayList<>();
        for (String name : names) {
            EntityDefinition match = entities.stream()
                .filter(entity -> entity.pluralName().equalsIgnoreCase(name) || entity.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new CatalogException("Entity not found in catalog: " + name));
            if (!selected.contains(match)) {
                selected.add(match);
            }
        }
        return new EntityCatalog(selected);
    }

    private void validate() throws CatalogException {
        Set<String> seen = new HashSet<>();
        for (EntityDefinition entity : entities) {
            if (entity.name() == null || !JAVA_IDENTIFIER.matcher(entity.name()).matches()) {
                throw new CatalogException("Invalid entity name: " + entity.name());
            }
            if (entity.pluralName() == null || !JAVA_IDENTIFIER.matcher(entity.pluralName()).matches()) {
                throw new CatalogException("Invalid plural name for entity " + entity.name() + ": " + entity.pluralName());
            }
            if (entity.name().equals(entity.pluralName())) {
                throw new CatalogException("Entity " + entity.name() + " needs a plural name different from its record name");
            }
            if (!seen.add(entity.pluralName())) {
                throw new CatalogException("Duplicate entity in catalog: " + entity.pluralName());
            }
            if (entity.operations().isEmpty()) {
                throw new CatalogException("Entity " + entity.pluralName() + " supports no operations");
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class CatalogFile {
        @JsonProperty("entities")
        public List<EntityDefinition> entities;
    }
}
