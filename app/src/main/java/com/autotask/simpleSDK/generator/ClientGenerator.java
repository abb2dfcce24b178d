package com.autotask.simpleSDK.generator;

import com.autotask.simpleSDK.entities.EntityOperation;
import com.autotask.simpleSDK.generator.catalog.CatalogException;
import com.autotask.simpleSDK.generator.catalog.EntityCatalog;
import com.autotask.simpleSDK.generator.catalog.EntityDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the {@code AutotaskClient} facade holding one instance of every generated entity class.
 *
 * <p>{@code testConnection()} queries CompanyCategories when the catalog has it, otherwise the first
 * listable entity; a catalog without listable entities gets no connection test.
 */
public class ClientGenerator {
    public static final String CLIENT_CLASS_NAME = "AutotaskClient";
    private static final String CONNECTION_TEST_ENTITY = "CompanyCategories";

    private final String clientPackage;
    private final String entitiesPackage;

    public ClientGenerator(String clientPackage, String entitiesPackage) {
        this.clientPackage = clientPackage;
        this.entitiesPackage = entitiesPackage;
    }

    public String generate(EntityCatalog catalog) throws CatalogException {
        List<EntityDefinition> entities = catalog.getEntities();
        Optional<EntityDefinition> connectionTestEntity = findConnectionTestEntity(entities);

        StringBuilder content = new StringBuilder();
        content.append("package ").append(clientPackage).append(";\n\n");
        SourceWriter.appendImports(content, clientPackage, collectImports(entities, connectionTestEntity.isPresent()));

        content.append("/**\n");
        content.append(" * Entry point to the Autotask REST API with one accessor per entity. All entities share the\n");
        content.append(" * same {@link AutotaskHttpClient} and {@link RequestHandler}.\n");
        content.append(" */\n");
        content.append("public class ").append(CLIENT_CLASS_NAME).append(" {\n");
        content.append("    private final AutotaskHttpClient httpClient;\n");
        content.append("    private final RequestHandler requestHandler;\n");
        content.append("    private final Map<String, BaseEntity<?>> entities;\n");
        for (EntityDefinition entity : entities) {
            content.append("    private final ").append(entity.pluralName()).append(" ")
                .append(SourceWriter.lowerCamel(entity.pluralName())).append(";\n");
        }
        content.append("\n");

        content.append("    public ").append(CLIENT_CLASS_NAME).append("(AutotaskHttpClient httpClient, RequestHandler requestHandler) {\n");
        content.append("        this.httpClient = httpClient;\n");
        content.append("        this.requestHandler = requestHandler;\n");
        for (EntityDefinition entity : entities) {
            content.append("        this.").append(SourceWriter.lowerCamel(entity.pluralName())).append(" = new ")
                .append(entity.pluralName()).append("(httpClient, requestHandler);\n");
        }
        content.append("\n");
        content.append("        Map<String, BaseEntity<?>> byName = new LinkedHashMap<>();\n");
        for (EntityDefinition entity : entities) {
            content.append("        byName.put(").append(entity.pluralName()).append(".METADATA.name(), ")
                .append(SourceWriter.lowerCamel(entity.pluralName())).append(");\n");
        }
        content.append("        this.entities = Collections.unmodifiableMap(byName);\n");
        content.append("    }\n\n");

        content.append("    public static AutotaskClientBuilder builder() {\n");
        content.append("        return new AutotaskClientBuilder();\n");
        content.append("    }\n\n");

        for (EntityDefinition entity : entities) {
            String field = SourceWriter.lowerCamel(entity.pluralName());
            content.append("    public ").append(entity.pluralName()).append(" ").append(field).append("() {\n");
            content.append("        return ").append(field).append(";\n");
            content.append("    }\n\n");
        }

        content.append("    /** All entities keyed by name, in catalog order. */\n");
        content.append("    public Map<String, BaseEntity<?>> entities() {\n");
        content.append("        return entities;\n");
        content.append("    }\n\n");

        content.append("    /** Looks an entity up by name, ignoring case. */\n");
        content.append("    public Optional<BaseEntity<?>> entity(String name) {\n");
        content.append("        for (Map.Entry<String, BaseEntity<?>> entry : entities.entrySet()) {\n");
        content.append("            if (entry.getKey().equalsIgnoreCase(name)) {\n");
        content.append("                return Optional.of(entry.getValue());\n");
        content.append("            }\n");
        content.append("        }\n");
        content.append("        return Optional.empty();\n");
        content.append("    }\n\n");

        if (connectionTestEntity.isPresent()) {
            String pluralName = connectionTestEntity.get().pluralName();
            content.append("    /**\n");
            content.append("     * Runs a one-record ").append(pluralName).append(" query. Resolves {@code false} instead of failing\n");
            content.append("     * when the API cannot be reached or rejects the credentials.\n");
            content.append("     */\n");
            content.append("    public CompletableFuture<Boolean> testConnection() {\n");
            content.append("        return ").append(SourceWriter.lowerCamel(pluralName)).append(".list(QueryOptions.builder().pageSize(1).build())\n");
            content.append("            .handle((response, error) -> {\n");
            content.append("                if (error != null) {\n");
            content.append("                    Throwable cause = error.getCause() != null ? error.getCause() : error;\n");
            content.append("                    requestHandler.getLogger().warn(\"Connection test failed: {}\", cause.getMessage());\n");
            content.append("                    return false;\n");
            content.append("                }\n");
            content.append("                return true;\n");
            content.append("            });\n");
            content.append("    }\n\n");
        }

        content.append("    public AutotaskHttpClient getHttpClient() {\n");
        content.append("        return httpClient;\n");
        content.append("    }\n\n");
        content.append("    public RequestHandler getRequestHandler() {\n");
        content.append("        return requestHandler;\n");
        content.append("    }\n");
        content.append("}\n");
        return content.toString();
    }

    public Path write(EntityCatalog catalog, Path outputRoot) throws IOException, CatalogException {
        return SourceWriter.write(outputRoot, clientPackage, CLIENT_CLASS_NAME, generate(catalog));
    }

    private Set<String> collectImports(List<EntityDefinition> entities, boolean withConnectionTest) {
        String runtime = SourceWriter.RUNTIME_PACKAGE;
        Set<String> imports = new HashSet<>();
        imports.add(runtime + ".client.AutotaskClientBuilder");
        imports.add(runtime + ".entities.BaseEntity");
        imports.add(runtime + ".http.AutotaskHttpClient");
        imports.add(runtime + ".http.RequestHandler");
        imports.add("java.util.Collections");
        imports.add("java.util.LinkedHashMap");
        imports.add("java.util.Map");
        imports.add("java.util.Optional");
        for (EntityDefinition entity : entities) {
            imports.add(entitiesPackage + "." + entity.pluralName());
        }
        if (withConnectionTest) {
            imports.add(runtime + ".query.QueryOptions");
            imports.add("java.util.concurrent.CompletableFuture");
        }
        return imports;
    }

    private Optional<EntityDefinition> findConnectionTestEntity(List<EntityDefinition> entities) throws CatalogException {
        EntityDefinition firstListable = null;
        for (EntityDefinition entity : entities) {
            if (!entity.operations().contains(EntityOperation.LIST)) {
                continue;
            }
            if (CONNECTION_TEST_ENTITY.equals(entity.pluralName())) {
                return Optional.of(entity);
            }
            if (firstListable == null) {
                firstListable = entity;
            }
        }
        return Optional.ofNullable(firstListable);
    }
}
