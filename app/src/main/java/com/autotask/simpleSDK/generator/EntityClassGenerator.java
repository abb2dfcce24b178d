package com.autotask.simpleSDK.generator;

import com.autotask.simpleSDK.entities.EntityOperation;
import com.autotask.simpleSDK.generator.catalog.CatalogException;
import com.autotask.simpleSDK.generator.catalog.EntityDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes an entity class: the capability interfaces its operations grant, its {@code EntityMetadata},
 * and one method per operation delegating to {@code BaseEntity}.
 *
 * <pre>
 * public class TimeEntries extends BaseEntity&lt;TimeEntry&gt; implements Creatable&lt;TimeEntry&gt;, ... {
 *     public CompletableFuture&lt;ApiResponse&lt;TimeEntry&gt;&gt; get(long id) { ... }
 * }
 * </pre>
 */
public class EntityClassGenerator {
    private final String entitiesPackage;
    private final String modelsPackage;

    public EntityClassGenerator(String entitiesPackage, String modelsPackage) {
        this.entitiesPackage = entitiesPackage;
        this.modelsPackage = modelsPackage;
    }

    public String generate(EntityDefinition entity) throws CatalogException {
        Set<EntityOperation> operations = entity.operations();
        String className = entity.pluralName();
        String recordType = entity.name();

        StringBuilder content = new StringBuilder();
        content.append("package ").append(entitiesPackage).append(";\n\n");
        SourceWriter.appendImports(content, entitiesPackage, collectImports(entity, operations));

        content.append("/**\n");
        content.append(" * ").append(SourceWriter.javadocText(entity.description())).append("\n");
        content.append(" *\n");
        content.append(" * <p>Category: ").append(entity.category()).append(". Operations: ")
            .append(operations.stream().map(EntityOperation::getName).collect(Collectors.joining(", ")))
            .append(".\n");
        content.append(" */\n");

        content.append("public class ").append(className).append(" extends BaseEntity<").append(recordType).append(">\n");
        content.append("        implements ").append(String.join(", ", capabilityInterfaces(operations, recordType))).append(" {\n");

        content.append("    public static final String ENDPOINT = ").append(SourceWriter.stringLiteral(entity.endpoint())).append(";\n");
        content.append("    public static final EntityMetadata METADATA = new EntityMetadata(\n");
        content.append("        ").append(SourceWriter.stringLiteral(className)).append(",\n");
        content.append("        ENDPOINT,\n");
        content.append("        ").append(SourceWriter.stringLiteral(entity.description())).append(",\n");
        content.append("        ").append(SourceWriter.stringLiteral(entity.category())).append(",\n");
        content.append("        EnumSet.of(")
            .append(operations.stream().map(operation -> "EntityOperation." + operation.name()).collect(Collectors.joining(", ")))
            .append(")\n");
        content.append("    );\n\n");

        content.append("    public ").append(className).append("(AutotaskHttpClient httpClient, RequestHandler requestHandler) {\n");
        content.append("        super(httpClient, requestHandler, ").append(recordType).append(".class, METADATA);\n");
        content.append("    }\n");

        for (EntityOperation operation : operations) {
            content.append("\n");
            appendOperation(content, operation, className, recordType);
        }

        content.append("}\n");
        return content.toString();
    }

    public Path write(EntityDefinition entity, Path outputRoot) throws IOException, CatalogException {
        return SourceWriter.write(outputRoot, entitiesPackage, entity.pluralName(), generate(entity));
    }

    private Set<String> collectImports(EntityDefinition entity, Set<EntityOperation> operations) {
        String runtime = SourceWriter.RUNTIME_PACKAGE;
        Set<String> imports = new HashSet<>();
        imports.add(runtime + ".entities.BaseEntity");
        imports.add(runtime + ".entities.EntityMetadata");
        imports.add(runtime + ".entities.EntityOperation");
        imports.add(runtime + ".http.AutotaskHttpClient");
        imports.add(runtime + ".http.AutotaskRequest");
        imports.add(runtime + ".http.RequestHandler");
        imports.add(modelsPackage + "." + entity.name());
        imports.add("java.util.EnumSet");
        imports.add("java.util.concurrent.CompletableFuture");

        for (EntityOperation operation : operations) {
            imports.add(runtime + ".entities." + capabilityName(operation));
            if (operation != EntityOperation.DELETE) {
                imports.add(runtime + ".models.ApiResponse");
            }
        }
        if (operations.contains(EntityOperation.LIST)) {
            imports.add(runtime + ".query.QueryFilters");
            imports.add(runtime + ".query.QueryOptions");
            imports.add("java.util.List");
        }
        return imports;
    }

    private List<String> capabilityInterfaces(Set<EntityOperation> operations, String recordType) {
        List<String> interfaces = new ArrayList<>();
        for (EntityOperation operation : operations) {
            String capability = capabilityName(operation);
            interfaces.add(operation == EntityOperation.DELETE ? capability : capability + "<" + recordType + ">");
        }
        return interfaces;
    }

    static String capabilityName(EntityOperation operation) {
        switch (operation) {
            case CREATE:
                return "Creatable";
            case GET:
                return "Retrievable";
            case UPDATE:
                return "Updatable";
            case PATCH:
                return "Patchable";
            case DELETE:
                return "Deletable";
            case LIST:
                return "Listable";
            default:
                throw new IllegalArgumentException("No capability interface for " + operation);
        }
    }

    private void appendOperation(StringBuilder content, EntityOperation operation, String className, String recordType) {
        String recordVariable = SourceWriter.lowerCamel(recordType);
        content.append("    @Override\n");

        switch (operation) {
            case CREATE:
                content.append("    public CompletableFuture<ApiResponse<").append(recordType).append(">> create(")
                    .append(recordType).append(" ").append(recordVariable).append(") {\n");
                content.append("        logger.debug(\"Creating ").append(className).append(" record\");\n");
                content.append("        AutotaskRequest request = httpClient.post(ENDPOINT).body(").append(recordVariable).append(");\n");
                content.append("        return executeRequest(() -> httpClient.send(request), ENDPOINT, \"POST\");\n");
                break;
            case GET:
                content.append("    public CompletableFuture<ApiResponse<").append(recordType).append(">> get(long id) {\n");
                content.append("        logger.debug(\"Getting ").append(className).append(" id={}\", id);\n");
                content.append("        String path = ENDPOINT + \"/\" + id;\n");
                content.append("        AutotaskRequest request = httpClient.get(path);\n");
                content.append("        return executeRequest(() -> httpClient.send(request), path, \"GET\");\n");
                break;
            case UPDATE:
                appendWriteById(content, "update", "Updating", "put", "PUT", className, recordType, recordVariable);
                break;
            case PATCH:
                appendWriteById(content, "patch", "Patching", "patch", "PATCH", className, recordType, recordVariable);
                break;
            case DELETE:
                content.append("    public CompletableFuture<Void> delete(long id) {\n");
                content.append("        logger.debug(\"Deleting ").append(className).append(" id={}\", id);\n");
                content.append("        String path = ENDPOINT + \"/\" + id;\n");
                content.append("        AutotaskRequest request = httpClient.delete(path);\n");
                content.append("        return executeDeleteRequest(() -> httpClient.send(request), path);\n");
                break;
            case LIST:
                content.append("    public CompletableFuture<ApiResponse<List<").append(recordType).append(">>> list(QueryOptions query) {\n");
                content.append("        logger.debug(\"Listing ").append(className).append(" query={}\", query);\n");
                content.append("        String path = ENDPOINT + \"/query\";\n");
                content.append("        return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);\n");
                break;
            default:
                throw new IllegalArgumentException("Unsupported operation " + operation);
        }

        content.append("    }\n");
    }

    private void appendWriteById(StringBuilder content, String methodName, String verb, String factory, String httpMethod,
                                 String className, String recordType, String recordVariable) {
        content.append("    public CompletableFuture<ApiResponse<").append(recordType).append(">> ").append(methodName)
            .append("(long id, ").append(recordType).append(" ").append(recordVariable).append(") {\n");
        content.append("        logger.debug(\"").append(verb).append(" ").append(className).append(" id={}\", id);\n");
        content.append("        String path = ENDPOINT + \"/\" + id;\n");
        content.append("        AutotaskRequest request = httpClient.").append(factory).append("(path).body(").append(recordVariable).append(");\n");
        content.append("        return executeRequest(() -> httpClient.send(request), path, \"").append(httpMethod).append("\");\n");
    }
}
