package com.autotask.simpleSDK.generator;

import com.autotask.simpleSDK.generator.catalog.EntityDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Writes the record class of an entity, e.g. {@code TimeEntry extends AutotaskRecord}.
 */
public class ModelGenerator {
    private final String modelsPackage;

    public ModelGenerator(String modelsPackage) {
        this.modelsPackage = modelsPackage;
    }

    public String generate(EntityDefinition entity) {
        String className = entity.name();
        StringBuilder content = new StringBuilder();

        content.append("package ").append(modelsPackage).append(";\n\n");
        SourceWriter.appendImports(content, modelsPackage, Set.of(
            SourceWriter.RUNTIME_PACKAGE + ".models.AutotaskRecord",
            "java.util.Map"
        ));

        content.append("/**\n");
        content.append(" * A single ").append(entity.pluralName()).append(" record.\n");
        content.append(" */\n");
        content.append("public class ").append(className).append(" extends AutotaskRecord {\n");
        content.append("    public ").append(className).append("() {\n");
        content.append("    }\n\n");
        content.append("    public ").append(className).append("(Map<String, ?> fields) {\n");
        content.append("        super(fields);\n");
        content.append("    }\n");
        content.append("}\n");
        return content.toString();
    }

    public Path write(EntityDefinition entity, Path outputRoot) throws IOException {
        return SourceWriter.write(outputRoot, modelsPackage, entity.name(), generate(entity));
    }
}
