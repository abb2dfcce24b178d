package com.autotask.simpleSDK.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Small helpers shared by the source generators: import blocks, identifier casing, literal escaping.
 */
final class SourceWriter {
    /** Package of the SDK runtime classes the generated code builds on. */
    static final String RUNTIME_PACKAGE = "com.autotask.simpleSDK";

    private SourceWriter() {
    }

    /**
     * Appends the import block: non-JDK imports, a blank line, JDK imports, each group sorted. Imports of
     * classes in {@code currentPackage} are dropped.
     */
    static void appendImports(StringBuilder content, String currentPackage, Set<String> imports) {
        Set<String> libraryImports = new TreeSet<>();
        Set<String> jdkImports = new TreeSet<>();
        for (String qualifiedName : imports) {
            String importPackage = qualifiedName.substring(0, qualifiedName.lastIndexOf('.'));
            if (importPackage.equals(currentPackage)) {
                continue;
            }
            if (qualifiedName.startsWith("java.")) {
                jdkImports.add(qualifiedName);
            } else {
                libraryImports.add(qualifiedName);
            }
        }

        for (String qualifiedName : libraryImports) {
            content.append("import ").append(qualifiedName).append(";\n");
        }
        if (!libraryImports.isEmpty() && !jdkImports.isEmpty()) {
            content.append("\n");
        }
        for (String qualifiedName : jdkImports) {
            content.append("import ").append(qualifiedName).append(";\n");
        }
        if (!libraryImports.isEmpty() || !jdkImports.isEmpty()) {
            content.append("\n");
        }
    }

    static String lowerCamel(String name) {
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }

    static String stringLiteral(String value) {
        String text = value == null ? "" : value;
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String javadocText(String value) {
        String text = value == null ? "" : value.trim();
        text = text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("*/", "*&#47;");
        return text.isEmpty() || text.endsWith(".") ? text : text + ".";
    }

    static Path write(Path outputRoot, String packageName, String className, String content) throws IOException {
        Path directory = outputRoot.resolve(packageName.replace('.', '/'));
        Files.createDirectories(directory);
        Path file = directory.resolve(className + ".java");
        Files.writeString(file, content);
        return file;
    }
}
