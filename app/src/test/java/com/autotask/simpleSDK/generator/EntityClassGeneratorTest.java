package com.autotask.simpleSDK.generator;

import com.autotask.simpleSDK.generator.catalog.EntityDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks that entity classes expose exactly the methods their catalog operations allow.
 */
class EntityClassGeneratorTest {

    @TempDir
    Path tempDir;

    private EntityClassGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new EntityClassGenerator("com.example.sdk.entities", "com.example.sdk.models");
    }

    @Test
    void testReadOnlyEntityGetsGetAndListOnly() throws Exception {
        String source = generator.generate(new EntityDefinition("Resource", "Resources",
            "Users and technicians", "core", List.of("GET")));

        assertThat(source).startsWith("package com.example.sdk.entities;\n\n");
        assertThat(source).contains("public class Resources extends BaseEntity<Resource>\n"
            + "        implements Retrievable<Resource>, Listable<Resource> {");
        assertThat(source).contains("public CompletableFuture<ApiResponse<Resource>> get(long id) {");
        assertThat(source).contains("public CompletableFuture<ApiResponse<List<Resource>>> list(QueryOptions query) {");
        assertThat(source).doesNotContain(" create(", " update(", " patch(", " delete(");
        assertThat(source).contains("EnumSet.of(EntityOperation.GET, EntityOperation.LIST)");
        assertThat(source).contains(" * Users and technicians.\n");
        assertThat(source).contains("import com.example.sdk.models.Resource;");
        assertThat(source).contains("import com.autotask.simpleSDK.entities.BaseEntity;");
    }

    @Test
    void testFullEntityGetsEveryOperation() throws Exception {
        String source = generator.generate(new EntityDefinition("TimeEntry", "TimeEntries",
            "Time logged by resources", "time", List.of("GET", "POST", "PUT", "PATCH", "DELETE")));

        assertThat(source).contains("implements Creatable<TimeEntry>, Retrievable<TimeEntry>, Updatable<TimeEntry>, "
            + "Patchable<TimeEntry>, Deletable, Listable<TimeEntry> {");
        assertThat(source).contains("AutotaskRequest request = httpClient.post(ENDPOINT).body(timeEntry);");
        assertThat(source).contains("AutotaskRequest request = httpClient.put(path).body(timeEntry);");
        assertThat(source).contains("AutotaskRequest request = httpClient.patch(path).body(timeEntry);");
        assertThat(source).contains("return executeDeleteRequest(() -> httpClient.send(request), path);");
        assertThat(source).contains("String path = ENDPOINT + \"/query\";");
        assertThat(source).contains(
            "return executeQueryRequest(() -> httpClient.send(httpClient.post(path).body(QueryFilters.searchBody(query))), path);");
        assertThat(source).contains("public static final String ENDPOINT = \"/TimeEntries\";");
    }

    @Test
    void testCreateWithoutReadHasNoListImports() throws Exception {
        String source = generator.generate(new EntityDefinition("Attachment", "Attachments",
            "Files attached to <tickets>", "core", List.of("POST", "DELETE")));

        assertThat(source).doesNotContain("import java.util.List;", "QueryOptions");
        assertThat(source).contains(" * Files attached to &lt;tickets&gt;.\n");
        assertThat(source).contains("\"Files attached to <tickets>\",");
    }

    @Test
    void testWritesIntoPackageDirectory() throws Exception {
        Path written = generator.write(new EntityDefinition("Resource", "Resources", "Users", "core", List.of("GET")), tempDir);

        assertThat(written).isEqualTo(tempDir.resolve("com/example/sdk/entities/Resources.java"));
        assertThat(Files.readString(written)).contains("public class Resources");
    }
}
