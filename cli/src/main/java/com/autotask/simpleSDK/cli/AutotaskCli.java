package com.autotask.simpleSDK.cli;

import com.autotask.simpleSDK.client.AutotaskClient;
import com.autotask.simpleSDK.client.AutotaskConfig;
import com.autotask.simpleSDK.entities.BaseEntity;
import com.autotask.simpleSDK.entities.Creatable;
import com.autotask.simpleSDK.entities.Deletable;
import com.autotask.simpleSDK.entities.EntityOperation;
import com.autotask.simpleSDK.entities.Listable;
import com.autotask.simpleSDK.entities.Patchable;
import com.autotask.simpleSDK.entities.Retrievable;
import com.autotask.simpleSDK.entities.Updatable;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.autotask.simpleSDK.http.exceptions.AutotaskServiceException;
import com.autotask.simpleSDK.http.recording.HttpInteractionRecorder;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.AutotaskRecord;
import com.autotask.simpleSDK.query.FilterPredicate;
import com.autotask.simpleSDK.query.QueryOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

@CommandLine.Command(
    name = "autotask",
    description = "Call the Autotask REST API: autotask <entity> <create|get|update|patch|delete|list> [args]",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT",
    footer = {
        "",
        "Examples:",
        "  autotask Companies get 12",
        "  autotask Tickets list '{\"filter\":{\"status\":1},\"pageSize\":10}'",
        "  autotask TimeEntries create '{\"ticketID\":5,\"hoursWorked\":1.5}'",
        "  autotask Contacts patch 7 '{\"emailAddress\":\"a@example.com\"}'",
        "",
        "Credentials come from AUTOTASK_USERNAME, AUTOTASK_INTEGRATION_CODE, AUTOTASK_SECRET",
        "and AUTOTASK_API_URL unless --config names a properties file."
    }
)
public class AutotaskCli implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(AutotaskCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Entity name, e.g. Companies or TimeEntries")
    private String entityName;

    @CommandLine.Parameters(index = "1", description = "Operation: create, get, update, patch, delete or list")
    private String operationName;

    @CommandLine.Parameters(index = "2..*", arity = "0..*", description = "Operation arguments: an id and/or a JSON document")
    private List<String> arguments = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Properties file with autotask.username, autotask.integration-code, autotask.secret and autotask.api-url"
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-m", "--mode"},
        description = "How HTTP calls are handled: live, record or play (default: live)",
        converter = RecorderModeConverter.class,
        defaultValue = "live"
    )
    private HttpInteractionRecorder.Mode mode;

    @CommandLine.Option(
        names = {"-r", "--recordings-dir"},
        description = "Directory to read/write recorded HTTP exchanges (default: recordings)",
        defaultValue = "recordings"
    )
    private Path recordingsDirectory;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AutotaskCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EntityOperation operation;
        try {
            operation = EntityOperation.fromName(operationName);
        } catch (IllegalArgumentException e) {
            err.println("Unknown operation '" + operationName + "'. Use one of: create, get, update, patch, delete, list");
            return EXIT_USAGE;
        }

        try {
            AutotaskClient client = createClient();
            BaseEntity<?> entity = client.entity(entityName).orElse(null);
            if (entity == null) {
                err.println("Unknown entity '" + entityName + "'. Available entities: " + String.join(", ", client.entities().keySet()));
                return EXIT_USAGE;
            }
            if (!entity.getMetadata().supports(operation)) {
                err.println("Operation '" + operation.getName() + "' is not supported by " + entity.getMetadata().name()
                    + ". Supported operations: " + entity.getMetadata().operations().stream()
                        .map(EntityOperation::getName)
                        .collect(Collectors.joining(", ")));
                return EXIT_USAGE;
            }

            Object result = execute(entity, operation);
            out.println(objectMapper.writeValueAsString(result));
            out.flush();
            return EXIT_OK;
        } catch (AutotaskServiceException e) {
            logger.debug("Request failed", e);
            err.println("Error: " + e.getMessage() + " (HTTP " + e.getStatusCode() + " " + e.getMethod() + " " + e.getEndpoint() + ")");
            return EXIT_FAILURE;
        } catch (AutotaskException | IOException e) {
            logger.debug("Command failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends AutotaskRecord> Object execute(BaseEntity<T> entity, EntityOperation operation)
            throws AutotaskException, JsonProcessingException {
        switch (operation) {
            case CREATE:
                return await(((Creatable<T>) entity).create(entity.newRecord(readObject(argument(0, "record JSON")))));
            case GET:
                return await(((Retrievable<T>) entity).get(readId(argument(0, "id"))));
            case UPDATE:
                return await(((Updatable<T>) entity).update(readId(argument(0, "id")), entity.newRecord(readObject(argument(1, "record JSON")))));
            case PATCH:
                return await(((Patchable<T>) entity).patch(readId(argument(0, "id")), entity.newRecord(readObject(argument(1, "record JSON")))));
            case DELETE:
                long id = readId(argument(0, "id"));
                await(((Deletable) entity).delete(id));
                Map<String, Object> deleted = new LinkedHashMap<>();
                deleted.put("id", id);
                deleted.put("deleted", true);
                return deleted;
            case LIST:
                return await(((Listable<T>) entity).list(readQuery(arguments.isEmpty() ? null : arguments.get(0))));
            default:
                throw new IllegalStateException("Unhandled operation " + operation);
        }
    }

    private AutotaskClient createClient() throws AutotaskException, IOException {
        AutotaskConfig config = configFile != null ? AutotaskConfig.fromProperties(loadProperties(configFile)) : AutotaskConfig.fromEnvironment();

        HttpInteractionRecorder recorder = null;
        if (mode != HttpInteractionRecorder.Mode.LIVE) {
            recorder = new HttpInteractionRecorder(mode, recordingsDirectory.toAbsolutePath());
            logger.info("HTTP mode {} using {}", mode, recordingsDirectory.toAbsolutePath());
        }

        return AutotaskClient.builder()
            .config(config)
            .recorder(recorder)
            .build();
    }

    private static Properties loadProperties(Path file) throws IOException {
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(file)) {
            properties.load(input);
        }
        return properties;
    }

    private <R> R await(CompletableFuture<R> future) throws AutotaskException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AutotaskException("Interrupted while waiting for the Autotask API", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AutotaskException) {
                throw (AutotaskException) e.getCause();
            }
            throw new AutotaskException("Request failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private String argument(int index, String name) {
        if (arguments.size() <= index) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Missing " + name + " for '" + operationName + "'");
        }
        return arguments.get(index);
    }

    private long readId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid id '" + value + "', expected a number");
        }
    }

    private Map<String, Object> readObject(String json) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Expected a JSON object but got: " + json);
        }
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    /**
     * Reads {@code {"filter": {...} | [...], "sort": "...", "page": n, "pageSize": n}}.
     */
    QueryOptions readQuery(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return QueryOptions.none();
        }
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Expected a JSON query object but got: " + json);
        }

        QueryOptions.Builder query = QueryOptions.builder();
        JsonNode filter = node.get("filter");
        if (filter != null && filter.isArray()) {
            query.filter(objectMapper.convertValue(filter, new TypeReference<List<FilterPredicate>>() { }));
        } else if (filter != null && filter.isObject()) {
            query.filter(objectMapper.convertValue(filter, new TypeReference<LinkedHashMap<String, Object>>() { }));
        } else if (filter != null && !filter.isNull()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Query filter must be a JSON object or array");
        }
        if (node.hasNonNull("sort")) {
            query.sort(node.get("sort").asText());
        }
        if (node.hasNonNull("page")) {
            query.page(node.get("page").asInt());
        }
        if (node.hasNonNull("pageSize")) {
            query.pageSize(node.get("pageSize").asInt());
        }
        return query.build();
    }

    static class RecorderModeConverter implements CommandLine.ITypeConverter<HttpInteractionRecorder.Mode> {
        @Override
        public HttpInteractionRecorder.Mode convert(String value) {
            switch (value.toLowerCase(Locale.ROOT)) {
                case "live":
                    return HttpInteractionRecorder.Mode.LIVE;
                case "record":
                    return HttpInteractionRecorder.Mode.RECORD;
                case "play":
                case "playback":
                    return HttpInteractionRecorder.Mode.PLAYBACK;
                default:
                    throw new CommandLine.TypeConversionException("Unknown mode: " + value + ". Supported values: live, record, play");
            }
        }
    }
}
