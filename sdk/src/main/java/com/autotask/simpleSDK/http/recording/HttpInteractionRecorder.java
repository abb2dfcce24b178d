package com.autotask.simpleSDK.http.recording;

import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.HttpCallResult;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Records Autotask API exchanges as JSON fixtures and replays them later without touching the network.
 *
 * <p>A fixture is keyed by HTTP method, the endpoint path relative to the zone base URL, the query
 * parameters and the request body compared as a JSON tree, so fixtures survive a zone change and key
 * reordering in request bodies. Several fixtures with the same key replay in file-name order, which lets
 * a directory describe a create followed by reads of the same ticket. Request headers are not stored,
 * so credentials never reach disk.
 */
public class HttpInteractionRecorder {
    public enum Mode {
        LIVE,
        RECORD,
        PLAYBACK
    }

    private static final Pattern SEQUENCE_PREFIX = Pattern.compile("^(\\d+)_");
    private static final int MAX_SLUG_LENGTH = 60;

    private final Mode mode;
    private final Path recordingsDirectory;
    private final ObjectMapper objectMapper;
    private final Map<ExchangeKey, Deque<RecordedExchange>> playbackIndex = new HashMap<>();
    private int nextSequence = 1;

    public HttpInteractionRecorder(Mode mode, Path recordingsDirectory) throws AutotaskException {
        this.mode = mode == null ? Mode.LIVE : mode;

        if (this.mode != Mode.LIVE && recordingsDirectory == null) {
            throw new AutotaskException("Recording directory is required for recorder mode: " + this.mode);
        }

        this.recordingsDirectory = recordingsDirectory;
        this.objectMapper = new ObjectMapper();

        if (this.mode == Mode.RECORD) {
            prepareRecordingDirectory();
        } else if (this.mode == Mode.PLAYBACK) {
            loadFixtures();
        }
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isRecording() {
        return mode == Mode.RECORD;
    }

    public boolean isPlayback() {
        return mode == Mode.PLAYBACK;
    }

    public synchronized void record(AutotaskRequest request, HttpCallResult result) throws AutotaskException {
        if (!isRecording()) {
            return;
        }

        ExchangeKey key = keyOf(request);
        RecordedExchange exchange = new RecordedExchange(
            key.method(),
            key.path(),
            key.query().isEmpty() ? null : key.query(),
            key.body(),
            result.statusCode(),
            result.headers().isEmpty() ? null : new TreeMap<>(result.headers()),
            responseTree(result.body()),
            Instant.now().toString()
        );

        String fileName = String.format("%05d_%s_%s.json", nextSequence, key.method(), slug(key.path()));
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(recordingsDirectory.resolve(fileName).toFile(), exchange);
        } catch (IOException e) {
            throw new AutotaskException("Failed to record HTTP exchange " + key.method() + " " + key.path(), e);
        }
        nextSequence++;
    }

    public synchronized HttpCallResult playback(AutotaskRequest request) throws AutotaskException {
        if (!isPlayback()) {
            throw new AutotaskException("Recorder is not in playback mode");
        }

        ExchangeKey key = keyOf(request);
        Deque<RecordedExchange> queue = playbackIndex.get(key);
        if (queue == null || queue.isEmpty()) {
            throw new AutotaskException("No recorded response found for request: " + key.method() + " " + key.path());
        }

        RecordedExchange exchange = queue.pollFirst();
        Map<String, String> headers = exchange.responseHeaders() == null ? Map.of() : exchange.responseHeaders();
        return new HttpCallResult(exchange.status(), Map.copyOf(headers), responseText(exchange.responseBody()));
    }

    private void prepareRecordingDirectory() throws AutotaskException {
        try {
            Files.createDirectories(recordingsDirectory);
            for (Path file : fixtureFiles()) {
                Matcher matcher = SEQUENCE_PREFIX.matcher(file.getFileName().toString());
                if (matcher.find()) {
                    nextSequence = Math.max(nextSequence, Integer.parseInt(matcher.group(1)) + 1);
                }
            }
        } catch (IOException | NumberFormatException e) {
            throw new AutotaskException("Failed to initialize recordings directory: " + recordingsDirectory, e);
        }
    }

    private void loadFixtures() throws AutotaskException {
        try {
            if (!Files.isDirectory(recordingsDirectory)) {
                throw new NoSuchFileException(recordingsDirectory.toString());
            }

            for (Path file : fixtureFiles()) {
                RecordedExchange exchange = objectMapper.readValue(file.toFile(), RecordedExchange.class);
                if (exchange.method() == null || exchange.path() == null) {
                    throw new AutotaskException("Recorded exchange needs a method and a path: " + file);
                }
                if (exchange.status() == null) {
                    throw new AutotaskException("Recorded exchange has no status: " + file);
                }
                ExchangeKey key = new ExchangeKey(
                    exchange.method().toUpperCase(Locale.ROOT),
                    exchange.path(),
                    exchange.query() == null ? Map.of() : new TreeMap<>(exchange.query()),
                    normalizeBody(exchange.requestBody())
                );
                playbackIndex.computeIfAbsent(key, ignored -> new ArrayDeque<>()).add(exchange);
            }
        } catch (NoSuchFileException e) {
            throw new AutotaskException("Playback directory does not exist: " + recordingsDirectory, e);
        } catch (IOException e) {
            throw new AutotaskException("Failed to load recorded HTTP exchanges from: " + recordingsDirectory, e);
        }
    }

    private List<Path> fixtureFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(recordingsDirectory, "*.json")) {
            for (Path file : stream) {
                files.add(file);
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private ExchangeKey keyOf(AutotaskRequest request) throws AutotaskException {
        return new ExchangeKey(
            request.getMethod(),
            request.getPath(),
            new TreeMap<>(request.getQueryParameters()),
            parseBody(request.getSerializedBody())
        );
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return normalizeBody(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static JsonNode normalizeBody(JsonNode body) {
        return body == null || body.isNull() || body.isMissingNode() ? null : body;
    }

    private JsonNode responseTree(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static String responseText(JsonNode body) {
        if (body == null || body.isNull()) {
            return "";
        }
        return body.isTextual() ? body.asText() : body.toString();
    }

    static String slug(String path) {
        String slug = path.replaceAll("[^A-Za-z0-9]+", "-").replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            return "root";
        }
        return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
    }

    private record ExchangeKey(String method, String path, Map<String, String> query, JsonNode body) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RecordedExchange(
        String method,
        String path,
        Map<String, String> query,
        JsonNode requestBody,
        Integer status,
        Map<String, String> responseHeaders,
        JsonNode responseBody,
        String recordedAt
    ) {
    }
}
