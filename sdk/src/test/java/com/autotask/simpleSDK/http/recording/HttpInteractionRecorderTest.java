package com.autotask.simpleSDK.http.recording;

import com.autotask.simpleSDK.http.AutotaskRequest;
import com.autotask.simpleSDK.http.HttpCallResult;
import com.autotask.simpleSDK.http.auth.ApiUserCredentials;
import com.autotask.simpleSDK.http.auth.AutotaskCredentials;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class HttpInteractionRecorderTest {
    private static final String ZONE_ONE = "https://webservices2.autotask.net/ATServicesRest/V1.0";
    private static final String ZONE_TWO = "https://webservices15.autotask.net/ATServicesRest/V1.0";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path recordings;

    @Test
    void testRecordedExchangeIsReplayed() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        AutotaskRequest create = request(ZONE_ONE, "POST", "/Tickets", null).body(Map.of("title", "Printer down"));
        recorder.record(create, new HttpCallResult(200, Map.of("Content-Type", "application/json"), "{\"itemId\":101}"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);
        HttpCallResult replayed = playback.playback(create);

        assertEquals(200, replayed.statusCode());
        assertEquals("{\"itemId\":101}", replayed.body());
        assertEquals("application/json", replayed.headers().get("Content-Type"));
    }

    @Test
    void testFixtureIsWrittenAgainstTheEndpointPath() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        AutotaskCredentials credentials = new ApiUserCredentials("api@example.com", "INTEGRATION", "s3cret");

        recorder.record(request(ZONE_ONE, "PATCH", "/Tickets/9001", credentials).body(Map.of("status", 5)),
            new HttpCallResult(200, Map.of(), "{\"itemId\":9001}"));

        List<Path> files = listRecordings();
        assertEquals(1, files.size());
        assertEquals("00001_PATCH_Tickets-9001.json", files.get(0).getFileName().toString());

        String text = Files.readString(files.get(0));
        assertFalse(text.contains("INTEGRATION"));
        assertFalse(text.contains("s3cret"));
        assertFalse(text.contains("webservices2"));

        JsonNode written = objectMapper.readTree(text);
        assertEquals("PATCH", written.path("method").asText());
        assertEquals("/Tickets/9001", written.path("path").asText());
        assertEquals(5, written.path("requestBody").path("status").asInt());
        assertEquals(9001, written.path("responseBody").path("itemId").asInt());
        assertFalse(written.has("query"));
        assertFalse(written.has("responseHeaders"));
    }

    @Test
    void testFixtureReplaysInAnotherZone() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        recorder.record(request(ZONE_ONE, "GET", "/Tickets/1", null), new HttpCallResult(200, Map.of(), "{\"item\":{\"id\":1}}"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);

        assertEquals("{\"item\":{\"id\":1}}", playback.playback(request(ZONE_TWO, "GET", "/Tickets/1", null)).body());
    }

    @Test
    void testRepeatedRequestsReplayInRecordingOrder() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        AutotaskRequest read = request(ZONE_ONE, "GET", "/Tickets/1", null);
        recorder.record(read, new HttpCallResult(200, Map.of(), "{\"item\":{\"id\":1,\"status\":1}}"));
        recorder.record(read, new HttpCallResult(200, Map.of(), "{\"item\":{\"id\":1,\"status\":5}}"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);

        assertEquals("{\"item\":{\"id\":1,\"status\":1}}", playback.playback(read).body());
        assertEquals("{\"item\":{\"id\":1,\"status\":5}}", playback.playback(read).body());
        AutotaskException exhausted = assertThrows(AutotaskException.class, () -> playback.playback(read));
        assertEquals("No recorded response found for request: GET /Tickets/1", exhausted.getMessage());
    }

    @Test
    void testQueryParameterOrderDoesNotAffectMatching() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        recorder.record(request(ZONE_ONE, "GET", "/Tickets/entityInformation/fields", null).queryParam("b", 2).queryParam("a", 1),
            new HttpCallResult(200, Map.of(), "{\"fields\":[]}"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);
        AutotaskRequest reordered = request(ZONE_ONE, "GET", "/Tickets/entityInformation/fields", null)
            .queryParam("a", 1).queryParam("b", 2);

        assertEquals("{\"fields\":[]}", playback.playback(reordered).body());
    }

    @Test
    void testBodiesAreComparedAsJson() throws Exception {
        Files.writeString(recordings.resolve("00001_POST_Tickets-query.json"), """
            {
              "method": "POST",
              "path": "/Tickets/query",
              "requestBody": {"MaxRecords": 10, "filter": [{"op": "eq", "field": "companyID", "value": 0}]},
              "status": 200,
              "responseBody": {"items": [], "pageDetails": {"count": 0}}
            }
            """);

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);
        AutotaskRequest query = request(ZONE_ONE, "POST", "/Tickets/query", null)
            .body("{\"filter\":[{\"op\":\"eq\",\"field\":\"companyID\",\"value\":0}],\"MaxRecords\":10}");

        HttpCallResult replayed = playback.playback(query);

        assertEquals(200, replayed.statusCode());
        assertEquals("{\"items\":[],\"pageDetails\":{\"count\":0}}", replayed.body());
        assertTrue(replayed.headers().isEmpty());
    }

    @Test
    void testDifferentBodiesDoNotMatch() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        recorder.record(request(ZONE_ONE, "POST", "/Tickets", null).body(Map.of("title", "A")),
            new HttpCallResult(200, Map.of(), "{\"itemId\":1}"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);

        assertThrows(AutotaskException.class,
            () -> playback.playback(request(ZONE_ONE, "POST", "/Tickets", null).body(Map.of("title", "B"))));
    }

    @Test
    void testEmptyAndPlainTextResponsesReplayAsText() throws Exception {
        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        recorder.record(request(ZONE_ONE, "DELETE", "/Tickets/1", null), new HttpCallResult(204, Map.of(), ""));
        recorder.record(request(ZONE_ONE, "GET", "/Tickets/2", null), new HttpCallResult(502, Map.of(), "Bad Gateway"));

        JsonNode deleted = objectMapper.readTree(listRecordings().get(0).toFile());
        assertFalse(deleted.has("responseBody"));

        HttpInteractionRecorder playback = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings);

        assertEquals("", playback.playback(request(ZONE_ONE, "DELETE", "/Tickets/1", null)).body());
        HttpCallResult gateway = playback.playback(request(ZONE_ONE, "GET", "/Tickets/2", null));
        assertEquals(502, gateway.statusCode());
        assertEquals("Bad Gateway", gateway.body());
    }

    @Test
    void testFixtureWithoutStatusIsRejected() throws Exception {
        Files.writeString(recordings.resolve("00001_GET_broken.json"), """
            {"method": "GET", "path": "/Tickets/1"}
            """);

        AutotaskException error = assertThrows(AutotaskException.class,
            () -> new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings));
        assertTrue(error.getMessage().startsWith("Recorded exchange has no status"));
    }

    @Test
    void testRecordingContinuesAfterHighestExistingNumber() throws Exception {
        Files.writeString(recordings.resolve("00007_GET_Tickets-7.json"), "{}");
        Files.writeString(recordings.resolve("notes.json"), "{}");

        HttpInteractionRecorder recorder = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, recordings);
        recorder.record(request(ZONE_ONE, "GET", "/Tickets/8", null), new HttpCallResult(200, Map.of(), "{}"));
        recorder.record(request(ZONE_ONE, "GET", "/Tickets/9", null), new HttpCallResult(200, Map.of(), "{}"));

        List<String> names = listRecordings().stream()
            .map(path -> path.getFileName().toString())
            .collect(Collectors.toList());
        assertEquals(List.of("00007_GET_Tickets-7.json", "00008_GET_Tickets-8.json", "00009_GET_Tickets-9.json", "notes.json"), names);
    }

    @Test
    void testSlugKeepsFileNamesShort() {
        assertEquals("Tickets-query", HttpInteractionRecorder.slug("/Tickets/query"));
        assertEquals("root", HttpInteractionRecorder.slug("/"));
        assertEquals(60, HttpInteractionRecorder.slug("/" + "ConfigurationItemBillingProductAssociations/".repeat(3)).length());
    }

    @Test
    void testPlaybackNeedsExistingDirectory() {
        assertThrows(AutotaskException.class,
            () -> new HttpInteractionRecorder(HttpInteractionRecorder.Mode.PLAYBACK, recordings.resolve("missing")));
        assertThrows(AutotaskException.class, () -> new HttpInteractionRecorder(HttpInteractionRecorder.Mode.RECORD, null));
    }

    @Test
    void testLiveModeNeitherRecordsNorPlaysBack() throws Exception {
        HttpInteractionRecorder live = new HttpInteractionRecorder(HttpInteractionRecorder.Mode.LIVE, null);

        live.record(request(ZONE_ONE, "GET", "/Tickets/1", null), new HttpCallResult(200, Map.of(), "{}"));

        assertFalse(live.isRecording());
        assertFalse(live.isPlayback());
        assertThrows(AutotaskException.class, () -> live.playback(request(ZONE_ONE, "GET", "/Tickets/1", null)));
    }

    private List<Path> listRecordings() throws Exception {
        try (Stream<Path> files = Files.list(recordings)) {
            return files.sorted().collect(Collectors.toList());
        }
    }

    private AutotaskRequest request(String zone, String method, String path, AutotaskCredentials credentials) {
        return new AutotaskRequest(method, path, zone + path, credentials, objectMapper);
    }
}
