package com.autotask.simpleSDK.entities;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.RecordingDelayScheduler;
import com.autotask.simpleSDK.http.RequestBodies;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.http.RequestOptions;
import com.autotask.simpleSDK.http.StubHttpResponse;
import com.autotask.simpleSDK.http.auth.ApiUserCredentials;
import com.autotask.simpleSDK.http.exceptions.AutotaskServiceException;
import com.autotask.simpleSDK.http.retry.ExponentialBackoffStrategy;
import com.autotask.simpleSDK.http.retry.RetryPolicy;
import com.autotask.simpleSDK.models.ApiResponse;
import com.autotask.simpleSDK.models.TimeEntry;
import com.autotask.simpleSDK.query.QueryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeEntriesTest {
    private static final String BASE_URL = "https://webservices5.autotask.net/ATServicesRest/V1.0";

    @Mock
    private HttpClient httpClient;

    private RecordingDelayScheduler scheduler;
    private TimeEntries timeEntries;

    @BeforeEach
    void setUp() {
        scheduler = new RecordingDelayScheduler();
        AutotaskHttpClient client = new AutotaskHttpClient(BASE_URL, new ApiUserCredentials("api@example.com", "CODE", "secret"),
            null, httpClient);
        RequestHandler requestHandler = new RequestHandler(LoggerFactory.getLogger(TimeEntriesTest.class), RetryPolicy.DEFAULT,
            RequestOptions.defaults(), new ExponentialBackoffStrategy(), scheduler);
        timeEntries = new TimeEntries(client, requestHandler);
    }

    @Test
    void testCreatePostsRecordAndReturnsNewId() throws Exception {
        respondWith(StubHttpResponse.of(200, "{\"itemId\":101}"));
        TimeEntry entry = new TimeEntry(Map.of("ticketID", 12));
        entry.set("hoursWorked", 1.5);

        ApiResponse<TimeEntry> response = timeEntries.create(entry).get();

        assertEquals(101L, response.data().getId().orElseThrow());
        HttpRequest sent = captureRequest();
        assertEquals("POST", sent.method());
        assertEquals(BASE_URL + "/TimeEntries", sent.uri().toString());
        assertEquals("{\"ticketID\":12,\"hoursWorked\":1.5}", RequestBodies.asString(sent));
    }

    @Test
    void testGetUnwrapsItemEnvelope() throws Exception {
        respondWith(StubHttpResponse.of(200, """
            {
              "item": {
                "id": 5,
                "resourceID": 29682885,
                "hoursWorked": 0.75,
                "summaryNotes": "Replaced toner"
              }
            }
            """));

        TimeEntry entry = timeEntries.get(5).get().data();

        assertEquals(5L, entry.getId().orElseThrow());
        assertEquals("Replaced toner", entry.get("summaryNotes"));
        assertEquals(0.75, entry.get("hoursWorked"));
        HttpRequest sent = captureRequest();
        assertEquals("GET", sent.method());
        assertEquals(BASE_URL + "/TimeEntries/5", sent.uri().toString());
    }

    @Test
    void testUpdatePutsRecordToIdPath() throws Exception {
        respondWith(StubHttpResponse.of(200, "{\"item\":{\"id\":5,\"hoursWorked\":2.5}}"));

        TimeEntry updated = timeEntries.update(5, new TimeEntry(Map.of("hoursWorked", 2.5))).get().data();

        assertEquals(2.5, updated.get("hoursWorked"));
        HttpRequest sent = captureRequest();
        assertEquals("PUT", sent.method());
        assertEquals(BASE_URL + "/TimeEntries/5", sent.uri().toString());
        assertEquals("{\"hoursWorked\":2.5}", RequestBodies.asString(sent));
    }

    @Test
    void testPatchSendsPartialRecord() throws Exception {
        respondWith(StubHttpResponse.of(200, "{\"itemId\":5}"));

        ApiResponse<TimeEntry> response = timeEntries.patch(5, new TimeEntry(Map.of("summaryNotes", "Follow-up"))).get();

        assertEquals(5L, response.data().getId().orElseThrow());
        HttpRequest sent = captureRequest();
        assertEquals("PATCH", sent.method());
        assertEquals("{\"summaryNotes\":\"Follow-up\"}", RequestBodies.asString(sent));
    }

    @Test
    void testDeleteCompletesWithoutValue() throws Exception {
        respondWith(StubHttpResponse.of(200, ""));

        assertNull(timeEntries.delete(5).get());
        HttpRequest sent = captureRequest();
        assertEquals("DELETE", sent.method());
        assertEquals(BASE_URL + "/TimeEntries/5", sent.uri().toString());
    }

    @Test
    void testListPostsQueryAndUnwrapsItems() throws Exception {
        respondWith(StubHttpResponse.of(200, """
            {
              "items": [
                {"id": 1, "resourceID": 7},
                {"id": 2, "resourceID": 7}
              ],
              "pageDetails": {"count": 2, "requestCount": 10, "prevPageUrl": null, "nextPageUrl": null}
            }
            """));

        List<TimeEntry> entries = timeEntries.list(QueryOptions.builder().where("resourceID", 7).pageSize(10).build())
            .get().data();

        assertEquals(2, entries.size());
        assertEquals(2L, entries.get(1).getId().orElseThrow());
        HttpRequest sent = captureRequest();
        assertEquals("POST", sent.method());
        assertEquals(BASE_URL + "/TimeEntries/query", sent.uri().toString());
        assertEquals("{\"filter\":[{\"op\":\"eq\",\"field\":\"resourceID\",\"value\":7}],\"MaxRecords\":10}",
            RequestBodies.asString(sent));
    }

    @Test
    void testListWithoutFilterSendsMatchAllPredicate() throws Exception {
        respondWith(StubHttpResponse.of(200, "{\"items\":[]}"));

        assertTrue(timeEntries.list().get().data().isEmpty());
        assertEquals("{\"filter\":[{\"op\":\"gte\",\"field\":\"id\",\"value\":0}]}", RequestBodies.asString(captureRequest()));
    }

    @Test
    void testInvalidFilterFailsTheReturnedFuture() {
        QueryOptions query = QueryOptions.builder()
            .where("dateWorked", Map.of(" ", "2024-05-01"))
            .build();

        CompletableFuture<ApiResponse<List<TimeEntry>>> listed = timeEntries.list(query);

        ExecutionException error = assertThrows(ExecutionException.class, listed::get);
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertEquals("Filter operator is required", error.getCause().getMessage());
        verifyNoInteractions(httpClient);
        assertTrue(scheduler.getDelays().isEmpty());
    }

    @Test
    void testGetIsRetriedAfterServerError() throws Exception {
        when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(CompletableFuture.completedFuture(StubHttpResponse.of(503, "")))
            .thenReturn(CompletableFuture.completedFuture(StubHttpResponse.of(200, "{\"item\":{\"id\":5}}")));

        assertEquals(5L, timeEntries.get(5).get().data().getId().orElseThrow());
        verify(httpClient, times(2)).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertEquals(1, scheduler.getDelays().size());
    }

    @Test
    void testListQueryIsRetriedAfterServerError() throws Exception {
        when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(CompletableFuture.completedFuture(StubHttpResponse.of(502, "")))
            .thenReturn(CompletableFuture.completedFuture(StubHttpResponse.of(200, "{\"items\":[{\"id\":1}]}")));

        assertEquals(1, timeEntries.list().get().data().size());
        verify(httpClient, times(2)).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    void testCreateIsNotRetried() {
        respondWith(StubHttpResponse.of(503, "{\"errors\":[\"Service unavailable\"]}"));

        ExecutionException error = assertThrows(ExecutionException.class,
            () -> timeEntries.create(new TimeEntry(Map.of("ticketID", 12))).get());

        AutotaskServiceException cause = assertInstanceOf(AutotaskServiceException.class, error.getCause());
        assertEquals(503, cause.getStatusCode());
        assertEquals("/TimeEntries", cause.getEndpoint());
        verify(httpClient, times(1)).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertTrue(scheduler.getDelays().isEmpty());
    }

    @Test
    void testMetadataDescribesAllOperations() {
        EntityMetadata metadata = timeEntries.getMetadata();

        assertEquals("TimeEntries", metadata.name());
        assertEquals("/TimeEntries", metadata.endpoint());
        for (EntityOperation operation : EntityOperation.values()) {
            assertTrue(metadata.supports(operation), operation.name());
        }
        assertEquals(TimeEntry.class, timeEntries.getRecordType());
    }

    private void respondWith(HttpResponse<String> response) {
        when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(CompletableFuture.completedFuture(response));
    }

    private HttpRequest captureRequest() {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        return captor.getValue();
    }
}
