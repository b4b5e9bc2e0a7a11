package com.hooky.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.support.SseTestClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against the in-memory backend.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.store.force-memory=true",
        "app.public-base-url=https://hooks.example.com/",
        "app.stream.heartbeat-ms=200"
    })
@DisplayName("Memory mode E2E Tests")
class MemoryModeIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EventBroadcaster broadcaster;

    @LocalServerPort
    private int port;

    private String createReceiver(int ttlSeconds) {
        ResponseEntity<JsonNode> created = restTemplate.postForEntity(
            "/api/endpoints", Map.of("ttlSeconds", ttlSeconds), JsonNode.class);
        assertEquals(HttpStatus.OK, created.getStatusCode());
        return created.getBody().get("id").asText();
    }

    private ResponseEntity<JsonNode> capture(String id, String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.postForEntity("/hook/" + id, new HttpEntity<>(json, headers), JsonNode.class);
    }

    private ResponseEntity<JsonNode> delete(String id) {
        return restTemplate.exchange("/api/endpoints/" + id, HttpMethod.DELETE, null, JsonNode.class);
    }

    @Test
    @DisplayName("create, capture, list, delete")
    void fullLifecycle() {
        // Create
        ResponseEntity<JsonNode> created = restTemplate.postForEntity(
            "/api/endpoints", Map.of("ttlSeconds", 5), JsonNode.class);
        assertEquals(HttpStatus.OK, created.getStatusCode());
        JsonNode body = created.getBody();
        String id = body.get("id").asText();
        assertTrue(id.matches("[a-z0-9]{10}"), id);
        assertEquals("https://hooks.example.com/hook/" + id, body.get("url").asText());
        assertEquals(5, body.get("ttlSeconds").asInt());
        long expiresAt = body.get("expiresAt").asLong();
        assertTrue(expiresAt > System.currentTimeMillis());

        // Capture
        ResponseEntity<JsonNode> captured = restTemplate.postForEntity(
            "/hook/" + id + "?source=test", Map.of("alpha", 1), JsonNode.class);
        assertEquals(HttpStatus.OK, captured.getStatusCode());
        assertTrue(captured.getBody().get("ok").asBoolean());
        String eventId = captured.getBody().get("received").get("id").asText();

        // Events
        ResponseEntity<JsonNode> events = restTemplate.getForEntity("/api/endpoints/" + id + "/events", JsonNode.class);
        assertEquals(HttpStatus.OK, events.getStatusCode());
        JsonNode list = events.getBody().get("events");
        assertEquals(1, list.size());
        JsonNode event = list.get(0);
        assertEquals(eventId, event.get("id").asText());
        assertEquals("POST", event.get("method").asText());
        assertEquals("/hook/" + id + "?source=test", event.get("path").asText());
        assertEquals("test", event.get("query").get("source").asText());
        assertEquals(1, event.get("body").get("alpha").asInt());
        assertTrue(event.get("headers").has("content-type"));

        // Receiver detail and listing
        ResponseEntity<JsonNode> detail = restTemplate.getForEntity("/api/endpoints/" + id, JsonNode.class);
        assertEquals(HttpStatus.OK, detail.getStatusCode());
        assertEquals(expiresAt, detail.getBody().get("expiresAt").asLong());

        ResponseEntity<JsonNode> listing = restTemplate.getForEntity("/api/endpoints", JsonNode.class);
        boolean listed = false;
        for (JsonNode summary : listing.getBody().get("endpoints")) {
            if (summary.get("id").asText().equals(id)) {
                listed = true;
                assertEquals(1, summary.get("eventCount").asInt());
            }
        }
        assertTrue(listed);

        // Delete
        ResponseEntity<JsonNode> deleted = delete(id);
        assertEquals(HttpStatus.OK, deleted.getStatusCode());
        assertEquals(id, deleted.getBody().get("deleted").asText());

        assertEquals(HttpStatus.NOT_FOUND, delete(id).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
            restTemplate.getForEntity("/api/endpoints/" + id + "/events", JsonNode.class).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, capture(id, "{}").getStatusCode());
    }

    @Test
    @DisplayName("expired receivers answer 410 before the reaper runs")
    void expiredReceiverIsGone() {
        String id = createReceiver(1);
        assertEquals(HttpStatus.OK, capture(id, "{\"early\":true}").getStatusCode());

        await().atMost(5, TimeUnit.SECONDS).pollInterval(Duration.ofMillis(100)).untilAsserted(() ->
            assertEquals(HttpStatus.GONE, capture(id, "{\"late\":true}").getStatusCode()));

        ResponseEntity<JsonNode> events = restTemplate.getForEntity("/api/endpoints/" + id + "/events", JsonNode.class);
        assertEquals(HttpStatus.GONE, events.getStatusCode());
        assertEquals("RECEIVER_EXPIRED", events.getBody().get("error").asText());

        ResponseEntity<JsonNode> listing = restTemplate.getForEntity("/api/endpoints", JsonNode.class);
        for (JsonNode summary : listing.getBody().get("endpoints")) {
            assertNotEquals(id, summary.get("id").asText());
        }
    }

    @Test
    @DisplayName("unknown and malformed ids")
    void unknownAndMalformedIds() {
        assertEquals(HttpStatus.NOT_FOUND, capture("doesnotexist", "{}").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
            restTemplate.getForEntity("/api/endpoints/doesnotexist", JsonNode.class).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
            restTemplate.getForEntity("/api/endpoints/" + "a".repeat(80), JsonNode.class).getStatusCode());
    }

    @Test
    @DisplayName("event log keeps the 100 most recent captures")
    void eventLogIsCapped() {
        String id = createReceiver(60);
        for (int i = 1; i <= 105; i++) {
            assertEquals(HttpStatus.OK, capture(id, "{\"n\":" + i + "}").getStatusCode());
        }

        JsonNode events = restTemplate.getForEntity("/api/endpoints/" + id + "/events", JsonNode.class)
            .getBody().get("events");

        assertEquals(100, events.size());
        assertEquals(105, events.get(0).get("body").get("n").asInt());
        assertEquals(6, events.get(99).get("body").get("n").asInt());
    }

    @Test
    @DisplayName("live stream receives captures and ends on delete")
    void liveStream() throws Exception {
        String id = createReceiver(60);

        try (SseTestClient stream = SseTestClient.open("http://localhost:" + port + "/api/endpoints/" + id + "/stream")) {
            assertEquals(200, stream.statusCode());
            assertTrue(stream.contentType().startsWith("text/event-stream"), stream.contentType());
            assertNotNull(stream.nextLineStartingWith(":connected", Duration.ofSeconds(5)));

            capture(id, "{\"live\":1}");
            capture(id, "{\"live\":2}");

            assertEquals("event:webhook", stream.nextLineStartingWith("event:", Duration.ofSeconds(5)));
            String first = stream.nextLineStartingWith("data:", Duration.ofSeconds(5));
            assertNotNull(first);
            assertEquals(1, objectMapper.readTree(first.substring("data:".length())).get("body").get("live").asInt());
            String second = stream.nextLineStartingWith("data:", Duration.ofSeconds(5));
            assertNotNull(second);
            assertEquals(2, objectMapper.readTree(second.substring("data:".length())).get("body").get("live").asInt());

            assertEquals(HttpStatus.OK, delete(id).getStatusCode());
            assertTrue(stream.awaitEnd(Duration.ofSeconds(5)), "stream should end after delete");
        }
    }

    @Test
    @DisplayName("an idle stream is released once its client disconnects")
    void idleStreamReleasedAfterClientDisconnect() throws Exception {
        String id = createReceiver(600);
        await().atMost(Duration.ofSeconds(10)).until(() -> broadcaster.activeSubscriptions() == 0);

        SseTestClient stream = SseTestClient.open("http://localhost:" + port + "/api/endpoints/" + id + "/stream");
        assertNotNull(stream.nextLineStartingWith(":connected", Duration.ofSeconds(5)));
        await().atMost(Duration.ofSeconds(5)).until(() -> broadcaster.activeSubscriptions() == 1);

        stream.close();

        // No capture is sent: only the heartbeat can notice the closed connection
        await().atMost(Duration.ofSeconds(10)).until(() -> broadcaster.activeSubscriptions() == 0);
        assertEquals(HttpStatus.OK, restTemplate.getForEntity("/api/endpoints/" + id, JsonNode.class).getStatusCode());
    }

    @Test
    @DisplayName("huge and non-numeric ttl values never fail creation")
    void oddTtlValuesAreNormalised() {
        ResponseEntity<JsonNode> huge = restTemplate.postForEntity(
            "/api/endpoints", Map.of("ttlSeconds", 1e20), JsonNode.class);
        assertEquals(HttpStatus.OK, huge.getStatusCode());
        assertEquals(31_536_000, huge.getBody().get("ttlSeconds").asLong());

        ResponseEntity<JsonNode> object = restTemplate.postForEntity(
            "/api/endpoints", Map.of("ttlSeconds", Map.of("x", 1)), JsonNode.class);
        assertEquals(HttpStatus.OK, object.getStatusCode());
        assertEquals(3600, object.getBody().get("ttlSeconds").asLong());

        ResponseEntity<JsonNode> array = restTemplate.postForEntity(
            "/api/endpoints", Map.of("ttlSeconds", List.of(5)), JsonNode.class);
        assertEquals(HttpStatus.OK, array.getStatusCode());
        assertEquals(3600, array.getBody().get("ttlSeconds").asLong());
    }

    @Test
    @DisplayName("live stream for an unknown receiver is a JSON 404")
    void liveStreamForUnknownReceiver() throws Exception {
        try (SseTestClient stream = SseTestClient.open("http://localhost:" + port + "/api/endpoints/nothere/stream")) {
            assertEquals(404, stream.statusCode());
            assertTrue(stream.contentType().startsWith("application/json"), stream.contentType());
        }
    }

    @Test
    @DisplayName("captures racing a delete either land before it or get 404")
    void deleteRacingCaptures() throws Exception {
        String id = createReceiver(60);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<HttpStatus>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                int n = i;
                results.add(pool.submit(() -> HttpStatus.valueOf(capture(id, "{\"n\":" + n + "}").getStatusCode().value())));
                if (i == 20) {
                    results.add(pool.submit(() -> HttpStatus.valueOf(delete(id).getStatusCode().value())));
                }
            }
            for (Future<HttpStatus> result : results) {
                assertTrue(Set.of(HttpStatus.OK, HttpStatus.NOT_FOUND).contains(result.get(10, TimeUnit.SECONDS)));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(HttpStatus.NOT_FOUND, capture(id, "{}").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
            restTemplate.getForEntity("/api/endpoints/" + id + "/events", JsonNode.class).getStatusCode());
    }

    @Test
    @DisplayName("actuator reports the memory backend")
    void actuatorInfoShowsBackend() {
        ResponseEntity<JsonNode> info = restTemplate.getForEntity("/actuator/info", JsonNode.class);

        assertEquals(HttpStatus.OK, info.getStatusCode());
        assertEquals("MEMORY", info.getBody().get("store").get("backend").asText());
    }

    @Test
    @DisplayName("OpenAPI document describes the API")
    void openApiDocumentIsServed() {
        ResponseEntity<JsonNode> docs = restTemplate.getForEntity("/api-docs", JsonNode.class);

        assertEquals(HttpStatus.OK, docs.getStatusCode());
        assertEquals("Hooky API", docs.getBody().get("info").get("title").asText());
        assertTrue(docs.getBody().get("paths").has("/api/endpoints"));
    }
}
