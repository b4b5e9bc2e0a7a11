package com.hooky.adapter.in.web;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hooky.application.port.in.CreateReceiverUseCase;
import com.hooky.application.port.in.DeleteReceiverUseCase;
import com.hooky.application.port.in.GetReceiverUseCase;
import com.hooky.application.port.in.ListEventsUseCase;
import com.hooky.application.port.in.ListReceiversUseCase;
import com.hooky.application.port.in.ListReceiversUseCase.ReceiverOverview;
import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;
import com.hooky.infrastructure.exception.StoreUnavailableException;
import com.hooky.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(ReceiverController.class)
class ReceiverControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final ReceiverId ID = ReceiverId.fromTrusted("abcde12345");
    private static final String HOOK_URL = "http://hooks.test/hook/abcde12345";

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return new MutableClock(NOW);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateReceiverUseCase createReceiverUseCase;

    @MockBean
    private GetReceiverUseCase getReceiverUseCase;

    @MockBean
    private ListReceiversUseCase listReceiversUseCase;

    @MockBean
    private DeleteReceiverUseCase deleteReceiverUseCase;

    @MockBean
    private ListEventsUseCase listEventsUseCase;

    @MockBean
    private HookUrls hookUrls;

    @BeforeEach
    void setUp() {
        when(hookUrls.hookUrl(any())).thenAnswer(inv -> "http://hooks.test/hook/" + inv.getArgument(0, ReceiverId.class).value());
    }

    @Test
    void shouldCreateReceiver() throws Exception {
        Receiver receiver = Receiver.create(ID, NOW, Duration.ofSeconds(120));
        when(createReceiverUseCase.createReceiver(120L)).thenReturn(receiver);

        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttlSeconds\":120}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("abcde12345"))
            .andExpect(jsonPath("$.url").value(HOOK_URL))
            .andExpect(jsonPath("$.ttlSeconds").value(120))
            .andExpect(jsonPath("$.expiresAt").value(NOW.plusSeconds(120).toEpochMilli()));
    }

    @Test
    void shouldCreateReceiverWithoutBody() throws Exception {
        when(createReceiverUseCase.createReceiver(isNull())).thenReturn(Receiver.create(ID, NOW, Duration.ofHours(1)));

        mockMvc.perform(post("/api/endpoints"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ttlSeconds").value(3600));
    }

    @Test
    void shouldAcceptTtlAsNumericString() throws Exception {
        when(createReceiverUseCase.createReceiver(45L)).thenReturn(Receiver.create(ID, NOW, Duration.ofSeconds(45)));

        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttlSeconds\":\"45.9\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ttlSeconds").value(45));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldUseDefaultTtlForObjectOrArrayValues() throws Exception {
        when(createReceiverUseCase.createReceiver(isNull())).thenReturn(Receiver.create(ID, NOW, Duration.ofHours(1)));

        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttlSeconds\":{}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ttlSeconds").value(3600));
        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttlSeconds\":[5]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ttlSeconds").value(3600));

        verify(createReceiverUseCase, times(2)).createReceiver(isNull());
    }

    @Test
    void shouldPassHugeTtlThroughWithoutOverflow() throws Exception {
        when(createReceiverUseCase.createReceiver(Long.MAX_VALUE))
            .thenReturn(Receiver.create(ID, NOW, Duration.ofSeconds(31_536_000)));

        mockMvc.perform(post("/api/endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ttlSeconds\":1e20}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ttlSeconds").value(31_536_000));
    }

    @Test
    void parseTtlShouldIgnoreGarbage() {
        assertNull(ReceiverController.parseTtlText(null));
        assertNull(ReceiverController.parseTtlText(" "));
        assertNull(ReceiverController.parseTtlText("soon"));
        assertNull(ReceiverController.parseTtlText("NaN"));
        assertNull(ReceiverController.parseTtlText("Infinity"));
        assertEquals(10L, ReceiverController.parseTtlText("10"));
        assertEquals(-3L, ReceiverController.parseTtlText("-2.5"));
    }

    @Test
    void parseTtlShouldHandleEveryJsonNodeType() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;

        assertNull(ReceiverController.parseTtl(null));
        assertNull(ReceiverController.parseTtl(nodes.nullNode()));
        assertNull(ReceiverController.parseTtl(nodes.objectNode()));
        assertNull(ReceiverController.parseTtl(nodes.arrayNode().add(5)));
        assertNull(ReceiverController.parseTtl(nodes.booleanNode(true)));
        assertEquals(1L, ReceiverController.parseTtl(nodes.numberNode(1.5)));
        assertEquals(30L, ReceiverController.parseTtl(nodes.textNode("30")));
        assertEquals(Long.MAX_VALUE, ReceiverController.parseTtl(nodes.numberNode(1e20)));
    }

    @Test
    void shouldListReceiversWithRemainingTtl() throws Exception {
        Receiver receiver = Receiver.create(ID, NOW.minusSeconds(30), Duration.ofSeconds(90));
        when(listReceiversUseCase.listReceivers()).thenReturn(List.of(new ReceiverOverview(receiver, 4)));

        mockMvc.perform(get("/api/endpoints"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.endpoints", hasSize(1)))
            .andExpect(jsonPath("$.endpoints[0].id").value("abcde12345"))
            .andExpect(jsonPath("$.endpoints[0].ttlSeconds").value(60))
            .andExpect(jsonPath("$.endpoints[0].eventCount").value(4))
            .andExpect(jsonPath("$.endpoints[0].url").value(HOOK_URL));
    }

    @Test
    void shouldGetReceiver() throws Exception {
        Receiver receiver = Receiver.create(ID, NOW, Duration.ofSeconds(300));
        when(getReceiverUseCase.getReceiver(ID)).thenReturn(Result.success(receiver));

        mockMvc.perform(get("/api/endpoints/abcde12345"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("abcde12345"))
            .andExpect(jsonPath("$.ttlSeconds").value(300))
            .andExpect(jsonPath("$.expiresAt").value(receiver.expiresAt().toEpochMilli()));
    }

    @Test
    void shouldReturn404ForUnknownReceiver() throws Exception {
        when(getReceiverUseCase.getReceiver(ID)).thenReturn(Result.failure(new ReceiverError.NotFound(ID)));

        mockMvc.perform(get("/api/endpoints/abcde12345"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("RECEIVER_NOT_FOUND"));
    }

    @Test
    void shouldReturn410ForExpiredReceiver() throws Exception {
        when(getReceiverUseCase.getReceiver(ID))
            .thenReturn(Result.failure(new ReceiverError.Expired(ID, NOW.minusSeconds(1))));

        mockMvc.perform(get("/api/endpoints/abcde12345"))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.error").value("RECEIVER_EXPIRED"));
    }

    @Test
    void shouldRejectMalformedId() throws Exception {
        mockMvc.perform(get("/api/endpoints/bad.id"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("RECEIVER_ID_INVALID_FORMAT"));
    }

    @Test
    void shouldListEventsNewestFirst() throws Exception {
        CapturedEvent newer = new CapturedEvent(UUID.randomUUID(), NOW, "POST", "/hook/abcde12345",
            Map.of(), Map.of(), Map.of("alpha", 2));
        CapturedEvent older = new CapturedEvent(UUID.randomUUID(), NOW.minusSeconds(5), "POST", "/hook/abcde12345",
            Map.of(), Map.of(), Map.of("alpha", 1));
        when(listEventsUseCase.listEvents(ID)).thenReturn(Result.success(List.of(newer, older)));

        mockMvc.perform(get("/api/endpoints/abcde12345/events"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(2)))
            .andExpect(jsonPath("$.events[0].body.alpha").value(2))
            .andExpect(jsonPath("$.events[1].body.alpha").value(1));
    }

    @Test
    void shouldReturn410ForEventsOfExpiredReceiver() throws Exception {
        when(listEventsUseCase.listEvents(ID))
            .thenReturn(Result.failure(new ReceiverError.Expired(ID, NOW.minusSeconds(1))));

        mockMvc.perform(get("/api/endpoints/abcde12345/events"))
            .andExpect(status().isGone());
    }

    @Test
    void shouldDeleteReceiver() throws Exception {
        when(deleteReceiverUseCase.deleteReceiver(ID)).thenReturn(true);

        mockMvc.perform(delete("/api/endpoints/abcde12345"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(jsonPath("$.deleted").value("abcde12345"));
    }

    @Test
    void shouldReturn404WhenDeletingUnknownReceiver() throws Exception {
        when(deleteReceiverUseCase.deleteReceiver(ID)).thenReturn(false);

        mockMvc.perform(delete("/api/endpoints/abcde12345"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("RECEIVER_NOT_FOUND"));
    }

    @Test
    void shouldNotDeleteWithMalformedId() throws Exception {
        mockMvc.perform(delete("/api/endpoints/" + "x".repeat(65)))
            .andExpect(status().isBadRequest());

        verify(deleteReceiverUseCase, never()).deleteReceiver(any());
    }

    @Test
    void shouldReturn503WhenStoreIsDown() throws Exception {
        when(getReceiverUseCase.getReceiver(ID))
            .thenThrow(new StoreUnavailableException("find", new QueryTimeoutException("timed out")));

        mockMvc.perform(get("/api/endpoints/abcde12345"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("STORE_UNAVAILABLE"));
    }

    @Test
    void shouldEchoRequestId() throws Exception {
        when(getReceiverUseCase.getReceiver(ID)).thenReturn(Result.failure(new ReceiverError.NotFound(ID)));

        mockMvc.perform(get("/api/endpoints/abcde12345").header("X-Request-Id", "req-42"))
            .andExpect(header().string("X-Request-Id", "req-42"))
            .andExpect(jsonPath("$.requestId").value("req-42"));
    }
}
