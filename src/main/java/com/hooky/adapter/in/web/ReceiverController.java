package com.hooky.adapter.in.web;

import com.hooky.application.port.in.CreateReceiverUseCase;
import com.hooky.application.port.in.DeleteReceiverUseCase;
import com.hooky.application.port.in.GetReceiverUseCase;
import com.hooky.application.port.in.ListEventsUseCase;
import com.hooky.application.port.in.ListReceiversUseCase;
import com.hooky.application.port.in.ListReceiversUseCase.ReceiverOverview;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/endpoints")
@Tag(name = "Endpoints", description = "Webhook receiver management")
public class ReceiverController {

    private final CreateReceiverUseCase createReceiverUseCase;
    private final GetReceiverUseCase getReceiverUseCase;
    private final ListReceiversUseCase listReceiversUseCase;
    private final DeleteReceiverUseCase deleteReceiverUseCase;
    private final ListEventsUseCase listEventsUseCase;
    private final HookUrls hookUrls;
    private final Clock clock;

    public ReceiverController(
            CreateReceiverUseCase createReceiverUseCase,
            GetReceiverUseCase getReceiverUseCase,
            ListReceiversUseCase listReceiversUseCase,
            DeleteReceiverUseCase deleteReceiverUseCase,
            ListEventsUseCase listEventsUseCase,
            HookUrls hookUrls,
            Clock clock) {
        this.createReceiverUseCase = createReceiverUseCase;
        this.getReceiverUseCase = getReceiverUseCase;
        this.listReceiversUseCase = listReceiversUseCase;
        this.deleteReceiverUseCase = deleteReceiverUseCase;
        this.listEventsUseCase = listEventsUseCase;
        this.hookUrls = hookUrls;
        this.clock = clock;
    }

    @PostMapping
    @Operation(summary = "Create a receiver", description = "Creates a temporary webhook address. ttlSeconds is a number "
        + "or numeric string of whole seconds: fractions are rounded down, values above the configured maximum are clamped, "
        + "and anything else means the default of 3600 seconds")
    public ResponseEntity<CreateReceiverResponse> createReceiver(
            @RequestBody(required = false) CreateReceiverRequest request) {
        Long ttlSeconds = request != null ? parseTtl(request.ttlSeconds()) : null;
        Receiver receiver = createReceiverUseCase.createReceiver(ttlSeconds);
        return ResponseEntity.ok(new CreateReceiverResponse(
            receiver.id().value(),
            hookUrls.hookUrl(receiver.id()),
            receiver.ttl().toSeconds(),
            receiver.expiresAt().toEpochMilli()
        ));
    }

    @GetMapping
    @Operation(summary = "List receivers", description = "Returns every unexpired receiver with its remaining TTL and event count")
    public ResponseEntity<ReceiverListResponse> listReceivers() {
        Instant now = clock.instant();
        List<ReceiverSummary> endpoints = listReceiversUseCase.listReceivers().stream()
            .map(overview -> ReceiverSummary.from(overview, hookUrls.hookUrl(overview.receiver().id()), now))
            .toList();
        return ResponseEntity.ok(new ReceiverListResponse(endpoints));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a receiver")
    public ResponseEntity<?> getReceiver(
            @Parameter(description = "Receiver ID") @PathVariable String id) {
        var idResult = ReceiverId.parse(id);
        if (idResult.isFailure()) {
            return ErrorResponse.from(idResult.errorOrNull());
        }
        Instant now = clock.instant();
        return getReceiverUseCase.getReceiver(idResult.getOrThrow()).<ResponseEntity<?>>fold(
            receiver -> ResponseEntity.ok(new ReceiverResponse(
                receiver.id().value(),
                hookUrls.hookUrl(receiver.id()),
                receiver.expiresAt().toEpochMilli(),
                remainingSeconds(receiver, now))),
            ErrorResponse::from);
    }

    @GetMapping("/{id}/events")
    @Operation(summary = "List captured events", description = "Returns up to 100 most recent requests, newest first")
    public ResponseEntity<?> listEvents(
            @Parameter(description = "Receiver ID") @PathVariable String id) {
        var idResult = ReceiverId.parse(id);
        if (idResult.isFailure()) {
            return ErrorResponse.from(idResult.errorOrNull());
        }
        return listEventsUseCase.listEvents(idResult.getOrThrow()).<ResponseEntity<?>>fold(
            events -> ResponseEntity.ok(new EventListResponse(events)),
            ErrorResponse::from);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a receiver", description = "Removes the receiver, its events and any live streams")
    public ResponseEntity<?> deleteReceiver(
            @Parameter(description = "Receiver ID") @PathVariable String id) {
        var idResult = ReceiverId.parse(id);
        if (idResult.isFailure()) {
            return ErrorResponse.from(idResult.errorOrNull());
        }
        if (!deleteReceiverUseCase.deleteReceiver(idResult.getOrThrow())) {
            return ErrorResponse.of(HttpStatus.NOT_FOUND, "RECEIVER_NOT_FOUND", "Receiver not found: " + id);
        }
        return ResponseEntity.ok(new DeleteResponse(true, id));
    }

    /**
     * Accepts numbers or numeric strings; anything else, objects and arrays included, means "use the default".
     */
    static Long parseTtl(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return floorSeconds(node.asDouble());
        }
        if (node.isTextual()) {
            return parseTtlText(node.asText());
        }
        return null;
    }

    static Long parseTtlText(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return floorSeconds(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long floorSeconds(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return null;
        }
        // Saturates at Long.MAX_VALUE; the service clamps to its maximum
        return (long) Math.floor(seconds);
    }

    private static long remainingSeconds(Receiver receiver, Instant now) {
        return Math.round(receiver.remaining(now).toMillis() / 1000.0);
    }

    public record CreateReceiverRequest(JsonNode ttlSeconds) {}

    public record CreateReceiverResponse(String id, String url, long ttlSeconds, long expiresAt) {}

    public record ReceiverResponse(String id, String url, long expiresAt, long ttlSeconds) {}

    public record ReceiverListResponse(List<ReceiverSummary> endpoints) {}

    public record ReceiverSummary(String id, long expiresAt, long ttlSeconds, String url, long eventCount) {
        static ReceiverSummary from(ReceiverOverview overview, String url, Instant now) {
            Receiver receiver = overview.receiver();
            return new ReceiverSummary(
                receiver.id().value(),
                receiver.expiresAt().toEpochMilli(),
                remainingSeconds(receiver, now),
                url,
                overview.eventCount());
        }
    }

    public record EventListResponse(List<CapturedEvent> events) {}

    public record DeleteResponse(boolean ok, String deleted) {}
}
