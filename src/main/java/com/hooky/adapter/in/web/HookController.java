package com.hooky.adapter.in.web;

import com.hooky.application.port.in.CaptureEventUseCase;
import com.hooky.domain.model.ReceiverId;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.UUID;

@RestController
@Tag(name = "Hooks", description = "Webhook capture")
public class HookController {

    private final CaptureEventUseCase captureEventUseCase;
    private final CapturedRequestMapper requestMapper;

    public HookController(CaptureEventUseCase captureEventUseCase, CapturedRequestMapper requestMapper) {
        this.captureEventUseCase = captureEventUseCase;
        this.requestMapper = requestMapper;
    }

    @RequestMapping("/hook/{id}")
    @Operation(summary = "Capture a request", description = "Records any request sent to the receiver address")
    public ResponseEntity<?> capture(
            @Parameter(description = "Receiver ID") @PathVariable String id,
            HttpServletRequest request) throws IOException {
        var idResult = ReceiverId.parse(id);
        if (idResult.isFailure()) {
            return ErrorResponse.from(idResult.errorOrNull());
        }
        var captureRequest = requestMapper.toCaptureRequest(request);
        return captureEventUseCase.captureEvent(idResult.getOrThrow(), captureRequest).<ResponseEntity<?>>fold(
            event -> ResponseEntity.ok(new CaptureResponse(true, new Received(event.id()))),
            ErrorResponse::from);
    }

    public record CaptureResponse(boolean ok, Received received) {}

    public record Received(UUID id) {}
}
