package com.hooky.application.port.in;

import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;

import java.util.Map;

public interface CaptureEventUseCase {
    Result<CapturedEvent, ReceiverError> captureEvent(ReceiverId id, CaptureRequest request);

    record CaptureRequest(
        String method,
        String path,
        Map<String, Object> query,
        Map<String, Object> headers,
        Object body
    ) {}
}
