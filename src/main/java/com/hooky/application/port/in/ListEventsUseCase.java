package com.hooky.application.port.in;

import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;

import java.util.List;

public interface ListEventsUseCase {
    Result<List<CapturedEvent>, ReceiverError> listEvents(ReceiverId id);
}
