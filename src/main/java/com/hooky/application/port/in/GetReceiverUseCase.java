package com.hooky.application.port.in;

import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;

public interface GetReceiverUseCase {
    Result<Receiver, ReceiverError> getReceiver(ReceiverId id);
}
