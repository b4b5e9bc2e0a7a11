package com.hooky.application.port.in;

import com.hooky.domain.model.Receiver;

import java.util.List;

public interface ListReceiversUseCase {
    List<ReceiverOverview> listReceivers();

    record ReceiverOverview(Receiver receiver, long eventCount) {}
}
