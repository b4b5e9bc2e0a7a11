package com.hooky.application.port.in;

import com.hooky.domain.model.ReceiverId;

public interface DeleteReceiverUseCase {
    /**
     * @return true if the receiver existed and was removed, false if there was nothing to delete
     */
    boolean deleteReceiver(ReceiverId id);
}
