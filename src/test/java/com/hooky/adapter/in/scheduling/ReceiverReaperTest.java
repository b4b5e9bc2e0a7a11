package com.hooky.adapter.in.scheduling;

import com.hooky.application.port.in.SweepExpiredReceiversUseCase;
import com.hooky.infrastructure.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReceiverReaperTest {

    @Mock
    private SweepExpiredReceiversUseCase sweepExpiredReceiversUseCase;

    @InjectMocks
    private ReceiverReaper reaper;

    @Test
    void shouldSweepOnEachPass() {
        when(sweepExpiredReceiversUseCase.sweepExpired()).thenReturn(3, 0);

        reaper.sweep();
        reaper.sweep();

        verify(sweepExpiredReceiversUseCase, times(2)).sweepExpired();
    }

    @Test
    void shouldSurviveStoreOutage() {
        when(sweepExpiredReceiversUseCase.sweepExpired())
            .thenThrow(new StoreUnavailableException("sweep", new RedisConnectionFailureException("down")));

        assertDoesNotThrow(reaper::sweep);
    }
}
