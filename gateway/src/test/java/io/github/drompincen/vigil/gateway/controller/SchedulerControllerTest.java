package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.SchedulerStatusResponse;
import io.github.drompincen.vigil.runtime.event.SchedulerEventService;
import io.github.drompincen.vigil.runtime.scheduler.TriggerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerControllerTest {

    @Mock private TriggerEngine triggerEngine;
    @Mock private SchedulerEventService eventService;

    private SchedulerController controller;

    @BeforeEach
    void setUp() {
        controller = new SchedulerController(triggerEngine, eventService);
    }

    @Test
    void statusReturnsEngineSnapshot() {
        var timer = new SchedulerStatusResponse.TimerInfo("s1", Instant.parse("2024-03-01T09:00:00Z"), 0);
        when(triggerEngine.status()).thenReturn(new SchedulerStatusResponse("RUNNING", 1, List.of(timer)));

        SchedulerStatusResponse status = controller.status();

        assertThat(status.state()).isEqualTo("RUNNING");
        assertThat(status.timers()).containsExactly(timer);
    }

    @Test
    void eventsLimitIsCapped() {
        when(eventService.recent("tenant-1", 500)).thenReturn(List.of());

        assertThat(controller.events("tenant-1", 10_000)).isEmpty();
        verify(eventService).recent("tenant-1", 500);
    }
}
