package io.github.drompincen.vigil.protocol.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerEventTypeTest {

    @Test
    void notificationHookEventTypesExist() {
        assertThat(SchedulerEventType.valueOf("BREAKER_OPENED")).isNotNull();
        assertThat(SchedulerEventType.valueOf("SCHEDULE_AUTO_DISABLED")).isNotNull();
        assertThat(SchedulerEventType.valueOf("MANUAL_TRIGGER_COMPLETED")).isNotNull();
    }
}
