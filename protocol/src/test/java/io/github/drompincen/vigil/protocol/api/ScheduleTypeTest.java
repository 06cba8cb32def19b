package io.github.drompincen.vigil.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleTypeTest {

    @Test
    void allRecurrenceKindsExist() {
        assertThat(ScheduleType.values()).containsExactly(
                ScheduleType.MANUAL,
                ScheduleType.HOURLY,
                ScheduleType.DAILY,
                ScheduleType.WEEKLY,
                ScheduleType.MONTHLY,
                ScheduleType.CUSTOM);
    }

    @Test
    void valueOfReturnsCorrectEnum() {
        assertThat(ScheduleType.valueOf("CUSTOM")).isEqualTo(ScheduleType.CUSTOM);
        assertThat(CircuitState.valueOf("HALF_OPEN")).isEqualTo(CircuitState.HALF_OPEN);
    }
}
