package io.github.drompincen.vigil.protocol.api;

import java.time.Instant;
import java.util.List;

public record SchedulerStatusResponse(
        String state,
        int totalTimers,
        List<TimerInfo> timers
) {
    public record TimerInfo(String scheduleId, Instant nextFireAt, int runningInstances) {}
}
