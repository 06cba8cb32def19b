package io.github.drompincen.vigil.protocol.event;

import java.time.Instant;
import java.util.Map;

public record SchedulerEvent(
        String eventId,
        String tenantId,
        SchedulerEventType type,
        String subjectId,
        Map<String, Object> payload,
        Instant timestamp
) {}
