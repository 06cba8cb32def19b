package io.github.drompincen.vigil.protocol.api;

import java.time.Instant;
import java.util.Map;

public record JobRunResponse(
        String jobRunId,
        String scheduleId,
        String tenantId,
        String jobType,
        TriggerSource triggerSource,
        JobRunStatus status,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        Map<String, Long> metrics,
        String errorMessage
) {}
