package io.github.drompincen.vigil.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScheduleResponse(
        String scheduleId,
        String tenantId,
        String createdByUserId,
        String name,
        String description,
        String jobType,
        List<String> targetIds,
        Map<String, Object> config,
        ScheduleType scheduleType,
        String cronExpression,
        Integer hourOfDay,
        Integer minuteOfHour,
        Integer dayOfWeek,
        Integer dayOfMonth,
        boolean active,
        boolean registered,
        Instant nextRunAt,
        Instant lastRunAt,
        RunStatus lastRunStatus,
        int consecutiveFailures,
        String lastErrorMessage,
        Instant createdAt,
        Instant updatedAt
) {}
