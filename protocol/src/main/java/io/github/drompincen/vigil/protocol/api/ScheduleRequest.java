package io.github.drompincen.vigil.protocol.api;

import java.util.List;
import java.util.Map;

public record ScheduleRequest(
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
        Boolean active
) {}
