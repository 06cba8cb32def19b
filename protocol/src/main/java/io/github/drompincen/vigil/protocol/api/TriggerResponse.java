package io.github.drompincen.vigil.protocol.api;

public record TriggerResponse(
        String scheduleId,
        boolean executed,
        String jobRunId,
        JobRunStatus status,
        String message
) {}
