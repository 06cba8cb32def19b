package io.github.drompincen.vigil.protocol.api;

import java.util.List;

public record BulkScheduleRequest(
        String tenantId,
        List<String> scheduleIds
) {}
