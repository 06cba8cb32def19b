package io.github.drompincen.vigil.protocol.api;

import java.util.List;

public record BulkScheduleResponse(
        int succeeded,
        List<String> failedIds
) {}
