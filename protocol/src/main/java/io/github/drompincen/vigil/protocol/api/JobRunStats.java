package io.github.drompincen.vigil.protocol.api;

import java.util.Map;

public record JobRunStats(
        long totalRuns,
        long completedRuns,
        long failedRuns,
        long runningRuns,
        long pendingRuns,
        Double averageDurationSeconds,
        Map<String, Long> runsByJobType
) {}
