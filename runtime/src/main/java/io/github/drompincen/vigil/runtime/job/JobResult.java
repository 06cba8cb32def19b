package io.github.drompincen.vigil.runtime.job;

import java.util.Map;

public record JobResult(
        boolean success,
        Map<String, Long> metrics,
        String error
) {
    public static JobResult success(Map<String, Long> metrics) {
        return new JobResult(true, metrics != null ? metrics : Map.of(), null);
    }

    public static JobResult failure(String error) {
        return new JobResult(false, Map.of(), error);
    }
}
