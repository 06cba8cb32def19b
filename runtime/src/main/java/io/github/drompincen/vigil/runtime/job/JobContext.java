package io.github.drompincen.vigil.runtime.job;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

public record JobContext(
        String tenantId,
        List<String> targetIds,
        Map<String, Object> config,
        String jobRunId,
        String scheduleId,
        ObjectMapper objectMapper
) {
    /** Binds the free-form schedule config onto a job-specific type. */
    public <T> T configAs(Class<T> type) {
        return objectMapper.convertValue(config != null ? config : Map.of(), type);
    }
}
