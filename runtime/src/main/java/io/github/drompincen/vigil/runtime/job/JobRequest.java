package io.github.drompincen.vigil.runtime.job;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.protocol.api.TriggerSource;

import java.util.List;
import java.util.Map;

public record JobRequest(
        String scheduleId,
        String tenantId,
        String jobType,
        List<String> targetIds,
        Map<String, Object> config,
        TriggerSource triggerSource
) {
    public static JobRequest forSchedule(AutomationScheduleDocument schedule, TriggerSource source) {
        return new JobRequest(schedule.getScheduleId(), schedule.getTenantId(), schedule.getJobType(),
                schedule.getTargetIds(), schedule.getConfig(), source);
    }
}
