package io.github.drompincen.vigil.runtime.job;

import io.github.drompincen.vigil.protocol.api.JobRunStatus;

/**
 * Outcome of one firing. {@code jobRunId} is null when the firing was skipped before a run
 * was recorded (inactive schedule, overlap limit).
 */
public record JobRunResult(
        String jobRunId,
        JobRunStatus status,
        String error,
        boolean autoDisabled,
        boolean skipped
) {
    public static JobRunResult skipped(String reason) {
        return new JobRunResult(null, null, reason, false, true);
    }

    public boolean succeeded() {
        return status == JobRunStatus.COMPLETED;
    }
}
