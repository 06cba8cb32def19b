package io.github.drompincen.vigil.persistence.store;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage boundary for automation schedules as seen by the scheduler.
 * <p>
 * Timing and outcome fields are written with targeted field updates instead of whole-document
 * saves, so concurrent firings of the same schedule cannot lose each other's writes.
 */
public interface ScheduleStore {

    /** Active schedules whose type is not MANUAL. */
    List<AutomationScheduleDocument> loadActiveSchedules();

    Optional<AutomationScheduleDocument> findById(String scheduleId);

    AutomationScheduleDocument save(AutomationScheduleDocument schedule);

    void delete(String scheduleId);

    void markFired(String scheduleId, Instant firedAt);

    void updateNextRun(String scheduleId, Instant nextRunAt);

    void recordSuccess(String scheduleId, String jobRunId, Instant at);

    /**
     * Atomically increments the failure streak and stores the error.
     *
     * @return the streak after the increment, or 0 when the schedule no longer exists
     */
    int recordFailure(String scheduleId, String errorMessage, Instant at);

    /** @return true when the schedule existed and was active */
    boolean deactivate(String scheduleId, Instant at);
}
