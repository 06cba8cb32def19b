package io.github.drompincen.vigil.runtime.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.vigil.persistence.document.JobRunDocument;
import io.github.drompincen.vigil.persistence.repository.JobRunRepository;
import io.github.drompincen.vigil.persistence.store.ScheduleStore;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import io.github.drompincen.vigil.protocol.event.SchedulerEventType;
import io.github.drompincen.vigil.runtime.event.SchedulerEventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Runs one job body and records its outcome on the JobRun and on the owning schedule.
 * Nothing thrown by the body or by the bookkeeping escapes {@link #execute}.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    /** Consecutive failures after which a schedule is deactivated. */
    public static final int AUTO_DISABLE_THRESHOLD = 5;

    static final String INTERRUPTED_MESSAGE = "Interrupted by scheduler restart";

    private final ScheduleStore scheduleStore;
    private final JobRunRepository jobRunRepository;
    private final SchedulerEventService eventService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobExecutor(ScheduleStore scheduleStore,
                       JobRunRepository jobRunRepository,
                       SchedulerEventService eventService,
                       ObjectMapper objectMapper,
                       Clock clock) {
        this.scheduleStore = scheduleStore;
        this.jobRunRepository = jobRunRepository;
        this.eventService = eventService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public JobRunResult execute(JobRequest request, JobBody body) {
        JobRunDocument run;
        try {
            run = createRun(request);
        } catch (Exception e) {
            log.error("Could not record job run for schedule {} ({})", request.scheduleId(), request.jobType(), e);
            return new JobRunResult(null, JobRunStatus.FAILED, "Could not record job run: " + e.getMessage(),
                    false, false);
        }

        JobResult result;
        try {
            transition(run, JobRunStatus.RUNNING);
            run.setStartedAt(clock.instant());
            jobRunRepository.save(run);

            log.info("Job run {} started: type={} schedule={} tenant={} trigger={}", run.getJobRunId(),
                    request.jobType(), request.scheduleId(), request.tenantId(), request.triggerSource());

            JobContext ctx = new JobContext(request.tenantId(),
                    request.targetIds() != null ? request.targetIds() : List.of(),
                    request.config() != null ? request.config() : Map.of(),
                    run.getJobRunId(), request.scheduleId(), objectMapper);
            result = body.run(ctx);
            if (result == null) {
                result = JobResult.failure("Job returned no result");
            }
        } catch (Exception e) {
            log.error("Job run {} ({}) threw: {}", run.getJobRunId(), request.jobType(), e.getMessage(), e);
            result = JobResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        return result.success() ? completeRun(request, run, result) : failRun(request, run, result.error());
    }

    /**
     * Marks runs left PENDING or RUNNING by a previous process as FAILED.
     *
     * @return the number of runs repaired
     */
    public int recoverInterruptedRuns() {
        List<JobRunDocument> orphans = jobRunRepository.findByStatusIn(
                List.of(JobRunStatus.PENDING, JobRunStatus.RUNNING));
        Instant now = clock.instant();
        for (JobRunDocument run : orphans) {
            run.setStatus(JobRunStatus.FAILED);
            run.setErrorMessage(INTERRUPTED_MESSAGE);
            run.setCompletedAt(now);
            if (run.getStartedAt() != null) {
                run.setDurationMs(Duration.between(run.getStartedAt(), now).toMillis());
            }
            jobRunRepository.save(run);
        }
        if (!orphans.isEmpty()) {
            log.warn("Marked {} interrupted job runs as FAILED", orphans.size());
        }
        return orphans.size();
    }

    private JobRunDocument createRun(JobRequest request) {
        JobRunDocument run = new JobRunDocument();
        run.setJobRunId(UUID.randomUUID().toString());
        run.setScheduleId(request.scheduleId());
        run.setTenantId(request.tenantId());
        run.setJobType(request.jobType());
        run.setTriggerSource(request.triggerSource());
        run.setStatus(JobRunStatus.PENDING);
        run.setCreatedAt(clock.instant());
        jobRunRepository.save(run);
        return run;
    }

    private JobRunResult completeRun(JobRequest request, JobRunDocument run, JobResult result) {
        Instant now = clock.instant();
        try {
            transition(run, JobRunStatus.COMPLETED);
            run.setMetrics(result.metrics() != null ? new HashMap<>(result.metrics()) : Map.of());
            finish(run, now);
            jobRunRepository.save(run);
            if (request.scheduleId() != null) {
                scheduleStore.recordSuccess(request.scheduleId(), run.getJobRunId(), now);
            }
            log.info("Job run {} completed in {}ms, metrics={}", run.getJobRunId(), run.getDurationMs(),
                    run.getMetrics());
        } catch (Exception e) {
            log.error("Failed to record success of job run {}", run.getJobRunId(), e);
        }
        return new JobRunResult(run.getJobRunId(), JobRunStatus.COMPLETED, null, false, false);
    }

    private JobRunResult failRun(JobRequest request, JobRunDocument run, String error) {
        Instant now = clock.instant();
        boolean autoDisabled = false;
        try {
            transition(run, JobRunStatus.FAILED);
            run.setErrorMessage(error);
            finish(run, now);
            jobRunRepository.save(run);
            log.warn("Job run {} ({}) failed: {}", run.getJobRunId(), request.jobType(), error);

            if (request.scheduleId() != null) {
                int streak = scheduleStore.recordFailure(request.scheduleId(), error, now);
                if (streak >= AUTO_DISABLE_THRESHOLD && scheduleStore.deactivate(request.scheduleId(), now)) {
                    autoDisabled = true;
                    log.warn("Schedule {} auto-disabled after {} consecutive failures", request.scheduleId(), streak);
                    Map<String, Object> payload = new HashMap<>();
                    payload.put("consecutiveFailures", streak);
                    payload.put("lastError", error);
                    payload.put("jobType", request.jobType());
                    eventService.publish(request.tenantId(), SchedulerEventType.SCHEDULE_AUTO_DISABLED,
                            request.scheduleId(), payload);
                }
            }
        } catch (Exception e) {
            log.error("Failed to record failure of job run {}", run.getJobRunId(), e);
        }
        return new JobRunResult(run.getJobRunId(), JobRunStatus.FAILED, error, autoDisabled, false);
    }

    private static void finish(JobRunDocument run, Instant now) {
        run.setCompletedAt(now);
        if (run.getStartedAt() != null) {
            run.setDurationMs(Duration.between(run.getStartedAt(), now).toMillis());
        }
    }

    private static void transition(JobRunDocument run, JobRunStatus next) {
        if (!run.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException("Job run " + run.getJobRunId() + " cannot move from "
                    + run.getStatus() + " to " + next);
        }
        run.setStatus(next);
    }
}
