package io.github.drompincen.vigil.runtime.scheduler;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.persistence.store.ScheduleStore;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import io.github.drompincen.vigil.protocol.api.SchedulerStatusResponse;
import io.github.drompincen.vigil.protocol.api.TriggerSource;
import io.github.drompincen.vigil.protocol.event.SchedulerEventType;
import io.github.drompincen.vigil.runtime.event.SchedulerEventService;
import io.github.drompincen.vigil.runtime.job.JobExecutor;
import io.github.drompincen.vigil.runtime.job.JobRegistry;
import io.github.drompincen.vigil.runtime.job.JobRequest;
import io.github.drompincen.vigil.runtime.job.JobRunResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps one timer per active, non-manual schedule and turns each firing into a job run.
 * <p>
 * Timers live on the {@link TaskScheduler}; job bodies run on the worker executor so a slow
 * job never holds a timer thread. When a timer fires the next occurrence is armed right away,
 * then the occurrence is dispatched. Up to {@code maxInstances} runs of one schedule may
 * overlap; further occurrences are skipped.
 */
@Service
public class TriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(TriggerEngine.class);

    private final ScheduleStore scheduleStore;
    private final RecurrenceCalculator recurrenceCalculator;
    private final JobExecutor jobExecutor;
    private final JobRegistry jobRegistry;
    private final SchedulerEventService eventService;
    private final TaskScheduler taskScheduler;
    private final Executor workerExecutor;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Object timerLock = new Object();
    private volatile EngineState state = EngineState.NOT_STARTED;

    private record Timer(ScheduledFuture<?> future, Instant fireAt) {}

    public TriggerEngine(ScheduleStore scheduleStore,
                         RecurrenceCalculator recurrenceCalculator,
                         JobExecutor jobExecutor,
                         JobRegistry jobRegistry,
                         SchedulerEventService eventService,
                         TaskScheduler taskScheduler,
                         @Qualifier("jobWorkerExecutor") Executor workerExecutor,
                         SchedulerProperties properties,
                         Clock clock) {
        this.scheduleStore = scheduleStore;
        this.recurrenceCalculator = recurrenceCalculator;
        this.jobExecutor = jobExecutor;
        this.jobRegistry = jobRegistry;
        this.eventService = eventService;
        this.taskScheduler = taskScheduler;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public synchronized void start() {
        if (state != EngineState.NOT_STARTED) {
            throw new IllegalStateException("Trigger engine cannot start from state " + state);
        }
        try {
            jobExecutor.recoverInterruptedRuns();
        } catch (Exception e) {
            log.error("Failed to recover interrupted job runs", e);
        }

        state = EngineState.RUNNING;
        Instant now = clock.instant();
        List<AutomationScheduleDocument> schedules = scheduleStore.loadActiveSchedules();
        for (AutomationScheduleDocument schedule : schedules) {
            try {
                seed(schedule, now);
            } catch (Exception e) {
                log.error("Failed to register schedule {}", schedule.getScheduleId(), e);
            }
        }
        log.info("Trigger engine started with {} timers", timers.size());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (state == EngineState.SHUT_DOWN) return;
        state = EngineState.SHUT_DOWN;
        synchronized (timerLock) {
            timers.values().forEach(t -> t.future().cancel(false));
            timers.clear();
        }
        log.info("Trigger engine shut down");
    }

    /** Registers a newly created schedule. Inactive and manual schedules get no timer. */
    public void add(AutomationScheduleDocument schedule) {
        update(schedule);
    }

    /** Brings the timer for {@code schedule} in line with its current definition. Idempotent. */
    public void update(AutomationScheduleDocument schedule) {
        String scheduleId = schedule.getScheduleId();
        if (state != EngineState.RUNNING) {
            log.debug("Engine is {}, not registering schedule {}", state, scheduleId);
            return;
        }
        if (!schedule.isActive() || schedule.getScheduleType() == ScheduleType.MANUAL) {
            remove(scheduleId);
            return;
        }
        reportInvalidCron(schedule);
        Instant now = clock.instant();
        Instant stored = schedule.getNextRunAt();
        Instant fireAt = stored != null && stored.isAfter(now)
                ? stored
                : recurrenceCalculator.nextRun(Recurrence.of(schedule), now);
        if (!fireAt.equals(stored)) {
            scheduleStore.updateNextRun(scheduleId, fireAt);
        }
        register(scheduleId, fireAt);
        log.info("Registered schedule {} ({}), next run {}", scheduleId, schedule.getScheduleType(), fireAt);
    }

    public void remove(String scheduleId) {
        if (unregister(scheduleId)) {
            log.info("Removed timer for schedule {}", scheduleId);
        }
    }

    public boolean isRegistered(String scheduleId) {
        return timers.containsKey(scheduleId);
    }

    public EngineState getState() {
        return state;
    }

    /**
     * Runs the schedule now on the worker pool. The registered timer is left as it is.
     *
     * @throws NoSuchElementException when the schedule does not exist
     */
    public CompletableFuture<JobRunResult> manualTrigger(String scheduleId) {
        if (state == EngineState.SHUT_DOWN) {
            throw new IllegalStateException("Trigger engine is shut down");
        }
        AutomationScheduleDocument schedule = scheduleStore.findById(scheduleId)
                .orElseThrow(() -> new NoSuchElementException("Schedule not found: " + scheduleId));
        log.info("Manually triggering schedule {} ({})", scheduleId, schedule.getJobType());

        return CompletableFuture.supplyAsync(() -> {
            JobRunResult result = dispatch(scheduleId, TriggerSource.MANUAL);
            Map<String, Object> payload = new HashMap<>();
            payload.put("jobRunId", result.jobRunId());
            payload.put("status", result.status() != null ? result.status().name() : "SKIPPED");
            payload.put("skipped", result.skipped());
            eventService.publish(schedule.getTenantId(), SchedulerEventType.MANUAL_TRIGGER_COMPLETED,
                    scheduleId, payload);
            return result;
        }, workerExecutor);
    }

    public SchedulerStatusResponse status() {
        List<SchedulerStatusResponse.TimerInfo> infos = timers.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.comparing(Timer::fireAt)))
                .map(e -> new SchedulerStatusResponse.TimerInfo(e.getKey(), e.getValue().fireAt(),
                        runningInstances(e.getKey())))
                .toList();
        return new SchedulerStatusResponse(state.name(), infos.size(), infos);
    }

    // ------------------------------------------------------------------
    // Firing
    // ------------------------------------------------------------------

    void onTimer(String scheduleId, Instant dueAt) {
        if (state != EngineState.RUNNING) return;
        try {
            Instant now = clock.instant();
            Optional<AutomationScheduleDocument> found = scheduleStore.findById(scheduleId);
            if (found.isEmpty() || !found.get().isActive()
                    || found.get().getScheduleType() == ScheduleType.MANUAL) {
                log.info("Schedule {} is gone or inactive, dropping its timer", scheduleId);
                unregister(scheduleId);
                return;
            }

            Instant next = recurrenceCalculator.nextRun(Recurrence.of(found.get()),
                    now.isAfter(dueAt) ? now : dueAt);
            if (!rearm(scheduleId, dueAt, next)) {
                log.debug("Timer for schedule {} at {} was replaced, ignoring", scheduleId, dueAt);
                return;
            }
            scheduleStore.updateNextRun(scheduleId, next);

            if (now.isAfter(dueAt.plus(properties.misfireGrace()))) {
                log.warn("Schedule {} misfired: due {} but fired at {}, skipping this occurrence",
                        scheduleId, dueAt, now);
                return;
            }
            workerExecutor.execute(() -> dispatch(scheduleId, TriggerSource.SCHEDULED));
        } catch (Exception e) {
            log.error("Timer for schedule {} failed", scheduleId, e);
        }
    }

    /**
     * Runs one occurrence. Returns a skipped result when the schedule is gone, inactive or
     * already running {@code maxInstances} times.
     */
    JobRunResult dispatch(String scheduleId, TriggerSource source) {
        try {
            Optional<AutomationScheduleDocument> found = scheduleStore.findById(scheduleId);
            if (found.isEmpty() || !found.get().isActive()) {
                log.info("Schedule {} is missing or inactive, skipping execution", scheduleId);
                unregister(scheduleId);
                return JobRunResult.skipped("Schedule is missing or inactive");
            }
            AutomationScheduleDocument schedule = found.get();

            AtomicInteger running = inFlight.computeIfAbsent(scheduleId, k -> new AtomicInteger());
            if (running.incrementAndGet() > properties.getMaxInstances()) {
                running.decrementAndGet();
                log.warn("Schedule {} already has {} runs in flight, skipping this occurrence",
                        scheduleId, properties.getMaxInstances());
                return JobRunResult.skipped("Maximum concurrent runs reached");
            }
            try {
                scheduleStore.markFired(scheduleId, clock.instant());
                JobRunResult result = jobExecutor.execute(JobRequest.forSchedule(schedule, source),
                        jobRegistry.resolve(schedule.getJobType()));

                if (result.autoDisabled()) {
                    unregister(scheduleId);
                } else if (source == TriggerSource.SCHEDULED) {
                    refreshNextRun(scheduleId);
                }
                return result;
            } finally {
                running.decrementAndGet();
            }
        } catch (Exception e) {
            log.error("Dispatch of schedule {} failed", scheduleId, e);
            return JobRunResult.skipped("Dispatch failed: " + e.getMessage());
        }
    }

    /**
     * Moves the timer past the completion time when the run overran the occurrence armed
     * by {@link #onTimer}. A timer still in the future is kept, and a timer only ever moves
     * forward.
     */
    private void refreshNextRun(String scheduleId) {
        if (state != EngineState.RUNNING) return;
        Optional<AutomationScheduleDocument> found = scheduleStore.findById(scheduleId);
        if (found.isEmpty() || !found.get().isActive()) return;

        Instant now = clock.instant();
        Instant next;
        synchronized (timerLock) {
            Timer current = timers.get(scheduleId);
            if (current == null || current.fireAt().isAfter(now)) return;
            next = recurrenceCalculator.nextRun(Recurrence.of(found.get()), now);
            if (!next.isAfter(current.fireAt())) return;
            scheduleStore.updateNextRun(scheduleId, next);
            register(scheduleId, next);
        }
        log.debug("Schedule {} overran its next occurrence, next run moved to {}", scheduleId, next);
    }

    // ------------------------------------------------------------------
    // Timers
    // ------------------------------------------------------------------

    private void seed(AutomationScheduleDocument schedule, Instant now) {
        reportInvalidCron(schedule);
        Recurrence recurrence = Recurrence.of(schedule);
        Instant stored = schedule.getNextRunAt();
        Instant fireAt;
        if (stored == null) {
            fireAt = recurrenceCalculator.nextRun(recurrence, now);
        } else if (stored.isBefore(now.minus(properties.misfireGrace()))) {
            log.warn("Schedule {} missed its run at {}, next run computed from now",
                    schedule.getScheduleId(), stored);
            fireAt = recurrenceCalculator.nextRun(recurrence, now);
        } else {
            fireAt = stored;
        }
        if (!fireAt.equals(stored)) {
            scheduleStore.updateNextRun(schedule.getScheduleId(), fireAt);
        }
        register(schedule.getScheduleId(), fireAt);
        log.info("Registered schedule {} ({}), next run {}", schedule.getScheduleId(),
                schedule.getScheduleType(), fireAt);
    }

    // An invalid expression still gets a timer: the calculator falls back to one day.
    private void reportInvalidCron(AutomationScheduleDocument schedule) {
        if (schedule.getScheduleType() != ScheduleType.CUSTOM) return;
        recurrenceCalculator.validateCron(schedule.getCronExpression()).ifPresent(error -> {
            log.warn("Schedule {} has an invalid cron expression '{}': {}", schedule.getScheduleId(),
                    schedule.getCronExpression(), error);
            Map<String, Object> payload = new HashMap<>();
            payload.put("cronExpression", schedule.getCronExpression());
            payload.put("error", error);
            eventService.publish(schedule.getTenantId(), SchedulerEventType.CRON_EXPRESSION_INVALID,
                    schedule.getScheduleId(), payload);
        });
    }

    private void register(String scheduleId, Instant fireAt) {
        synchronized (timerLock) {
            Timer previous = timers.get(scheduleId);
            if (previous != null) {
                if (previous.fireAt().equals(fireAt)) return;
                previous.future().cancel(false);
            }
            ScheduledFuture<?> future = taskScheduler.schedule(() -> onTimer(scheduleId, fireAt), fireAt);
            timers.put(scheduleId, new Timer(future, fireAt));
        }
    }

    private boolean rearm(String scheduleId, Instant firedAt, Instant next) {
        synchronized (timerLock) {
            Timer current = timers.get(scheduleId);
            if (current == null || !current.fireAt().equals(firedAt)) return false;
            ScheduledFuture<?> future = taskScheduler.schedule(() -> onTimer(scheduleId, next), next);
            timers.put(scheduleId, new Timer(future, next));
            return true;
        }
    }

    private boolean unregister(String scheduleId) {
        synchronized (timerLock) {
            Timer removed = timers.remove(scheduleId);
            if (removed == null) return false;
            removed.future().cancel(false);
            return true;
        }
    }

    private int runningInstances(String scheduleId) {
        AtomicInteger running = inFlight.get(scheduleId);
        return running != null ? running.get() : 0;
    }
}
