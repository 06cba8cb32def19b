package io.github.drompincen.vigil.runtime.scheduler;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.persistence.repository.AutomationScheduleRepository;
import io.github.drompincen.vigil.persistence.store.ScheduleStore;
import io.github.drompincen.vigil.protocol.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Schedule CRUD. Every change that affects firing is pushed to the {@link TriggerEngine}.
 */
@Service
public class AutomationScheduleService {

    private static final Logger log = LoggerFactory.getLogger(AutomationScheduleService.class);
    private static final int MAX_NAME_LENGTH = 200;

    private final AutomationScheduleRepository scheduleRepository;
    private final ScheduleStore scheduleStore;
    private final RecurrenceCalculator recurrenceCalculator;
    private final TriggerEngine triggerEngine;
    private final Clock clock;

    public AutomationScheduleService(AutomationScheduleRepository scheduleRepository,
                                     ScheduleStore scheduleStore,
                                     RecurrenceCalculator recurrenceCalculator,
                                     TriggerEngine triggerEngine,
                                     Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.scheduleStore = scheduleStore;
        this.recurrenceCalculator = recurrenceCalculator;
        this.triggerEngine = triggerEngine;
        this.clock = clock;
    }

    public ScheduleResponse create(ScheduleRequest req) {
        requireText(req.tenantId(), "tenantId");
        requireText(req.jobType(), "jobType");
        requireText(req.name(), "name");
        if (req.scheduleType() == null) {
            throw new IllegalArgumentException("scheduleType is required");
        }

        Instant now = clock.instant();
        AutomationScheduleDocument doc = new AutomationScheduleDocument();
        doc.setScheduleId(UUID.randomUUID().toString());
        doc.setTenantId(req.tenantId());
        doc.setCreatedByUserId(req.createdByUserId());
        doc.setName(req.name());
        doc.setDescription(req.description());
        doc.setJobType(req.jobType());
        doc.setTargetIds(req.targetIds());
        doc.setConfig(req.config() != null ? req.config() : new HashMap<>());
        doc.setScheduleType(req.scheduleType());
        doc.setCronExpression(req.cronExpression());
        doc.setHourOfDay(req.hourOfDay());
        doc.setMinuteOfHour(req.minuteOfHour());
        doc.setDayOfWeek(req.dayOfWeek());
        doc.setDayOfMonth(req.dayOfMonth());
        doc.setActive(req.active() != null ? req.active() : true);
        doc.setLastRunStatus(RunStatus.UNKNOWN);
        doc.setConsecutiveFailures(0);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        validate(doc);
        doc.setNextRunAt(computeNextRun(doc, now));

        scheduleStore.save(doc);
        triggerEngine.add(doc);
        log.info("Created schedule {} '{}' ({}, {}) for tenant {}", doc.getScheduleId(), doc.getName(),
                doc.getJobType(), doc.getScheduleType(), doc.getTenantId());
        return toResponse(doc);
    }

    public Optional<ScheduleResponse> get(String scheduleId) {
        return scheduleStore.findById(scheduleId).map(this::toResponse);
    }

    /** {@code active} and {@code jobType} are optional and combine. */
    public List<ScheduleResponse> list(String tenantId, Boolean active, String jobType) {
        List<AutomationScheduleDocument> schedules;
        if (tenantId == null) {
            schedules = scheduleRepository.findAll().stream()
                    .filter(s -> active == null || s.isActive() == active)
                    .filter(s -> jobType == null || jobType.equals(s.getJobType()))
                    .collect(Collectors.toList());
        } else if (active != null && jobType != null) {
            schedules = scheduleRepository.findByTenantIdAndActiveAndJobType(tenantId, active, jobType);
        } else if (active != null) {
            schedules = scheduleRepository.findByTenantIdAndActive(tenantId, active);
        } else if (jobType != null) {
            schedules = scheduleRepository.findByTenantIdAndJobType(tenantId, jobType);
        } else {
            schedules = scheduleRepository.findByTenantId(tenantId);
        }
        return schedules.stream()
                .sorted(Comparator.comparing(AutomationScheduleDocument::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    /** Applies the non-null fields of {@code req}. */
    public Optional<ScheduleResponse> update(String scheduleId, ScheduleRequest req) {
        return scheduleStore.findById(scheduleId).map(existing -> {
            Recurrence before = Recurrence.of(existing);
            boolean wasActive = existing.isActive();

            if (req.name() != null) existing.setName(req.name());
            if (req.description() != null) existing.setDescription(req.description());
            if (req.jobType() != null) existing.setJobType(req.jobType());
            if (req.targetIds() != null) existing.setTargetIds(req.targetIds());
            if (req.config() != null) existing.setConfig(req.config());
            if (req.scheduleType() != null) existing.setScheduleType(req.scheduleType());
            if (req.cronExpression() != null) existing.setCronExpression(req.cronExpression());
            if (req.hourOfDay() != null) existing.setHourOfDay(req.hourOfDay());
            if (req.minuteOfHour() != null) existing.setMinuteOfHour(req.minuteOfHour());
            if (req.dayOfWeek() != null) existing.setDayOfWeek(req.dayOfWeek());
            if (req.dayOfMonth() != null) existing.setDayOfMonth(req.dayOfMonth());
            if (req.active() != null) existing.setActive(req.active());
            validate(existing);

            Instant now = clock.instant();
            if (!Recurrence.of(existing).equals(before) || (existing.isActive() && !wasActive)) {
                existing.setNextRunAt(computeNextRun(existing, now));
            }
            existing.setUpdatedAt(now);
            scheduleStore.save(existing);
            triggerEngine.update(existing);
            log.info("Updated schedule {} '{}'", existing.getScheduleId(), existing.getName());
            return toResponse(existing);
        });
    }

    /** Re-enables the schedule and clears its failure streak. */
    public Optional<ScheduleResponse> activate(String scheduleId) {
        return scheduleStore.findById(scheduleId).map(schedule -> {
            Instant now = clock.instant();
            schedule.setActive(true);
            schedule.setConsecutiveFailures(0);
            schedule.setLastErrorMessage(null);
            schedule.setNextRunAt(computeNextRun(schedule, now));
            schedule.setUpdatedAt(now);
            scheduleStore.save(schedule);
            triggerEngine.update(schedule);
            log.info("Activated schedule {} '{}'", schedule.getScheduleId(), schedule.getName());
            return toResponse(schedule);
        });
    }

    public Optional<ScheduleResponse> deactivate(String scheduleId) {
        return scheduleStore.findById(scheduleId).map(schedule -> {
            schedule.setActive(false);
            schedule.setUpdatedAt(clock.instant());
            scheduleStore.save(schedule);
            triggerEngine.remove(scheduleId);
            log.info("Deactivated schedule {} '{}'", schedule.getScheduleId(), schedule.getName());
            return toResponse(schedule);
        });
    }

    public boolean delete(String scheduleId) {
        Optional<AutomationScheduleDocument> found = scheduleStore.findById(scheduleId);
        if (found.isEmpty()) return false;
        triggerEngine.remove(scheduleId);
        scheduleStore.delete(scheduleId);
        log.info("Deleted schedule {} '{}'", scheduleId, found.get().getName());
        return true;
    }

    public BulkScheduleResponse bulkActivate(BulkScheduleRequest req) {
        return bulk(req, id -> activate(id).isPresent());
    }

    public BulkScheduleResponse bulkDeactivate(BulkScheduleRequest req) {
        return bulk(req, id -> deactivate(id).isPresent());
    }

    public BulkScheduleResponse bulkDelete(BulkScheduleRequest req) {
        return bulk(req, this::delete);
    }

    // Ids that belong to another tenant are reported as failed.
    private BulkScheduleResponse bulk(BulkScheduleRequest req, Function<String, Boolean> operation) {
        requireText(req.tenantId(), "tenantId");
        if (req.scheduleIds() == null || req.scheduleIds().isEmpty()) {
            throw new IllegalArgumentException("scheduleIds must not be empty");
        }
        int succeeded = 0;
        List<String> failed = new ArrayList<>();
        for (String id : req.scheduleIds()) {
            try {
                boolean owned = scheduleRepository.findByScheduleIdAndTenantId(id, req.tenantId()).isPresent();
                if (owned && operation.apply(id)) {
                    succeeded++;
                } else {
                    failed.add(id);
                }
            } catch (RuntimeException e) {
                log.warn("Bulk operation failed for schedule {}: {}", id, e.getMessage());
                failed.add(id);
            }
        }
        return new BulkScheduleResponse(succeeded, failed);
    }

    // ------------------------------------------------------------------

    private void validate(AutomationScheduleDocument doc) {
        if (doc.getName() != null && doc.getName().length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        requireRange(doc.getHourOfDay(), 0, 23, "hourOfDay");
        requireRange(doc.getMinuteOfHour(), 0, 59, "minuteOfHour");
        requireRange(doc.getDayOfWeek(), 0, 6, "dayOfWeek");
        requireRange(doc.getDayOfMonth(), 1, 31, "dayOfMonth");

        ScheduleType type = doc.getScheduleType();
        if ((type == ScheduleType.DAILY || type == ScheduleType.WEEKLY) && doc.getHourOfDay() == null) {
            throw new IllegalArgumentException("hourOfDay is required when scheduleType is " + type);
        }
        if (type == ScheduleType.WEEKLY && doc.getDayOfWeek() == null) {
            throw new IllegalArgumentException("dayOfWeek is required when scheduleType is WEEKLY");
        }
        if (type == ScheduleType.MONTHLY && doc.getDayOfMonth() == null) {
            throw new IllegalArgumentException("dayOfMonth is required when scheduleType is MONTHLY");
        }
        if (type == ScheduleType.CUSTOM) {
            recurrenceCalculator.validateCron(doc.getCronExpression()).ifPresent(error -> {
                throw new IllegalArgumentException("Invalid cron expression: " + error);
            });
        }
    }

    private Instant computeNextRun(AutomationScheduleDocument doc, Instant now) {
        if (doc.getScheduleType() == ScheduleType.MANUAL) return null;
        return recurrenceCalculator.nextRun(Recurrence.of(doc), now);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static void requireRange(Integer value, int min, int max, String field) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max);
        }
    }

    private ScheduleResponse toResponse(AutomationScheduleDocument d) {
        return new ScheduleResponse(
                d.getScheduleId(),
                d.getTenantId(),
                d.getCreatedByUserId(),
                d.getName(),
                d.getDescription(),
                d.getJobType(),
                d.getTargetIds(),
                d.getConfig(),
                d.getScheduleType(),
                d.getCronExpression(),
                d.getHourOfDay(),
                d.getMinuteOfHour(),
                d.getDayOfWeek(),
                d.getDayOfMonth(),
                d.isActive(),
                triggerEngine.isRegistered(d.getScheduleId()),
                d.getNextRunAt(),
                d.getLastRunAt(),
                d.getLastRunStatus(),
                d.getConsecutiveFailures(),
                d.getLastErrorMessage(),
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }
}
