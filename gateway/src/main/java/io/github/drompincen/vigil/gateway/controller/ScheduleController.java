package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.*;
import io.github.drompincen.vigil.runtime.job.JobRunResult;
import io.github.drompincen.vigil.runtime.scheduler.AutomationScheduleService;
import io.github.drompincen.vigil.runtime.scheduler.TriggerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);
    private static final long TRIGGER_WAIT_SECONDS = 30;

    private final AutomationScheduleService scheduleService;
    private final TriggerEngine triggerEngine;

    public ScheduleController(AutomationScheduleService scheduleService, TriggerEngine triggerEngine) {
        this.scheduleService = scheduleService;
        this.triggerEngine = triggerEngine;
    }

    // --- CRUD ---

    @PostMapping
    public ResponseEntity<ScheduleResponse> create(@RequestBody ScheduleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(req));
    }

    @GetMapping
    public List<ScheduleResponse> list(@RequestParam(required = false) String tenantId,
                                       @RequestParam(required = false) Boolean active,
                                       @RequestParam(required = false) String jobType) {
        return scheduleService.list(tenantId, active, jobType);
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> get(@PathVariable String scheduleId) {
        return scheduleService.get(scheduleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{scheduleId}")
    public ResponseEntity<ScheduleResponse> update(@PathVariable String scheduleId,
                                                   @RequestBody ScheduleRequest req) {
        return scheduleService.update(scheduleId, req)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> delete(@PathVariable String scheduleId) {
        return scheduleService.delete(scheduleId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // --- Lifecycle ---

    @PostMapping("/{scheduleId}/activate")
    public ResponseEntity<ScheduleResponse> activate(@PathVariable String scheduleId) {
        return scheduleService.activate(scheduleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{scheduleId}/deactivate")
    public ResponseEntity<ScheduleResponse> deactivate(@PathVariable String scheduleId) {
        return scheduleService.deactivate(scheduleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /** Runs the schedule now and waits a bounded time for the outcome. */
    @PostMapping("/{scheduleId}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String scheduleId) {
        if (scheduleService.get(scheduleId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        CompletableFuture<JobRunResult> future = triggerEngine.manualTrigger(scheduleId);
        try {
            JobRunResult result = future.get(TRIGGER_WAIT_SECONDS, TimeUnit.SECONDS);
            if (result.skipped()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(new TriggerResponse(scheduleId, false, null, null, result.error()));
            }
            String message = result.succeeded() ? "Job completed" : "Job failed: " + result.error();
            return ResponseEntity.ok(new TriggerResponse(scheduleId, true, result.jobRunId(), result.status(), message));
        } catch (TimeoutException e) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new TriggerResponse(scheduleId, true, null, JobRunStatus.RUNNING,
                            "Job still running, see /api/job-runs"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for schedule " + scheduleId, e);
        } catch (ExecutionException e) {
            log.error("Manual trigger of schedule {} failed", scheduleId, e.getCause());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new TriggerResponse(scheduleId, false, null, JobRunStatus.FAILED,
                            String.valueOf(e.getCause().getMessage())));
        }
    }

    // --- Bulk ---

    @PostMapping("/bulk/activate")
    public BulkScheduleResponse bulkActivate(@RequestBody BulkScheduleRequest req) {
        return scheduleService.bulkActivate(req);
    }

    @PostMapping("/bulk/deactivate")
    public BulkScheduleResponse bulkDeactivate(@RequestBody BulkScheduleRequest req) {
        return scheduleService.bulkDeactivate(req);
    }

    @PostMapping("/bulk/delete")
    public BulkScheduleResponse bulkDelete(@RequestBody BulkScheduleRequest req) {
        return scheduleService.bulkDelete(req);
    }
}
