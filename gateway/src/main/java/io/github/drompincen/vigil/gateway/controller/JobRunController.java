package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.JobRunResponse;
import io.github.drompincen.vigil.protocol.api.JobRunStats;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import io.github.drompincen.vigil.runtime.job.JobRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/job-runs")
public class JobRunController {

    private final JobRunService jobRunService;

    public JobRunController(JobRunService jobRunService) {
        this.jobRunService = jobRunService;
    }

    @GetMapping
    public List<JobRunResponse> list(@RequestParam(required = false) String tenantId,
                                     @RequestParam(required = false) String scheduleId,
                                     @RequestParam(required = false) String jobType,
                                     @RequestParam(required = false) JobRunStatus status,
                                     @RequestParam(defaultValue = "0") int page,
                                     @RequestParam(defaultValue = "50") int size) {
        if (scheduleId != null) {
            return jobRunService.forSchedule(scheduleId);
        }
        return jobRunService.list(tenantId, jobType, status, page, size);
    }

    @GetMapping("/active")
    public List<JobRunResponse> active(@RequestParam(required = false) String tenantId) {
        return jobRunService.active(tenantId);
    }

    @GetMapping("/stats")
    public JobRunStats stats(@RequestParam String tenantId) {
        return jobRunService.stats(tenantId);
    }

    @GetMapping("/{jobRunId}")
    public ResponseEntity<JobRunResponse> get(@PathVariable String jobRunId) {
        return jobRunService.get(jobRunId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
