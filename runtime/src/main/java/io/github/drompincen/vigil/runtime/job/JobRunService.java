package io.github.drompincen.vigil.runtime.job;

import io.github.drompincen.vigil.persistence.document.JobRunDocument;
import io.github.drompincen.vigil.persistence.repository.JobRunRepository;
import io.github.drompincen.vigil.protocol.api.JobRunResponse;
import io.github.drompincen.vigil.protocol.api.JobRunStats;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class JobRunService {

    private static final int MAX_PAGE_SIZE = 500;

    private final JobRunRepository jobRunRepository;

    public JobRunService(JobRunRepository jobRunRepository) {
        this.jobRunRepository = jobRunRepository;
    }

    /** Newest first. {@code jobType} and {@code status} are optional filters; status wins when both are set. */
    public List<JobRunResponse> list(String tenantId, String jobType, JobRunStatus status, int page, int size) {
        Pageable pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        List<JobRunDocument> docs;
        if (tenantId == null) {
            docs = jobRunRepository.findAllByOrderByStartedAtDesc(pageable).getContent();
        } else if (status != null) {
            docs = jobRunRepository.findByTenantIdAndStatusOrderByStartedAtDesc(tenantId, status, pageable).getContent();
        } else if (jobType != null) {
            docs = jobRunRepository.findByTenantIdAndJobTypeOrderByStartedAtDesc(tenantId, jobType, pageable).getContent();
        } else {
            docs = jobRunRepository.findByTenantIdOrderByStartedAtDesc(tenantId, pageable).getContent();
        }
        return docs.stream().map(JobRunService::toResponse).collect(Collectors.toList());
    }

    public Optional<JobRunResponse> get(String jobRunId) {
        return jobRunRepository.findById(jobRunId).map(JobRunService::toResponse);
    }

    public List<JobRunResponse> forSchedule(String scheduleId) {
        return jobRunRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId).stream()
                .map(JobRunService::toResponse)
                .collect(Collectors.toList());
    }

    public List<JobRunResponse> active(String tenantId) {
        List<JobRunStatus> live = List.of(JobRunStatus.PENDING, JobRunStatus.RUNNING);
        List<JobRunDocument> docs = tenantId != null
                ? jobRunRepository.findByTenantIdAndStatusIn(tenantId, live)
                : jobRunRepository.findByStatusIn(live);
        return docs.stream().map(JobRunService::toResponse).collect(Collectors.toList());
    }

    public JobRunStats stats(String tenantId) {
        List<JobRunDocument> runs = jobRunRepository.findByTenantId(tenantId);

        Map<JobRunStatus, Long> byStatus = runs.stream()
                .collect(Collectors.groupingBy(JobRunDocument::getStatus, Collectors.counting()));
        Map<String, Long> byJobType = runs.stream()
                .filter(r -> r.getJobType() != null)
                .collect(Collectors.groupingBy(JobRunDocument::getJobType, TreeMap::new, Collectors.counting()));

        OptionalDouble avgMs = runs.stream()
                .filter(r -> r.getStatus() == JobRunStatus.COMPLETED && r.getDurationMs() != null)
                .mapToLong(JobRunDocument::getDurationMs)
                .average();

        return new JobRunStats(
                runs.size(),
                byStatus.getOrDefault(JobRunStatus.COMPLETED, 0L),
                byStatus.getOrDefault(JobRunStatus.FAILED, 0L),
                byStatus.getOrDefault(JobRunStatus.RUNNING, 0L),
                byStatus.getOrDefault(JobRunStatus.PENDING, 0L),
                avgMs.isPresent() ? avgMs.getAsDouble() / 1000.0 : null,
                byJobType
        );
    }

    static JobRunResponse toResponse(JobRunDocument d) {
        return new JobRunResponse(d.getJobRunId(), d.getScheduleId(), d.getTenantId(), d.getJobType(),
                d.getTriggerSource(), d.getStatus(), d.getStartedAt(), d.getCompletedAt(), d.getDurationMs(),
                d.getMetrics(), d.getErrorMessage());
    }
}
