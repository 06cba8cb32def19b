package io.github.drompincen.vigil.persistence.document;

import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import io.github.drompincen.vigil.protocol.api.TriggerSource;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "job_runs")
@CompoundIndex(name = "tenant_status_idx", def = "{'tenantId': 1, 'status': 1}")
@CompoundIndex(name = "tenant_started_idx", def = "{'tenantId': 1, 'startedAt': -1}")
public class JobRunDocument {

    @Id
    private String jobRunId;
    @Indexed
    private String scheduleId;
    private String tenantId;
    private String jobType;
    private TriggerSource triggerSource;
    private JobRunStatus status = JobRunStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Map<String, Long> metrics;
    private String errorMessage;
    private Instant createdAt;

    public JobRunDocument() {}

    public String getJobRunId() { return jobRunId; }
    public void setJobRunId(String jobRunId) { this.jobRunId = jobRunId; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }
    public String getJobType() { return jobType; }
    public void setJobType(String jobType) { this.jobType = jobType; }
    public TriggerSource getTriggerSource() { return triggerSource; }
    public void setTriggerSource(TriggerSource triggerSource) { this.triggerSource = triggerSource; }
    public JobRunStatus getStatus() { return status; }
    public void setStatus(JobRunStatus status) { this.status = status; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Long getDurationMs() { return durationMs; }
    public void setDurationMs(Long durationMs) { this.durationMs = durationMs; }
    public Map<String, Long> getMetrics() { return metrics; }
    public void setMetrics(Map<String, Long> metrics) { this.metrics = metrics; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
