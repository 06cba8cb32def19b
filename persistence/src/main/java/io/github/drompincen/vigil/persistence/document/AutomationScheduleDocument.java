package io.github.drompincen.vigil.persistence.document;

import io.github.drompincen.vigil.protocol.api.RunStatus;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Document(collection = "automation_schedules")
@CompoundIndex(name = "tenant_active_idx", def = "{'tenantId': 1, 'active': 1}")
@CompoundIndex(name = "tenant_job_type_idx", def = "{'tenantId': 1, 'jobType': 1}")
@CompoundIndex(name = "active_next_run_idx", def = "{'active': 1, 'nextRunAt': 1}")
public class AutomationScheduleDocument {

    @Id
    private String scheduleId;
    private String tenantId;
    private String createdByUserId;
    private String name;
    private String description;

    // Target
    private String jobType;
    private List<String> targetIds;
    private Map<String, Object> config;

    // Recurrence
    private ScheduleType scheduleType;
    private String cronExpression;
    private Integer hourOfDay;
    private Integer minuteOfHour;
    private Integer dayOfWeek;
    private Integer dayOfMonth;

    // Lifecycle
    private boolean active = true;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private RunStatus lastRunStatus = RunStatus.UNKNOWN;
    private String lastRunJobId;
    private int consecutiveFailures;
    private String lastErrorMessage;
    private Instant lastErrorAt;

    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public AutomationScheduleDocument() {}

    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }
    public String getCreatedByUserId() { return createdByUserId; }
    public void setCreatedByUserId(String createdByUserId) { this.createdByUserId = createdByUserId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getJobType() { return jobType; }
    public void setJobType(String jobType) { this.jobType = jobType; }
    public List<String> getTargetIds() { return targetIds; }
    public void setTargetIds(List<String> targetIds) { this.targetIds = targetIds; }
    public Map<String, Object> getConfig() { return config; }
    public void setConfig(Map<String, Object> config) { this.config = config; }
    public ScheduleType getScheduleType() { return scheduleType; }
    public void setScheduleType(ScheduleType scheduleType) { this.scheduleType = scheduleType; }
    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public Integer getHourOfDay() { return hourOfDay; }
    public void setHourOfDay(Integer hourOfDay) { this.hourOfDay = hourOfDay; }
    public Integer getMinuteOfHour() { return minuteOfHour; }
    public void setMinuteOfHour(Integer minuteOfHour) { this.minuteOfHour = minuteOfHour; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public Integer getDayOfMonth() { return dayOfMonth; }
    public void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }
    public RunStatus getLastRunStatus() { return lastRunStatus; }
    public void setLastRunStatus(RunStatus lastRunStatus) { this.lastRunStatus = lastRunStatus; }
    public String getLastRunJobId() { return lastRunJobId; }
    public void setLastRunJobId(String lastRunJobId) { this.lastRunJobId = lastRunJobId; }
    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }
    public Instant getLastErrorAt() { return lastErrorAt; }
    public void setLastErrorAt(Instant lastErrorAt) { this.lastErrorAt = lastErrorAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
