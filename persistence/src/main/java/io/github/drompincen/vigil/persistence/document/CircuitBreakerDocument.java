package io.github.drompincen.vigil.persistence.document;

import io.github.drompincen.vigil.protocol.api.CircuitState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "circuit_breakers")
@CompoundIndex(name = "tenant_resource_idx", def = "{'tenantId': 1, 'resourceId': 1}", unique = true)
public class CircuitBreakerDocument {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    /** {@code tenantId:resourceId} */
    @Id
    private String breakerId;
    private String tenantId;
    private String resourceId;
    private String provider;

    private CircuitState state = CircuitState.CLOSED;

    private long failureCount;
    private int consecutiveFailures;
    private long successCount;
    private int consecutiveSuccesses;

    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
    private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    private Instant lastFailureAt;
    private String lastFailureReason;
    private String lastFailureType;
    private Instant lastSuccessAt;

    private Instant openedAt;
    private Instant halfOpenedAt;
    private Instant closedAt;

    // Manual override, checked before the state machine
    private boolean manuallyDisabled;
    private String disabledReason;
    private String disabledBy;
    private Instant disabledAt;

    private Instant createdAt;
    private Instant updatedAt;

    public CircuitBreakerDocument() {}

    public static String idFor(String tenantId, String resourceId) {
        return tenantId + ":" + resourceId;
    }

    public String getBreakerId() { return breakerId; }
    public void setBreakerId(String breakerId) { this.breakerId = breakerId; }
    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }
    public String getResourceId() { return resourceId; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }
    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public CircuitState getState() { return state; }
    public void setState(CircuitState state) { this.state = state; }
    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }
    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
    public long getSuccessCount() { return successCount; }
    public void setSuccessCount(long successCount) { this.successCount = successCount; }
    public int getConsecutiveSuccesses() { return consecutiveSuccesses; }
    public void setConsecutiveSuccesses(int consecutiveSuccesses) { this.consecutiveSuccesses = consecutiveSuccesses; }
    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    public int getSuccessThreshold() { return successThreshold; }
    public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public Instant getLastFailureAt() { return lastFailureAt; }
    public void setLastFailureAt(Instant lastFailureAt) { this.lastFailureAt = lastFailureAt; }
    public String getLastFailureReason() { return lastFailureReason; }
    public void setLastFailureReason(String lastFailureReason) { this.lastFailureReason = lastFailureReason; }
    public String getLastFailureType() { return lastFailureType; }
    public void setLastFailureType(String lastFailureType) { this.lastFailureType = lastFailureType; }
    public Instant getLastSuccessAt() { return lastSuccessAt; }
    public void setLastSuccessAt(Instant lastSuccessAt) { this.lastSuccessAt = lastSuccessAt; }
    public Instant getOpenedAt() { return openedAt; }
    public void setOpenedAt(Instant openedAt) { this.openedAt = openedAt; }
    public Instant getHalfOpenedAt() { return halfOpenedAt; }
    public void setHalfOpenedAt(Instant halfOpenedAt) { this.halfOpenedAt = halfOpenedAt; }
    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
    public boolean isManuallyDisabled() { return manuallyDisabled; }
    public void setManuallyDisabled(boolean manuallyDisabled) { this.manuallyDisabled = manuallyDisabled; }
    public String getDisabledReason() { return disabledReason; }
    public void setDisabledReason(String disabledReason) { this.disabledReason = disabledReason; }
    public String getDisabledBy() { return disabledBy; }
    public void setDisabledBy(String disabledBy) { this.disabledBy = disabledBy; }
    public Instant getDisabledAt() { return disabledAt; }
    public void setDisabledAt(Instant disabledAt) { this.disabledAt = disabledAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
