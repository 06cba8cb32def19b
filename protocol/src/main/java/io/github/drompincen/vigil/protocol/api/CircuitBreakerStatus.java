package io.github.drompincen.vigil.protocol.api;

import java.time.Instant;

public record CircuitBreakerStatus(
        String tenantId,
        String resourceId,
        String provider,
        CircuitState state,
        boolean manuallyDisabled,
        String disabledReason,
        String disabledBy,
        boolean canMakeRequests,
        String blockReason,
        long failureCount,
        int consecutiveFailures,
        long successCount,
        int consecutiveSuccesses,
        int failureThreshold,
        int successThreshold,
        int timeoutSeconds,
        Instant lastFailureAt,
        String lastFailureReason,
        String lastFailureType,
        Instant lastSuccessAt,
        Instant openedAt,
        Instant halfOpenedAt,
        Instant closedAt
) {}
