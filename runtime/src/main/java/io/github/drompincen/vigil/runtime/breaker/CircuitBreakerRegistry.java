package io.github.drompincen.vigil.runtime.breaker;

import io.github.drompincen.vigil.persistence.document.CircuitBreakerDocument;
import io.github.drompincen.vigil.persistence.repository.CircuitBreakerRepository;
import io.github.drompincen.vigil.protocol.api.CircuitBreakerStatus;
import io.github.drompincen.vigil.protocol.api.CircuitState;
import io.github.drompincen.vigil.protocol.event.SchedulerEventType;
import io.github.drompincen.vigil.runtime.event.SchedulerEventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One circuit breaker per (tenant, external resource).
 * <p>
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN moves to HALF_OPEN
 * lazily, on the first request evaluated after {@code timeoutSeconds}. HALF_OPEN closes after
 * {@code successThreshold} consecutive successes and re-opens on any failure. A manual disable
 * blocks every request regardless of state.
 * <p>
 * Updates to one breaker are serialized in-process; the registry never throws from its
 * bookkeeping, and a storage failure while deciding lets the request through.
 */
@Service
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    private static final int MAX_REASON_LENGTH = 500;

    private final CircuitBreakerRepository breakerRepository;
    private final SchedulerEventService eventService;
    private final Clock clock;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerRepository breakerRepository,
                                  SchedulerEventService eventService,
                                  Clock clock) {
        this.breakerRepository = breakerRepository;
        this.eventService = eventService;
        this.clock = clock;
    }

    public CircuitBreakerDocument getOrCreate(ResourceRef ref) {
        synchronized (lockFor(ref)) {
            return loadOrCreate(ref);
        }
    }

    public BreakerDecision shouldAllowRequest(ResourceRef ref) {
        try {
            return mutate(ref, breaker -> {
                if (breaker.isManuallyDisabled()) {
                    return BreakerDecision.block("API manually disabled: " + breaker.getDisabledReason());
                }
                if (breaker.getState() == CircuitState.OPEN && timeoutElapsed(breaker, clock.instant())) {
                    transitionToHalfOpen(breaker);
                    log.info("Circuit breaker {} ({}) transitioned to HALF_OPEN",
                            breaker.getBreakerId(), breaker.getProvider());
                }
                return evaluate(breaker, clock.instant());
            });
        } catch (Exception e) {
            log.error("Circuit breaker check failed for {}, allowing request", ref.breakerId(), e);
            return BreakerDecision.allow();
        }
    }

    public void recordSuccess(ResourceRef ref) {
        try {
            mutate(ref, breaker -> {
                Instant now = clock.instant();
                breaker.setSuccessCount(breaker.getSuccessCount() + 1);
                breaker.setConsecutiveSuccesses(breaker.getConsecutiveSuccesses() + 1);
                breaker.setConsecutiveFailures(0);
                breaker.setLastSuccessAt(now);

                if (breaker.getState() == CircuitState.HALF_OPEN
                        && breaker.getConsecutiveSuccesses() >= breaker.getSuccessThreshold()) {
                    transitionToClosed(breaker);
                    log.info("Circuit breaker {} ({}) recovered and closed",
                            breaker.getBreakerId(), breaker.getProvider());
                    eventService.publish(breaker.getTenantId(), SchedulerEventType.BREAKER_CLOSED,
                            breaker.getBreakerId(), Map.of("provider", String.valueOf(breaker.getProvider())));
                }
                return null;
            });
        } catch (Exception e) {
            log.error("Failed to record success for {}", ref.breakerId(), e);
        }
    }

    public void recordFailure(ResourceRef ref, String errorMessage, String errorType) {
        try {
            mutate(ref, breaker -> {
                Instant now = clock.instant();
                breaker.setFailureCount(breaker.getFailureCount() + 1);
                breaker.setConsecutiveFailures(breaker.getConsecutiveFailures() + 1);
                breaker.setConsecutiveSuccesses(0);
                breaker.setLastFailureAt(now);
                breaker.setLastFailureReason(truncate(errorMessage));
                breaker.setLastFailureType(errorType);

                boolean trip = switch (breaker.getState()) {
                    case CLOSED -> breaker.getConsecutiveFailures() >= breaker.getFailureThreshold();
                    case HALF_OPEN -> true;
                    case OPEN -> false;
                };
                if (trip) {
                    transitionToOpen(breaker);
                    log.error("Circuit breaker {} ({}) opened after {} consecutive failures. Last error: {}",
                            breaker.getBreakerId(), breaker.getProvider(),
                            breaker.getConsecutiveFailures(), errorMessage);
                    Map<String, Object> payload = new HashMap<>();
                    payload.put("provider", breaker.getProvider());
                    payload.put("consecutiveFailures", breaker.getConsecutiveFailures());
                    payload.put("lastError", breaker.getLastFailureReason());
                    eventService.publish(breaker.getTenantId(), SchedulerEventType.BREAKER_OPENED,
                            breaker.getBreakerId(), payload);
                }
                return null;
            });
        } catch (Exception e) {
            log.error("Failed to record failure for {}", ref.breakerId(), e);
        }
    }

    public CircuitBreakerDocument manuallyDisable(ResourceRef ref, String reason, String actor) {
        return mutate(ref, breaker -> {
            breaker.setManuallyDisabled(true);
            breaker.setDisabledReason(reason);
            breaker.setDisabledBy(actor);
            breaker.setDisabledAt(clock.instant());
            log.info("Circuit breaker {} manually disabled by {}: {}", breaker.getBreakerId(), actor, reason);
            return breaker;
        });
    }

    public CircuitBreakerDocument manuallyEnable(ResourceRef ref, String actor) {
        return mutate(ref, breaker -> {
            clearOverride(breaker);
            transitionToClosed(breaker);
            log.info("Circuit breaker {} manually enabled by {}", breaker.getBreakerId(), actor);
            return breaker;
        });
    }

    public CircuitBreakerDocument reset(ResourceRef ref, String actor) {
        return mutate(ref, breaker -> {
            clearOverride(breaker);
            breaker.setFailureCount(0);
            breaker.setSuccessCount(0);
            breaker.setConsecutiveSuccesses(0);
            transitionToClosed(breaker);
            log.info("Circuit breaker {} reset by {}", breaker.getBreakerId(), actor);
            return breaker;
        });
    }

    /**
     * Runs {@code call} behind the breaker for {@code ref}, recording its outcome.
     *
     * @throws CircuitOpenException when the breaker refuses the request
     */
    public <T> T call(ResourceRef ref, Callable<T> call) throws Exception {
        BreakerDecision decision = shouldAllowRequest(ref);
        if (!decision.allowed()) {
            throw new CircuitOpenException(ref, decision.reason());
        }
        try {
            T result = call.call();
            recordSuccess(ref);
            return result;
        } catch (Exception e) {
            recordFailure(ref, e.getMessage() != null ? e.getMessage() : e.toString(),
                    e.getClass().getSimpleName());
            throw e;
        }
    }

    public Optional<CircuitBreakerStatus> status(String tenantId, String resourceId) {
        return breakerRepository.findById(CircuitBreakerDocument.idFor(tenantId, resourceId))
                .map(this::toStatus);
    }

    public List<CircuitBreakerStatus> statuses(String tenantId) {
        return breakerRepository.findByTenantId(tenantId).stream()
                .map(this::toStatus)
                .toList();
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private BreakerDecision evaluate(CircuitBreakerDocument breaker, Instant now) {
        if (breaker.isManuallyDisabled()) {
            return BreakerDecision.block("API manually disabled: " + breaker.getDisabledReason());
        }
        return switch (breaker.getState()) {
            case CLOSED, HALF_OPEN -> BreakerDecision.allow();
            case OPEN -> {
                if (timeoutElapsed(breaker, now)) {
                    yield BreakerDecision.allow();
                }
                long remaining = breaker.getTimeoutSeconds()
                        - Duration.between(breaker.getOpenedAt(), now).getSeconds();
                yield BreakerDecision.block("Circuit open due to failures. Retry in " + remaining
                        + "s. Last error: " + breaker.getLastFailureReason());
            }
        };
    }

    private static boolean timeoutElapsed(CircuitBreakerDocument breaker, Instant now) {
        if (breaker.getOpenedAt() == null) return true;
        return !now.isBefore(breaker.getOpenedAt().plusSeconds(breaker.getTimeoutSeconds()));
    }

    private void transitionToOpen(CircuitBreakerDocument breaker) {
        breaker.setState(CircuitState.OPEN);
        breaker.setOpenedAt(clock.instant());
        breaker.setHalfOpenedAt(null);
        breaker.setClosedAt(null);
        breaker.setConsecutiveSuccesses(0);
    }

    private void transitionToHalfOpen(CircuitBreakerDocument breaker) {
        breaker.setState(CircuitState.HALF_OPEN);
        breaker.setHalfOpenedAt(clock.instant());
        breaker.setOpenedAt(null);
        breaker.setClosedAt(null);
        breaker.setConsecutiveSuccesses(0);
        breaker.setConsecutiveFailures(0);
    }

    private void transitionToClosed(CircuitBreakerDocument breaker) {
        breaker.setState(CircuitState.CLOSED);
        breaker.setClosedAt(clock.instant());
        breaker.setOpenedAt(null);
        breaker.setHalfOpenedAt(null);
        breaker.setConsecutiveFailures(0);
    }

    private static void clearOverride(CircuitBreakerDocument breaker) {
        breaker.setManuallyDisabled(false);
        breaker.setDisabledReason(null);
        breaker.setDisabledBy(null);
        breaker.setDisabledAt(null);
    }

    // ------------------------------------------------------------------
    // Storage
    // ------------------------------------------------------------------

    private <T> T mutate(ResourceRef ref, Function<CircuitBreakerDocument, T> change) {
        synchronized (lockFor(ref)) {
            CircuitBreakerDocument breaker = loadOrCreate(ref);
            T result = change.apply(breaker);
            breaker.setUpdatedAt(clock.instant());
            breakerRepository.save(breaker);
            return result;
        }
    }

    private CircuitBreakerDocument loadOrCreate(ResourceRef ref) {
        return breakerRepository.findById(ref.breakerId()).orElseGet(() -> {
            Instant now = clock.instant();
            CircuitBreakerDocument breaker = new CircuitBreakerDocument();
            breaker.setBreakerId(ref.breakerId());
            breaker.setTenantId(ref.tenantId());
            breaker.setResourceId(ref.resourceId());
            breaker.setProvider(ref.provider());
            breaker.setState(CircuitState.CLOSED);
            breaker.setCreatedAt(now);
            breaker.setUpdatedAt(now);
            log.info("Created circuit breaker {} for provider {}", ref.breakerId(), ref.provider());
            breakerRepository.save(breaker);
            return breaker;
        });
    }

    private Object lockFor(ResourceRef ref) {
        return locks.computeIfAbsent(ref.breakerId(), k -> new Object());
    }

    private CircuitBreakerStatus toStatus(CircuitBreakerDocument b) {
        BreakerDecision decision = evaluate(b, clock.instant());
        return new CircuitBreakerStatus(
                b.getTenantId(),
                b.getResourceId(),
                b.getProvider(),
                b.getState(),
                b.isManuallyDisabled(),
                b.getDisabledReason(),
                b.getDisabledBy(),
                decision.allowed(),
                decision.reason(),
                b.getFailureCount(),
                b.getConsecutiveFailures(),
                b.getSuccessCount(),
                b.getConsecutiveSuccesses(),
                b.getFailureThreshold(),
                b.getSuccessThreshold(),
                b.getTimeoutSeconds(),
                b.getLastFailureAt(),
                b.getLastFailureReason(),
                b.getLastFailureType(),
                b.getLastSuccessAt(),
                b.getOpenedAt(),
                b.getHalfOpenedAt(),
                b.getClosedAt()
        );
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() > MAX_REASON_LENGTH ? message.substring(0, MAX_REASON_LENGTH) : message;
    }
}
