package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.BreakerAction;
import io.github.drompincen.vigil.protocol.api.BreakerControlRequest;
import io.github.drompincen.vigil.protocol.api.CircuitBreakerStatus;
import io.github.drompincen.vigil.protocol.api.CircuitState;
import io.github.drompincen.vigil.runtime.breaker.CircuitBreakerRegistry;
import io.github.drompincen.vigil.runtime.breaker.ResourceRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CircuitBreakerControllerTest {

    @Mock private CircuitBreakerRegistry breakerRegistry;
    @Captor private ArgumentCaptor<ResourceRef> refCaptor;

    private CircuitBreakerController controller;

    @BeforeEach
    void setUp() {
        controller = new CircuitBreakerController(breakerRegistry);
        when(breakerRegistry.status("tenant-1", "crm")).thenReturn(Optional.of(status(true)));
    }

    @Test
    void disableRequiresReason() {
        BreakerControlRequest req = new BreakerControlRequest(BreakerAction.DISABLE, " ", "ops");

        assertThatThrownBy(() -> controller.control("tenant-1", "crm", req))
                .isInstanceOf(IllegalArgumentException.class);
        verify(breakerRegistry, never()).manuallyDisable(any(), any(), any());
    }

    @Test
    void disableDelegatesWithActor() {
        ResponseEntity<CircuitBreakerStatus> response = controller.control("tenant-1", "crm",
                new BreakerControlRequest(BreakerAction.DISABLE, "quota exceeded", "ops"));

        verify(breakerRegistry).manuallyDisable(refCaptor.capture(), eq("quota exceeded"), eq("ops"));
        assertThat(refCaptor.getValue().tenantId()).isEqualTo("tenant-1");
        assertThat(refCaptor.getValue().resourceId()).isEqualTo("crm");
        assertThat(response.getBody().manuallyDisabled()).isTrue();
    }

    @Test
    void enableDefaultsActorToApi() {
        controller.control("tenant-1", "crm", new BreakerControlRequest(BreakerAction.ENABLE, null, null));

        verify(breakerRegistry).manuallyEnable(any(ResourceRef.class), eq("api"));
    }

    @Test
    void resetDelegates() {
        controller.control("tenant-1", "crm", new BreakerControlRequest(BreakerAction.RESET, null, "ops"));

        verify(breakerRegistry).reset(any(ResourceRef.class), eq("ops"));
    }

    @Test
    void missingActionIsRejected() {
        assertThatThrownBy(() -> controller.control("tenant-1", "crm", new BreakerControlRequest(null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("action");
    }

    @Test
    void getReturns404ForUnknownBreaker() {
        when(breakerRegistry.status("tenant-1", "none")).thenReturn(Optional.empty());

        assertThat(controller.get("tenant-1", "none").getStatusCode().value()).isEqualTo(404);
    }

    // ------------------------------------------------------------------

    private CircuitBreakerStatus status(boolean disabled) {
        return new CircuitBreakerStatus("tenant-1", "crm", "crm", CircuitState.CLOSED, disabled,
                disabled ? "quota exceeded" : null, disabled ? "ops" : null, !disabled,
                disabled ? "API manually disabled: quota exceeded" : null,
                0, 0, 0, 0, 5, 2, 300, null, null, null, null, null, null, null);
    }
}
