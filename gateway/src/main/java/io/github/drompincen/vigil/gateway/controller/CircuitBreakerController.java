package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.BreakerControlRequest;
import io.github.drompincen.vigil.protocol.api.CircuitBreakerStatus;
import io.github.drompincen.vigil.runtime.breaker.CircuitBreakerRegistry;
import io.github.drompincen.vigil.runtime.breaker.ResourceRef;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/circuit-breakers")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry breakerRegistry;

    public CircuitBreakerController(CircuitBreakerRegistry breakerRegistry) {
        this.breakerRegistry = breakerRegistry;
    }

    @GetMapping
    public List<CircuitBreakerStatus> list(@RequestParam String tenantId) {
        return breakerRegistry.statuses(tenantId);
    }

    @GetMapping("/{tenantId}/{resourceId}")
    public ResponseEntity<CircuitBreakerStatus> get(@PathVariable String tenantId,
                                                    @PathVariable String resourceId) {
        return breakerRegistry.status(tenantId, resourceId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{tenantId}/{resourceId}/control")
    public ResponseEntity<CircuitBreakerStatus> control(@PathVariable String tenantId,
                                                        @PathVariable String resourceId,
                                                        @RequestBody BreakerControlRequest req) {
        if (req.action() == null) {
            throw new IllegalArgumentException("action is required");
        }
        ResourceRef ref = new ResourceRef(tenantId, resourceId, resourceId);
        String actor = req.actor() != null ? req.actor() : "api";
        switch (req.action()) {
            case DISABLE -> {
                if (req.reason() == null || req.reason().isBlank()) {
                    throw new IllegalArgumentException("reason is required to disable a breaker");
                }
                breakerRegistry.manuallyDisable(ref, req.reason(), actor);
            }
            case ENABLE -> breakerRegistry.manuallyEnable(ref, actor);
            case RESET -> breakerRegistry.reset(ref, actor);
        }
        return breakerRegistry.status(tenantId, resourceId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
