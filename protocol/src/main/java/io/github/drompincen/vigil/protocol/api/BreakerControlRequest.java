package io.github.drompincen.vigil.protocol.api;

public record BreakerControlRequest(
        BreakerAction action,
        String reason,
        String actor
) {}
