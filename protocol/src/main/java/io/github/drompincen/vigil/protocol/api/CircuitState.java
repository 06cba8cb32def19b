package io.github.drompincen.vigil.protocol.api;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
