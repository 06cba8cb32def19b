package io.github.drompincen.vigil.protocol.api;

public enum BreakerAction {
    DISABLE,
    ENABLE,
    RESET
}
