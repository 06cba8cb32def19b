package io.github.drompincen.vigil.protocol.api;

public enum TriggerSource {
    SCHEDULED,
    MANUAL
}
