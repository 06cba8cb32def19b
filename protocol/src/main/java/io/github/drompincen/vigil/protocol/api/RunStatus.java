package io.github.drompincen.vigil.protocol.api;

public enum RunStatus {
    SUCCESS,
    FAILED,
    UNKNOWN
}
