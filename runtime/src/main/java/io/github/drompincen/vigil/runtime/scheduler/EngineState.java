package io.github.drompincen.vigil.runtime.scheduler;

public enum EngineState {
    NOT_STARTED,
    RUNNING,
    SHUT_DOWN
}
