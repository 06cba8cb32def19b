package io.github.drompincen.vigil.protocol.api;

/**
 * Lifecycle of a single job run. Transitions are monotonic:
 * PENDING -> RUNNING -> COMPLETED | FAILED. A PENDING run may also fail directly
 * when it never got to start.
 */
public enum JobRunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobRunStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
