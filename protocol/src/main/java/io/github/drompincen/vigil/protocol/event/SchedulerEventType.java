package io.github.drompincen.vigil.protocol.event;

public enum SchedulerEventType {
    BREAKER_OPENED,
    BREAKER_CLOSED,
    SCHEDULE_AUTO_DISABLED,
    MANUAL_TRIGGER_COMPLETED,
    CRON_EXPRESSION_INVALID
}
