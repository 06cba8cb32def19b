package io.github.drompincen.vigil.protocol.api;

public enum ScheduleType {
    MANUAL,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM
}
