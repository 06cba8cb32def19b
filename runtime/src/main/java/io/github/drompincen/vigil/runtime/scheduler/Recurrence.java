package io.github.drompincen.vigil.runtime.scheduler;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.protocol.api.ScheduleType;

/**
 * Declarative recurrence of a schedule. Optional fields are interpreted per {@link ScheduleType};
 * {@code dayOfWeek} counts from 0 = Monday to 6 = Sunday.
 */
public record Recurrence(
        ScheduleType scheduleType,
        Integer hourOfDay,
        Integer minuteOfHour,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String cronExpression
) {

    public static Recurrence of(AutomationScheduleDocument schedule) {
        return new Recurrence(
                schedule.getScheduleType(),
                schedule.getHourOfDay(),
                schedule.getMinuteOfHour(),
                schedule.getDayOfWeek(),
                schedule.getDayOfMonth(),
                schedule.getCronExpression());
    }

    public static Recurrence manual() {
        return new Recurrence(ScheduleType.MANUAL, null, null, null, null, null);
    }

    public static Recurrence hourly(int minute) {
        return new Recurrence(ScheduleType.HOURLY, null, minute, null, null, null);
    }

    public static Recurrence daily(int hour, int minute) {
        return new Recurrence(ScheduleType.DAILY, hour, minute, null, null, null);
    }

    public static Recurrence weekly(int dayOfWeek, int hour, int minute) {
        return new Recurrence(ScheduleType.WEEKLY, hour, minute, dayOfWeek, null, null);
    }

    public static Recurrence monthly(int dayOfMonth, int hour, int minute) {
        return new Recurrence(ScheduleType.MONTHLY, hour, minute, null, dayOfMonth, null);
    }

    public static Recurrence cron(String expression) {
        return new Recurrence(ScheduleType.CUSTOM, null, null, null, null, expression);
    }
}
