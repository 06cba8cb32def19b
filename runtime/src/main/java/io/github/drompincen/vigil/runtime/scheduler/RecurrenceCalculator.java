package io.github.drompincen.vigil.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Turns a {@link Recurrence} into the next fire instant strictly after a reference time.
 * Pure and deterministic; every computation happens in UTC.
 */
@Component
public class RecurrenceCalculator {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

    /** Returned for MANUAL schedules, which never fire on their own. */
    public static final Instant MANUAL_SENTINEL = Instant.parse("9999-12-31T23:59:59Z");

    static final int DEFAULT_HOUR = 9;
    static final int DEFAULT_MINUTE = 0;
    static final int DEFAULT_DAY_OF_WEEK = 0;
    static final int DEFAULT_DAY_OF_MONTH = 1;

    public Instant nextRun(Recurrence recurrence, Instant reference) {
        ZonedDateTime from = reference.atZone(ZoneOffset.UTC);
        int minute = clamp(recurrence.minuteOfHour(), DEFAULT_MINUTE, 0, 59);
        int hour = clamp(recurrence.hourOfDay(), DEFAULT_HOUR, 0, 23);

        ZonedDateTime next = switch (recurrence.scheduleType()) {
            case MANUAL -> null;
            case HOURLY -> nextHourly(from, minute);
            case DAILY -> nextDaily(from, hour, minute);
            case WEEKLY -> nextWeekly(from, clamp(recurrence.dayOfWeek(), DEFAULT_DAY_OF_WEEK, 0, 6), hour, minute);
            case MONTHLY -> nextMonthly(from, clamp(recurrence.dayOfMonth(), DEFAULT_DAY_OF_MONTH, 1, 31), hour, minute);
            case CUSTOM -> nextCron(from, recurrence.cronExpression());
        };
        return next == null ? MANUAL_SENTINEL : next.toInstant();
    }

    /**
     * @return the parse error for an invalid expression, empty when it is usable
     */
    public Optional<String> validateCron(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of("Cron expression is required for custom schedules");
        }
        try {
            CronExpression.parse(toSpringCron(expression));
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
    }

    private ZonedDateTime nextHourly(ZonedDateTime from, int minute) {
        ZonedDateTime candidate = from.truncatedTo(ChronoUnit.HOURS).withMinute(minute);
        return candidate.isAfter(from) ? candidate : candidate.plusHours(1);
    }

    private ZonedDateTime nextDaily(ZonedDateTime from, int hour, int minute) {
        ZonedDateTime candidate = atTime(from, hour, minute);
        return candidate.isAfter(from) ? candidate : candidate.plusDays(1);
    }

    private ZonedDateTime nextWeekly(ZonedDateTime from, int dayOfWeek, int hour, int minute) {
        DayOfWeek target = DayOfWeek.of(dayOfWeek + 1);
        ZonedDateTime candidate = atTime(from, hour, minute).with(TemporalAdjusters.nextOrSame(target));
        return candidate.isAfter(from) ? candidate : candidate.plusWeeks(1);
    }

    // Days past the end of a month land on its last day (31 -> Feb 29 in a leap year).
    private ZonedDateTime nextMonthly(ZonedDateTime from, int dayOfMonth, int hour, int minute) {
        ZonedDateTime candidate = inMonth(YearMonth.from(from), dayOfMonth, hour, minute);
        if (candidate.isAfter(from)) {
            return candidate;
        }
        return inMonth(YearMonth.from(from).plusMonths(1), dayOfMonth, hour, minute);
    }

    private ZonedDateTime nextCron(ZonedDateTime from, String expression) {
        try {
            if (expression == null || expression.isBlank()) {
                throw new IllegalArgumentException("missing cron expression");
            }
            ZonedDateTime next = CronExpression.parse(toSpringCron(expression)).next(from);
            if (next == null) {
                throw new IllegalArgumentException("expression '" + expression + "' never fires");
            }
            return next;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid cron expression '{}', falling back to one day: {}", expression, e.getMessage());
            return from.plusDays(1);
        }
    }

    /** Crontab has five fields; Spring expects a leading seconds field. */
    static String toSpringCron(String expression) {
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private static ZonedDateTime inMonth(YearMonth month, int dayOfMonth, int hour, int minute) {
        int day = Math.min(dayOfMonth, month.lengthOfMonth());
        return month.atDay(day).atTime(hour, minute).atZone(ZoneOffset.UTC);
    }

    private static ZonedDateTime atTime(ZonedDateTime from, int hour, int minute) {
        return from.truncatedTo(ChronoUnit.DAYS).withHour(hour).withMinute(minute);
    }

    private static int clamp(Integer value, int fallback, int min, int max) {
        if (value == null) return fallback;
        return Math.max(min, Math.min(max, value));
    }
}
