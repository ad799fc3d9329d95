package com.churnguard.intervention.schedule;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/** Delay computation for once-a-day jobs. */
public final class DailySchedule {

    private DailySchedule() { /* utility class */ }

    /**
     * Time from {@code now} until the next occurrence of {@code at}, strictly in the
     * future: at exactly {@code at} the next run is a day later.
     */
    public static Duration untilNext(ZonedDateTime now, LocalTime at) {
        ZonedDateTime next = now.with(at);
        if (!next.isAfter(now)) {
            next = next.plusDays(1).with(at);
        }
        return Duration.between(now, next);
    }
}
