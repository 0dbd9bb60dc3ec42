package com.lbs.anomaly.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    /** Maps a date onto the first day of its bucket (ISO week starts on Monday). */
    public LocalDate bucket(LocalDate date) {
        return switch (this) {
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
            case DAILY -> date;
        };
    }

    /** Last day of the latest bucket that is complete on {@code asOf}. */
    public LocalDate lastCompleteDay(LocalDate asOf) {
        return bucket(asOf.plusDays(1)).minusDays(1);
    }
}
