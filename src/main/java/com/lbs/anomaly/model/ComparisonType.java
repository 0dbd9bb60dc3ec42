package com.lbs.anomaly.model;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Calendar period comparison. Each type knows how to bucket a date into its period
 * and which period it is compared against.
 */
public enum ComparisonType {
    YOY,
    MOM,
    QOQ;

    /** First day of the period that contains {@code date}. */
    public LocalDate periodStart(LocalDate date) {
        if (this == QOQ) {
            int firstMonthOfQuarter = ((date.getMonthValue() - 1) / 3) * 3 + 1;
            return LocalDate.of(date.getYear(), firstMonthOfQuarter, 1);
        }
        return YearMonth.from(date).atDay(1);
    }

    /** Last day of the latest period that has fully elapsed by {@code asOf}; {@code asOf} itself on a period's last day. */
    public LocalDate lastCompleteDay(LocalDate asOf) {
        return periodStart(asOf.plusDays(1)).minusDays(1);
    }

    /** Start of the period the given period is compared with. */
    public LocalDate predecessor(LocalDate periodStart) {
        return switch (this) {
            case YOY -> periodStart.minusYears(1);
            case QOQ -> periodStart.minusMonths(3);
            case MOM -> periodStart.minusMonths(1);
        };
    }

    public String label(LocalDate periodStart) {
        if (this == QOQ) {
            return periodStart.getYear() + "-Q" + ((periodStart.getMonthValue() - 1) / 3 + 1);
        }
        return YearMonth.from(periodStart).toString();
    }
}
