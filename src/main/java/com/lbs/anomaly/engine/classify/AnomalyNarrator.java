package com.lbs.anomaly.engine.classify;

import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders the one-paragraph description of an anomaly. Output depends only on the record
 * fields and the severity, formatted with {@link Locale#US}.
 */
@Component
public class AnomalyNarrator {

    private static final String CATEGORY_COLUMN = "category";

    public String describe(AnomalyRecord record, Severity severity) {
        StringBuilder text = new StringBuilder()
                .append(severity.name())
                .append(" severity ")
                .append(record.getKind().name().toLowerCase(Locale.ROOT))
                .append(" detected for ")
                .append(subject(record));
        if (record.getTimePeriod() != null) {
            text.append(" on ").append(record.getTimePeriod());
        }
        text.append(". ").append(body(record));

        if (record.getTrend() != null) {
            text.append(" Current trend: ").append(amount(record.getTrend())).append('.');
        }
        if (record.getAdditionalColumns() != null && record.getAdditionalColumns().get(CATEGORY_COLUMN) != null) {
            text.append(" Category: ").append(record.getAdditionalColumns().get(CATEGORY_COLUMN)).append('.');
        }
        return text.toString();
    }

    private String body(AnomalyRecord record) {
        String metric = record.getMetricName();
        return switch (record.getDetectorKind()) {
            case TIME_SERIES -> {
                String range = record.getBounds() == null ? ""
                        : " (range " + amount(record.getBounds().lower()) + " to " + amount(record.getBounds().upper()) + ")";
                yield "The " + metric + " was " + amount(record.getMetricValue())
                        + " against an expected " + amount(record.getExpectedValue()) + range + deviation(record) + ".";
            }
            case STATISTICAL -> {
                StringBuilder s = new StringBuilder("The ").append(metric).append(" total of ")
                        .append(amount(record.getMetricValue()))
                        .append(" compares with an expected ").append(amount(record.getExpectedValue()))
                        .append(deviation(record));
                if (record.getZscore() != null) {
                    s.append(String.format(Locale.US, " (z-score %.2f)", record.getZscore()));
                }
                if (record.getAnomalyScore() != null) {
                    s.append(String.format(Locale.US, " (isolation score %.3f)", record.getAnomalyScore()));
                }
                yield s.append('.').toString();
            }
            case COMPARATIVE -> "The " + metric + " " + direction(record) + " by "
                    + percent(record.absoluteDeviationPct()) + " from " + amount(record.getPreviousValue())
                    + " in " + record.getPreviousPeriod() + " to " + amount(record.getMetricValue())
                    + " in " + record.getTimePeriod() + ".";
            case DAY_ON_DAY -> record.isZeroBaseline()
                    ? "The " + metric + " moved from 0 on " + record.getPreviousPeriod() + " to "
                        + amount(record.getMetricValue()) + "; the change is reported as the capped value "
                        + String.format(Locale.US, "%+.1f%%", record.getDeviationPct()) + "."
                    : "The " + metric + " " + direction(record) + " by " + percent(record.absoluteDeviationPct())
                        + " from " + amount(record.getPreviousValue()) + " on " + record.getPreviousPeriod()
                        + " to " + amount(record.getMetricValue()) + ".";
        };
    }

    private static String subject(AnomalyRecord record) {
        if ("all".equals(record.getDimensionValue())) {
            return "total " + record.getMetricName();
        }
        String shown = record.getDimensionLabel() != null ? record.getDimensionLabel() : record.getDimensionValue();
        return record.getDimensionName() + " '" + shown + "'";
    }

    private static String deviation(AnomalyRecord record) {
        if (record.getDeviationPct() == null) return "";
        return String.format(Locale.US, ", a deviation of %+.1f%%", record.getDeviationPct());
    }

    private static String direction(AnomalyRecord record) {
        return record.getKind().isUpward() ? "increased" : "decreased";
    }

    private static String amount(Double value) {
        return value == null ? "n/a" : String.format(Locale.US, "%,.2f", value);
    }

    private static String percent(double value) {
        return String.format(Locale.US, "%.1f%%", value);
    }
}
