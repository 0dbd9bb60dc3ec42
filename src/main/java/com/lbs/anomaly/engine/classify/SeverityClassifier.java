package com.lbs.anomaly.engine.classify;

import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.Severity;
import com.lbs.anomaly.model.SeverityRule;
import com.lbs.anomaly.model.SeverityThresholds;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns severity and description to detector output.
 *
 * <p>Order of evaluation: the first matching custom rule; CRITICAL above {@code criticalPct};
 * HIGH above {@code highPct} or beyond {@code highZ}; LOW below {@code mediumPct} for kinds
 * with a low tier; MEDIUM otherwise. Comparisons are strict and use absolute deviation.
 */
public class SeverityClassifier {

    private final SeverityThresholds defaults;
    private final Map<DetectorKind, SeverityThresholds> overrides;
    private final List<SeverityRule> rules;
    private final AnomalyNarrator narrator;

    public SeverityClassifier(SeverityThresholds defaults, Map<DetectorKind, SeverityThresholds> overrides,
                              List<SeverityRule> rules, AnomalyNarrator narrator) {
        this.defaults = defaults;
        this.overrides = overrides.isEmpty() ? new EnumMap<>(DetectorKind.class) : new EnumMap<>(overrides);
        this.rules = List.copyOf(rules);
        this.narrator = narrator;
    }

    public Severity classify(AnomalyRecord record) {
        for (SeverityRule rule : rules) {
            if (rule.matches(record)) {
                return rule.getSeverity();
            }
        }

        SeverityThresholds t = thresholdsFor(record.getDetectorKind());
        Double deviation = record.getDeviationPct();
        double absDeviation = deviation == null ? 0.0 : Math.abs(deviation);

        if (deviation != null && absDeviation > t.getCriticalPct()) {
            return Severity.CRITICAL;
        }
        if ((deviation != null && absDeviation > t.getHighPct())
                || (record.getZscore() != null && Math.abs(record.getZscore()) > t.getHighZ())) {
            return Severity.HIGH;
        }
        if (t.isLowTierEnabled() && deviation != null && absDeviation < t.getMediumPct()) {
            return Severity.LOW;
        }
        return Severity.MEDIUM;
    }

    /** Returns a copy of the record carrying severity and description. */
    public AnomalyRecord enrich(AnomalyRecord record) {
        Severity severity = classify(record);
        return record.toBuilder()
                .severity(severity)
                .description(narrator.describe(record, severity))
                .build();
    }

    public List<AnomalyRecord> enrichAll(List<AnomalyRecord> records) {
        return records.stream().map(this::enrich).toList();
    }

    public SeverityThresholds thresholdsFor(DetectorKind kind) {
        return kind == null ? defaults : overrides.getOrDefault(kind, defaults);
    }
}
