package com.lbs.anomaly.config;

import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.params.ComparativeParams;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a typed detector configuration. Used for configured detectors at startup and
 * for ad-hoc requests.
 */
public final class DetectionConfigValidator {

    private DetectionConfigValidator() {}

    public static List<String> problems(DetectionConfig config) {
        List<String> problems = new ArrayList<>();
        String name = config.getName();
        String where = "detector '" + name + "'";

        if (isBlank(name)) problems.add("detector name is required");
        if (config.getKind() == null) problems.add(where + ": kind is required");
        if (isBlank(config.getMetric())) problems.add(where + ": metric is required");
        if (config.getParams() == null) {
            problems.add(where + ": parameters are missing");
            return problems;
        }
        if (config.getParams().getLookbackDays() <= 0) problems.add(where + ": lookback_days must be positive");

        if (config.getKind() == DetectorKind.TIME_SERIES) {
            TimeSeriesParams p = config.timeSeriesParams();
            if (!p.isForecast()) {
                if (p.getWindowSize() < 2) problems.add(where + ": window_size must be at least 2");
                if (p.getWindowSize() > p.getLookbackDays()) {
                    problems.add(where + ": window_size " + p.getWindowSize()
                            + " is larger than lookback_days " + p.getLookbackDays());
                }
                if (p.getThresholdStd() <= 0) problems.add(where + ": threshold_std must be positive");
            } else {
                if (p.getIntervalWidth() <= 0 || p.getIntervalWidth() >= 1) {
                    problems.add(where + ": interval_width must be between 0 and 1");
                }
                if (p.getForecastDays() < 0) problems.add(where + ": forecast_days must not be negative");
            }
        } else if (config.getKind() == DetectorKind.STATISTICAL) {
            StatisticalParams p = config.statisticalParams();
            if (isBlank(config.getDimension())) problems.add(where + ": dimension is required");
            if (p.getThreshold() <= 0) problems.add(where + ": threshold must be positive");
            if (p.getIqrMultiplier() <= 0) problems.add(where + ": iqr_multiplier must be positive");
            if (p.getMinTransactions() < 0) problems.add(where + ": min_transactions must not be negative");
            if (p.getMinSampleSize() < 1) problems.add(where + ": min_sample_size must be positive");
            if (p.getContamination() <= 0 || p.getContamination() > 0.5) {
                problems.add(where + ": contamination must be in (0, 0.5]");
            }
            if (p.getNumTrees() < 1) problems.add(where + ": num_trees must be positive");
            if (p.getSampleSize() < 2) problems.add(where + ": sample_size must be at least 2");
            if (p.getMinGroups() < 2) problems.add(where + ": min_groups must be at least 2");
        } else if (config.getKind() == DetectorKind.COMPARATIVE) {
            ComparativeParams p = config.comparativeParams();
            if (p.getThresholdPct() < 0) problems.add(where + ": threshold_pct must not be negative");
        } else if (config.getKind() == DetectorKind.DAY_ON_DAY) {
            DayOnDayParams p = config.dayOnDayParams();
            if (isBlank(config.getDimension())) problems.add(where + ": dimension is required");
            if (p.getThresholdPct() < 0) problems.add(where + ": threshold_pct must not be negative");
            if (p.getTopN() < 1) problems.add(where + ": top_n must be positive");
            if (p.getZeroBaselineCapPct() <= 0) problems.add(where + ": zero_baseline_cap_pct must be positive");
        }
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
