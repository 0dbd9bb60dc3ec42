package com.lbs.anomaly.engine.stats;

import com.lbs.anomaly.model.BaselineStats;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Baseline statistics shared by every detector: count, mean, sample standard deviation,
 * extremes and linearly interpolated percentiles (the R-7 estimator, same as numpy/pandas).
 */
public final class BaselineCalculator {

    public static final double[] PERCENTILE_LEVELS = {25, 50, 75, 95, 99};

    // Relative variance below this is rounding noise on a constant group.
    private static final double VARIANCE_TOLERANCE = 1e-12;

    private BaselineCalculator() {}

    public static BaselineStats compute(double[] values, int minSampleSize) {
        return compute(null, null, null, values, minSampleSize);
    }

    public static BaselineStats compute(String dimensionValue, String metricName, String timeWindow,
                                        double[] values, int minSampleSize) {
        double[] clean = finite(values);
        int n = clean.length;

        BaselineStats.BaselineStatsBuilder builder = BaselineStats.builder()
                .dimensionValue(dimensionValue)
                .metricName(metricName)
                .timeWindow(timeWindow)
                .count(n);

        if (n == 0) {
            return builder.percentiles(Map.of()).insufficient(true).build();
        }

        double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : clean) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        return builder
                .sum(sum)
                .mean(mean)
                .stddev(sampleStdDev(clean, mean, min, max))
                .min(min)
                .max(max)
                .percentiles(percentiles(clean))
                .insufficient(n < Math.max(1, minSampleSize))
                .build();
    }

    /** Linearly interpolated percentile, {@code p} in (0, 100]. NaN for an empty input. */
    public static double percentile(double[] values, double p) {
        double[] clean = finite(values);
        if (clean.length == 0) return Double.NaN;
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(clean, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Mean and sample standard deviation of every element computed from all the other
     * elements. Runs in linear time on values shifted by the overall mean.
     */
    public static LeaveOneOut leaveOneOut(double[] values) {
        int n = values.length;
        double[] means = new double[n];
        double[] stddevs = new double[n];
        if (n < 3) {
            Arrays.fill(means, Double.NaN);
            Arrays.fill(stddevs, 0.0);
            return new LeaveOneOut(means, stddevs);
        }

        double center = Arrays.stream(values).average().orElse(0.0);
        double s = 0, q = 0;
        for (double v : values) {
            double d = v - center;
            s += d;
            q += d * d;
        }
        for (int i = 0; i < n; i++) {
            double d = values[i] - center;
            double restSum = s - d;
            double restSq = q - d * d;
            double restMean = restSum / (n - 1);
            double variance = (restSq - restSum * restMean) / (n - 2);
            means[i] = center + restMean;
            double scale = means[i] * means[i] + 1.0;
            stddevs[i] = variance <= VARIANCE_TOLERANCE * scale ? 0.0 : Math.sqrt(variance);
        }
        return new LeaveOneOut(means, stddevs);
    }

    private static double sampleStdDev(double[] values, double mean, double min, double max) {
        if (values.length < 2 || min == max) return 0.0;
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        double variance = sq / (values.length - 1);
        return variance <= VARIANCE_TOLERANCE * (mean * mean + 1.0) ? 0.0 : Math.sqrt(variance);
    }

    private static Map<String, Double> percentiles(double[] values) {
        Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        estimator.setData(values);
        Map<String, Double> result = new LinkedHashMap<>();
        for (double level : PERCENTILE_LEVELS) {
            result.put("p" + (int) level, estimator.evaluate(level));
        }
        return result;
    }

    private static double[] finite(double[] values) {
        if (values == null) return new double[0];
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public record LeaveOneOut(double[] means, double[] stddevs) {}
}
