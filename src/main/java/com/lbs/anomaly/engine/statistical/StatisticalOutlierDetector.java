package com.lbs.anomaly.engine.statistical;

import com.lbs.anomaly.engine.AdditionalColumns;
import com.lbs.anomaly.engine.AnomalyDetector;
import com.lbs.anomaly.engine.isolationforest.IsolationForest;
import com.lbs.anomaly.engine.stats.BaselineCalculator;
import com.lbs.anomaly.model.AnomalyKind;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.BaselineStats;
import com.lbs.anomaly.model.Bounds;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.DimensionAggregate;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-sectional outliers: the metric is summed per dimension value over the lookback
 * window and each group is compared with the population of groups.
 *
 * <ul>
 *   <li>z-score: each group against the mean and standard deviation of the other groups</li>
 *   <li>IQR: Tukey fences around the quartiles</li>
 *   <li>isolation forest: seeded forest over (total, order count), top contamination share flagged</li>
 * </ul>
 * Groups with fewer than {@code minTransactions} source rows are removed before any method runs.
 */
@Component
public class StatisticalOutlierDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalOutlierDetector.class);

    @Override
    public DetectorKind getSupportedKind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf) {
        StatisticalParams params = config.statisticalParams();
        LocalDate start = asOf.minusDays(params.getLookbackDays());
        Map<String, DimensionAggregate> aggregates = dataSource.fetchAggregate(config.getDimension(),
                config.getMetric(), start, asOf, config.getFilters());
        return analyze(config, aggregates.values());
    }

    public DetectionReport analyze(DetectionConfig config, Collection<DimensionAggregate> aggregates) {
        StatisticalParams params = config.statisticalParams();

        List<DimensionAggregate> groups = aggregates.stream()
                .filter(g -> Double.isFinite(g.total()))
                .filter(g -> g.observationCount() >= params.getMinTransactions())
                .sorted(Comparator.comparing(DimensionAggregate::dimensionKey))
                .toList();
        int excluded = aggregates.size() - groups.size();
        double[] values = groups.stream().mapToDouble(DimensionAggregate::total).toArray();

        List<AnomalyRecord> anomalies = switch (params.getMethod()) {
            case ZSCORE -> zScore(config, params, groups, values);
            case IQR -> iqr(config, params, groups, values);
            case ISOLATION_FOREST -> isolationForest(config, params, groups, values);
        };

        BaselineStats overall = BaselineCalculator.compute(values, 1);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("method", methodKey(params));
        stats.put("dimension", config.getDimension());
        stats.put("lookback_days", params.getLookbackDays());
        stats.put("total_items", values.length);
        stats.put("excluded_groups", excluded);
        stats.put("anomaly_count", anomalies.size());
        stats.put("mean", overall.getMean());
        stats.put("median", values.length == 0 ? 0.0 : overall.percentile("p50"));
        stats.put("std_dev", overall.getStddev());
        stats.put("min", overall.getMin());
        stats.put("max", overall.getMax());

        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(DetectorKind.STATISTICAL)
                .method(methodKey(params))
                .status(SectionStatus.SUCCESS)
                .anomalies(anomalies)
                .statistics(stats)
                .build();
    }

    private List<AnomalyRecord> zScore(DetectionConfig config, StatisticalParams params,
                                       List<DimensionAggregate> groups, double[] values) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        if (values.length < params.getMinSampleSize() || values.length < 3) {
            log.debug("'{}': {} groups, too few for a z-score baseline", config.getName(), values.length);
            return anomalies;
        }
        BaselineCalculator.LeaveOneOut baseline = BaselineCalculator.leaveOneOut(values);
        double t = params.getThreshold();
        for (int i = 0; i < values.length; i++) {
            double mean = baseline.means()[i];
            double sd = baseline.stddevs()[i];
            // Zero variance among the others: no anomaly possible for this group.
            if (sd == 0.0) continue;
            double z = (values[i] - mean) / sd;
            if (Math.abs(z) > t) {
                anomalies.add(record(config, groups.get(i), mean)
                        .bounds(new Bounds(mean - t * sd, mean + t * sd))
                        .zscore(z)
                        .build());
            }
        }
        return anomalies;
    }

    private List<AnomalyRecord> iqr(DetectionConfig config, StatisticalParams params,
                                    List<DimensionAggregate> groups, double[] values) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        if (values.length < Math.max(params.getMinSampleSize(), 4)) {
            log.debug("'{}': {} groups, too few for quartiles", config.getName(), values.length);
            return anomalies;
        }
        double q1 = BaselineCalculator.percentile(values, 25);
        double q3 = BaselineCalculator.percentile(values, 75);
        double median = BaselineCalculator.median(values);
        double spread = params.getIqrMultiplier() * (q3 - q1);
        Bounds fences = new Bounds(q1 - spread, q3 + spread);
        for (int i = 0; i < values.length; i++) {
            if (!fences.contains(values[i])) {
                anomalies.add(record(config, groups.get(i), median).bounds(fences).build());
            }
        }
        return anomalies;
    }

    private List<AnomalyRecord> isolationForest(DetectionConfig config, StatisticalParams params,
                                                List<DimensionAggregate> groups, double[] values) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        if (values.length < params.getMinGroups()) {
            log.debug("'{}': {} groups, isolation forest needs {}", config.getName(), values.length,
                    params.getMinGroups());
            return anomalies;
        }
        double[][] features = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            features[i] = params.isUseOrderCountFeature()
                    ? new double[]{values[i], groups.get(i).orderCount()}
                    : new double[]{values[i]};
        }
        double[] scores = new IsolationForest(params.getNumTrees(), params.getSampleSize(), params.getSeed())
                .fit(features)
                .scoreAll(features);
        double cutoff = BaselineCalculator.percentile(scores, 100.0 * (1.0 - params.getContamination()));
        double median = BaselineCalculator.median(values);
        for (int i = 0; i < values.length; i++) {
            if (scores[i] > cutoff) {
                anomalies.add(record(config, groups.get(i), median).anomalyScore(scores[i]).build());
            }
        }
        return anomalies;
    }

    private AnomalyRecord.AnomalyRecordBuilder record(DetectionConfig config, DimensionAggregate group,
                                                      double expected) {
        double signed = group.total() - expected;
        return AnomalyRecord.builder()
                .detectorSource(config.getName())
                .detectorKind(DetectorKind.STATISTICAL)
                .dimensionName(config.getDimension())
                .dimensionValue(group.dimensionKey())
                .dimensionLabel(group.dimensionLabel())
                .metricName(config.getMetric())
                .metricValue(group.total())
                .expectedValue(expected)
                .deviationPct(expected != 0 ? signed / Math.abs(expected) * 100.0 : null)
                .kind(AnomalyKind.ofDeviation(signed))
                .orderCount(group.orderCount())
                .additionalColumns(AdditionalColumns.pick(config.getAdditionalColumns(), group.attributes()));
    }

    private static String methodKey(StatisticalParams params) {
        return params.getMethod().name().toLowerCase(Locale.ROOT);
    }
}
