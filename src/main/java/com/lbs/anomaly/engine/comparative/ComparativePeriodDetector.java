package com.lbs.anomaly.engine.comparative;

import com.lbs.anomaly.engine.AnomalyDetector;
import com.lbs.anomaly.model.AnomalyKind;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.ComparisonType;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.MetricPoint;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.params.ComparativeParams;
import com.lbs.anomaly.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Period-over-period change (YoY, MoM, QoQ). Every calendar period is paired with its
 * predecessor; pairs whose predecessor total is zero are excluded rather than divided.
 * The period still in progress on the as-of date is not compared.
 */
@Component
public class ComparativePeriodDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ComparativePeriodDetector.class);

    @Override
    public DetectorKind getSupportedKind() {
        return DetectorKind.COMPARATIVE;
    }

    @Override
    public DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf) {
        ComparativeParams params = config.comparativeParams();
        ComparisonType type = params.getComparisonType();
        LocalDate start = type.periodStart(asOf.minusDays(params.getLookbackDays()));
        LocalDate end = type.lastCompleteDay(asOf);
        List<MetricPoint> points = dataSource.fetchSeries(null, config.getMetric(), start, end, config.getFilters());
        DetectionReport report = analyze(config, points);
        report.getStatistics().put("complete_through", end.toString());
        return report;
    }

    public DetectionReport analyze(DetectionConfig config, List<MetricPoint> points) {
        ComparativeParams params = config.comparativeParams();
        ComparisonType type = params.getComparisonType();

        TreeMap<LocalDate, double[]> periods = new TreeMap<>();
        for (MetricPoint point : points) {
            if (!point.isValid()) continue;
            double[] total = periods.computeIfAbsent(type.periodStart(point.timePeriod()), k -> new double[2]);
            total[0] += point.value();
            total[1] += point.orderCount();
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<Map<String, Object>> pairs = new ArrayList<>();
        int excludedZeroBaseline = 0;
        double changeSum = 0;
        double maxIncrease = 0;
        double maxDecrease = 0;

        for (Map.Entry<LocalDate, double[]> entry : periods.entrySet()) {
            LocalDate previousStart = type.predecessor(entry.getKey());
            double[] previous = periods.get(previousStart);
            if (previous == null) continue;
            if (previous[0] == 0.0) {
                excludedZeroBaseline++;
                continue;
            }
            double current = entry.getValue()[0];
            double change = (current - previous[0]) / Math.abs(previous[0]) * 100.0;
            boolean flagged = Math.abs(change) > params.getThresholdPct() && current >= params.getMinValue();

            changeSum += change;
            maxIncrease = Math.max(maxIncrease, change);
            maxDecrease = Math.min(maxDecrease, change);

            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("period", type.label(entry.getKey()));
            pair.put("previous_period", type.label(previousStart));
            pair.put("current_value", current);
            pair.put("previous_value", previous[0]);
            pair.put("percent_change", change);
            pair.put("is_anomaly", flagged);
            pairs.add(pair);

            if (flagged) {
                anomalies.add(AnomalyRecord.builder()
                        .detectorSource(config.getName())
                        .detectorKind(DetectorKind.COMPARATIVE)
                        .timePeriod(type.label(entry.getKey()))
                        .previousPeriod(type.label(previousStart))
                        .dimensionName(config.getDimension() == null ? "total" : config.getDimension())
                        .dimensionValue("all")
                        .metricName(config.getMetric())
                        .metricValue(current)
                        .previousValue(previous[0])
                        .expectedValue(previous[0])
                        .deviationPct(change)
                        .kind(AnomalyKind.ofChange(change))
                        .orderCount((long) entry.getValue()[1])
                        .previousOrderCount((long) previous[1])
                        .build());
            }
        }

        if (pairs.isEmpty()) {
            log.debug("'{}': no {} pairs in {} periods", config.getName(), type, periods.size());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("comparison_type", type.name().toLowerCase(Locale.ROOT));
        stats.put("threshold_pct", params.getThresholdPct());
        stats.put("min_value", params.getMinValue());
        stats.put("total_periods", periods.size());
        stats.put("total_pairs", pairs.size());
        stats.put("excluded_zero_baseline", excludedZeroBaseline);
        stats.put("anomaly_count", anomalies.size());
        stats.put("avg_percent_change", pairs.isEmpty() ? 0.0 : changeSum / pairs.size());
        stats.put("max_increase", maxIncrease);
        stats.put("max_decrease", maxDecrease);

        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(DetectorKind.COMPARATIVE)
                .method(type.name().toLowerCase(Locale.ROOT))
                .status(SectionStatus.SUCCESS)
                .anomalies(anomalies)
                .statistics(stats)
                .seriesData(pairs)
                .build();
    }
}
