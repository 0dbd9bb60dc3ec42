package com.lbs.anomaly.engine.dayonday;

import com.lbs.anomaly.engine.AdditionalColumns;
import com.lbs.anomaly.engine.AnomalyDetector;
import com.lbs.anomaly.engine.MetricFilters;
import com.lbs.anomaly.model.AnomalyKind;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.MetricPoint;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Day-over-day change for the top-N dimension values of a metric. Each observed day is
 * compared with the previous observed day of the same dimension value.
 *
 * <p>A zero previous day with a non-zero current day is flagged with the deviation capped
 * at {@code zeroBaselineCapPct}; zero on both days is not a change.
 */
@Component
public class DayOnDayDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(DayOnDayDetector.class);

    /** Numeric keys sort by value, anything else lexicographically after them. */
    static final Comparator<String> DIMENSION_KEY_ORDER = (a, b) -> {
        boolean an = isNumeric(a), bn = isNumeric(b);
        if (an && bn) return Double.compare(Double.parseDouble(a), Double.parseDouble(b));
        if (an != bn) return an ? -1 : 1;
        return a.compareTo(b);
    };

    @Override
    public DetectorKind getSupportedKind() {
        return DetectorKind.DAY_ON_DAY;
    }

    @Override
    public DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf) {
        DayOnDayParams params = config.dayOnDayParams();
        LocalDate start = asOf.minusDays(params.getLookbackDays());
        List<MetricPoint> points = dataSource.fetchSeries(config.getDimension(), config.getMetric(),
                start, asOf, config.getFilters());
        return analyze(config, points);
    }

    public DetectionReport analyze(DetectionConfig config, List<MetricPoint> points) {
        DayOnDayParams params = config.dayOnDayParams();

        Map<String, Series> byKey = new HashMap<>();
        for (MetricPoint point : points) {
            if (!point.isValid() || !MetricFilters.matches(point, config.getFilters())) continue;
            byKey.computeIfAbsent(point.dimensionKey(), k -> new Series(point.dimensionLabel()))
                    .add(point);
        }

        List<String> selected = byKey.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Series>>comparingDouble(e -> -e.getValue().total)
                        .thenComparing(Map.Entry::getKey, DIMENSION_KEY_ORDER))
                .limit(params.getTopN())
                .map(Map.Entry::getKey)
                .toList();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        int comparisons = 0;
        int zeroBaselines = 0;
        double changeSum = 0;
        int changeCount = 0;
        double maxIncrease = 0;
        double maxDecrease = 0;

        for (String key : selected) {
            Series series = byKey.get(key);
            Map.Entry<LocalDate, Day> previous = null;
            for (Map.Entry<LocalDate, Day> current : series.days.entrySet()) {
                if (previous != null) {
                    comparisons++;
                    AnomalyRecord anomaly = compare(config, params, key, series, previous, current);
                    if (anomaly != null) {
                        anomalies.add(anomaly);
                        if (anomaly.isZeroBaseline()) zeroBaselines++;
                    }
                    double prev = previous.getValue().value;
                    if (prev != 0.0) {
                        double change = (current.getValue().value - prev) / Math.abs(prev) * 100.0;
                        changeSum += change;
                        changeCount++;
                        maxIncrease = Math.max(maxIncrease, change);
                        maxDecrease = Math.min(maxDecrease, change);
                    }
                }
                previous = current;
            }
        }

        // Most recent first, largest moves first within a day.
        anomalies.sort(Comparator.comparing(AnomalyRecord::getTimePeriod).reversed()
                .thenComparing(Comparator.comparingDouble(AnomalyRecord::absoluteDeviationPct).reversed())
                .thenComparing(AnomalyRecord::getDimensionValue, DIMENSION_KEY_ORDER));

        long spikes = anomalies.stream().filter(a -> a.getKind().isUpward()).count();
        if (byKey.isEmpty()) {
            log.debug("'{}': no points after filters", config.getName());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("dimension", config.getDimension());
        stats.put("metric", config.getMetric());
        stats.put("threshold_pct", params.getThresholdPct());
        stats.put("lookback_days", params.getLookbackDays());
        stats.put("top_n", params.getTopN());
        stats.put("dimensions_analyzed", selected.size());
        stats.put("total_comparisons", comparisons);
        stats.put("anomaly_count", anomalies.size());
        stats.put("spike_count", spikes);
        stats.put("drop_count", anomalies.size() - spikes);
        stats.put("zero_baseline_count", zeroBaselines);
        stats.put("avg_percent_change", changeCount == 0 ? 0.0 : changeSum / changeCount);
        stats.put("max_increase", maxIncrease);
        stats.put("max_decrease", maxDecrease);

        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(DetectorKind.DAY_ON_DAY)
                .method("day_on_day")
                .status(SectionStatus.SUCCESS)
                .anomalies(anomalies)
                .statistics(stats)
                .build();
    }

    private AnomalyRecord compare(DetectionConfig config, DayOnDayParams params, String key, Series series,
                                  Map.Entry<LocalDate, Day> previous, Map.Entry<LocalDate, Day> current) {
        double prev = previous.getValue().value;
        double cur = current.getValue().value;
        double change;
        boolean zeroBaseline = false;

        if (prev == 0.0) {
            if (cur == 0.0) return null;
            change = Math.copySign(params.getZeroBaselineCapPct(), cur);
            zeroBaseline = true;
        } else {
            change = (cur - prev) / Math.abs(prev) * 100.0;
            if (Math.abs(change) <= params.getThresholdPct()) return null;
        }

        return AnomalyRecord.builder()
                .detectorSource(config.getName())
                .detectorKind(DetectorKind.DAY_ON_DAY)
                .timePeriod(current.getKey().toString())
                .previousPeriod(previous.getKey().toString())
                .dimensionName(config.getDimension())
                .dimensionValue(key)
                .dimensionLabel(series.label)
                .metricName(config.getMetric())
                .metricValue(cur)
                .previousValue(prev)
                .expectedValue(prev)
                .deviationPct(change)
                .kind(AnomalyKind.ofDeviation(change))
                .zeroBaseline(zeroBaseline)
                .orderCount(current.getValue().orders)
                .previousOrderCount(previous.getValue().orders)
                .additionalColumns(AdditionalColumns.pick(config.getAdditionalColumns(),
                        current.getValue().attributes))
                .build();
    }

    private static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) return false;
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static final class Series {
        private final String label;
        private final TreeMap<LocalDate, Day> days = new TreeMap<>();
        private double total;

        Series(String label) {
            this.label = label;
        }

        void add(MetricPoint point) {
            Day day = days.computeIfAbsent(point.timePeriod(), d -> new Day(point.attributes()));
            day.value += point.value();
            day.orders += point.orderCount();
            total += point.value();
        }
    }

    private static final class Day {
        private final Map<String, String> attributes;
        private double value;
        private long orders;

        Day(Map<String, String> attributes) {
            this.attributes = attributes;
        }
    }
}
