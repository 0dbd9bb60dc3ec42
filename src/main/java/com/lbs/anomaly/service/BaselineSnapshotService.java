package com.lbs.anomaly.service;

import com.lbs.anomaly.config.DetectionProperties;
import com.lbs.anomaly.config.MetricsConfig;
import com.lbs.anomaly.engine.stats.BaselineCalculator;
import com.lbs.anomaly.exception.DetectionException;
import com.lbs.anomaly.model.BaselineStats;
import com.lbs.anomaly.model.MetricPoint;
import com.lbs.anomaly.repository.BaselineSnapshotRepository;
import com.lbs.anomaly.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily baseline snapshots: per dimension value, the statistics of its daily metric totals
 * over the 30 days up to the business date.
 */
@Service
public class BaselineSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(BaselineSnapshotService.class);

    static final int WINDOW_DAYS = 30;

    private final MetricDataSource dataSource;
    private final BaselineSnapshotRepository repository;
    private final DetectionProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BaselineSnapshotService(MetricDataSource dataSource,
                                   BaselineSnapshotRepository repository,
                                   DetectionProperties properties,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.dataSource = dataSource;
        this.repository = repository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(cron = "${detection.snapshot.cron:0 30 2 * * *}")
    public void scheduledSnapshot() {
        DetectionProperties.Snapshot snapshot = properties.getSnapshot();
        if (!snapshot.isEnabled()) return;

        LocalDate businessDate = LocalDate.now(clock).minusDays(1);
        for (String dimension : snapshot.getDimensions()) {
            try {
                List<BaselineStats> stats = snapshot(businessDate, dimension, snapshot.getMetric());
                log.info("Baseline snapshot for {} {} on {}: {} groups",
                        dimension, snapshot.getMetric(), businessDate, stats.size());
            } catch (DetectionException e) {
                log.warn("Baseline snapshot for {} on {} failed: {}", dimension, businessDate, e.getMessage());
            }
        }
    }

    /** Computes and stores the snapshot for one dimension. */
    public List<BaselineStats> snapshot(LocalDate businessDate, String dimension, String metric) {
        List<BaselineStats> stats = compute(businessDate, dimension, metric);
        repository.save(businessDate, dimension, metric, stats);
        metricsConfig.recordSnapshot(dimension, stats.size());
        return stats;
    }

    /** Reads a stored snapshot, computing and storing it when absent. */
    public List<BaselineStats> getOrCompute(LocalDate businessDate, String dimension, String metric) {
        return repository.find(businessDate, dimension, metric)
                .orElseGet(() -> snapshot(businessDate, dimension, metric));
    }

    public List<BaselineStats> compute(LocalDate businessDate, String dimension, String metric) {
        LocalDate start = businessDate.minusDays(WINDOW_DAYS - 1);
        List<MetricPoint> points = dataSource.fetchSeries(dimension, metric, start, businessDate, Map.of());

        Map<String, TreeMap<LocalDate, Double>> daily = new TreeMap<>();
        for (MetricPoint point : points) {
            daily.computeIfAbsent(point.dimensionKey(), k -> new TreeMap<>())
                    .merge(point.timePeriod(), point.value(), Double::sum);
        }

        String window = start + ".." + businessDate;
        int minSampleSize = properties.getSnapshot().getMinSampleSize();
        List<BaselineStats> result = new ArrayList<>();
        daily.forEach((key, days) -> result.add(BaselineCalculator.compute(key, metric, window,
                days.values().stream().mapToDouble(Double::doubleValue).toArray(), minSampleSize)));
        result.sort(Comparator.comparingDouble(BaselineStats::getSum).reversed());
        return result;
    }
}
