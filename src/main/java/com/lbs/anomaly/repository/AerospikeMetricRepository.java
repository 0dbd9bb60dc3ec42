package com.lbs.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.lbs.anomaly.config.AerospikeConfig;
import com.lbs.anomaly.engine.MetricFilters;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.DimensionAggregate;
import com.lbs.anomaly.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metric facts in the {@code metric_points} set. One record is one fact row: its business
 * date, the attributes it can be grouped and filtered by (dimension keys, labels, category),
 * metric values by name and the order count.
 *
 * <p>A dimension label is read from the attribute {@code <dimension>_label} when present.
 */
@Repository
public class AerospikeMetricRepository implements MetricDataSource {

    private static final Logger log = LoggerFactory.getLogger(AerospikeMetricRepository.class);

    public static final String WHOLE_SERIES_KEY = "all";
    public static final String LABEL_SUFFIX = "_label";

    private static final String BIN_DATE = "date";
    private static final String BIN_ATTRS = "attrs";
    private static final String BIN_METRICS = "metrics";
    private static final String BIN_ORDERS = "orders";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ScanPolicy scanPolicy;

    public AerospikeMetricRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("metricScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.scanPolicy = scanPolicy;
    }

    public void save(String factId, LocalDate date, Map<String, String> attributes,
                     Map<String, Double> metrics, long orders) {
        Key key = new Key(namespace, AerospikeConfig.SET_METRIC_POINTS, factId);
        try {
            client.put(writePolicy, key,
                    new Bin(BIN_DATE, date.toString()),
                    new Bin(BIN_ATTRS, attributes),
                    new Bin(BIN_METRICS, metrics),
                    new Bin(BIN_ORDERS, orders));
        } catch (AerospikeException e) {
            throw new DataUnavailableException("Failed to store metric fact " + factId, e);
        }
    }

    @Override
    public List<MetricPoint> fetchSeries(String dimension, String metric, LocalDate start, LocalDate end,
                                         Map<String, String> filters) {
        List<MetricPoint> points = new ArrayList<>();
        int[] skipped = new int[1];

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METRIC_POINTS, (key, record) -> {
                MetricPoint point = toPoint(record, dimension, metric);
                if (point == null || point.timePeriod().isBefore(start) || point.timePeriod().isAfter(end)) {
                    return;
                }
                if (!point.isValid()) {
                    synchronized (skipped) {
                        skipped[0]++;
                    }
                    return;
                }
                if (!MetricFilters.matches(point, filters)) return;
                synchronized (points) {
                    points.add(point);
                }
            });
        } catch (AerospikeException e) {
            throw new DataUnavailableException("Metric store unavailable: " + e.getMessage(), e);
        }

        if (skipped[0] > 0) {
            log.debug("Dropped {} non-finite {} values between {} and {}", skipped[0], metric, start, end);
        }
        return points;
    }

    @Override
    public Map<String, DimensionAggregate> fetchAggregate(String dimension, String metric, LocalDate start,
                                                          LocalDate end, Map<String, String> filters) {
        Map<String, double[]> sums = new HashMap<>();
        Map<String, MetricPoint> firstSeen = new HashMap<>();
        for (MetricPoint point : fetchSeries(dimension, metric, start, end, filters)) {
            double[] acc = sums.computeIfAbsent(point.dimensionKey(), k -> new double[3]);
            acc[0] += point.value();
            acc[1] += 1;
            acc[2] += point.orderCount();
            firstSeen.putIfAbsent(point.dimensionKey(), point);
        }

        Map<String, DimensionAggregate> aggregates = new LinkedHashMap<>();
        sums.forEach((k, acc) -> {
            MetricPoint sample = firstSeen.get(k);
            aggregates.put(k, new DimensionAggregate(k, sample.dimensionLabel(), acc[0],
                    (long) acc[1], (long) acc[2], sample.attributes()));
        });
        return aggregates;
    }

    private MetricPoint toPoint(Record record, String dimension, String metric) {
        Map<String, String> attributes = stringMap(record.getMap(BIN_ATTRS));
        Map<?, ?> metrics = record.getMap(BIN_METRICS);
        String date = record.getString(BIN_DATE);
        if (metrics == null || date == null || !(metrics.get(metric) instanceof Number value)) {
            return null;
        }

        String dimensionKey = WHOLE_SERIES_KEY;
        String label = null;
        if (dimension != null) {
            dimensionKey = attributes.get(dimension);
            if (dimensionKey == null) return null;
            label = attributes.getOrDefault(dimension + LABEL_SUFFIX, dimensionKey);
        }

        try {
            return new MetricPoint(dimensionKey, label, LocalDate.parse(date), metric,
                    value.doubleValue(), record.getLong(BIN_ORDERS), attributes);
        } catch (DateTimeParseException e) {
            log.warn("Skipping metric fact with malformed date '{}'", date);
            return null;
        }
    }

    private static Map<String, String> stringMap(Map<?, ?> raw) {
        Map<String, String> result = new HashMap<>();
        if (raw == null) return result;
        raw.forEach((k, v) -> {
            if (k != null && v != null) result.put(k.toString(), v.toString());
        });
        return result;
    }
}
