package com.lbs.anomaly.repository;

import com.lbs.anomaly.model.DimensionAggregate;
import com.lbs.anomaly.model.MetricPoint;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Read side of the metric store. Detectors only ever see this interface, so tests can
 * hand them a fixed list of points.
 */
public interface MetricDataSource {

    /**
     * Points of {@code metric} dated within {@code [start, end]}, grouped under {@code dimension}
     * (null means the whole series). Points whose attributes do not match every filter are skipped.
     *
     * @throws com.lbs.anomaly.exception.DataUnavailableException when the store cannot be read
     */
    List<MetricPoint> fetchSeries(String dimension, String metric, LocalDate start, LocalDate end,
                                  Map<String, String> filters);

    /**
     * The metric summed per dimension value over {@code [start, end]}, keyed by dimension key.
     */
    Map<String, DimensionAggregate> fetchAggregate(String dimension, String metric, LocalDate start, LocalDate end,
                                                   Map<String, String> filters);
}
