package com.lbs.anomaly.engine;

import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.repository.MetricDataSource;

import java.time.LocalDate;

/**
 * Strategy interface for detector families. Implementations are stateless and
 * registered by {@link DetectorKind} in the orchestrator.
 *
 * <p>{@link #detect} returns a SUCCESS report whose anomalies carry no severity yet;
 * classification and summary counts are added by the orchestrator.
 */
public interface AnomalyDetector {

    DetectorKind getSupportedKind();

    /**
     * Runs one configured detector against data ending at {@code asOf}.
     *
     * @throws com.lbs.anomaly.exception.InsufficientDataException  when the window cannot support the method
     * @throws com.lbs.anomaly.exception.DataUnavailableException   when the data source fails
     * @throws com.lbs.anomaly.exception.ComputationException       when the numeric method fails
     */
    DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf);
}
