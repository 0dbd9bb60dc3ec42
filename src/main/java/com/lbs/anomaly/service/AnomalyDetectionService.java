package com.lbs.anomaly.service;

import com.lbs.anomaly.config.DetectionConfigSource;
import com.lbs.anomaly.config.DetectionConfigValidator;
import com.lbs.anomaly.config.EnumSettings;
import com.lbs.anomaly.engine.DetectionOrchestrator;
import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.ComparisonType;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectionResponse;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.Granularity;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.StatisticalMethod;
import com.lbs.anomaly.model.TimeSeriesMode;
import com.lbs.anomaly.model.params.ComparativeParams;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for detection runs: configured detectors by selector or name, and ad-hoc
 * single detectors built from request parameters.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionOrchestrator orchestrator;
    private final DetectionConfigSource configSource;

    public AnomalyDetectionService(DetectionOrchestrator orchestrator, DetectionConfigSource configSource) {
        this.orchestrator = orchestrator;
        this.configSource = configSource;
    }

    public DetectionResponse detect(String method) {
        return orchestrator.detect(method);
    }

    public Optional<DetectionReport> runConfigured(String name) {
        Optional<DetectionConfig> config = configSource.findByName(name);
        config.ifPresent(c -> {
            if (!c.isEnabled()) throw new ConfigurationException("Detector '" + name + "' is disabled");
        });
        return config.map(this::runSingle);
    }

    public List<DetectionConfig> listConfigs() {
        return configSource.getConfigs();
    }

    public DetectionReport timeSeries(String metric, String granularity, int lookbackDays, int windowSize,
                                      double thresholdStd, Map<String, String> filters) {
        return runSingle(DetectionConfig.builder()
                .name("adhoc_time_series")
                .kind(DetectorKind.TIME_SERIES)
                .metric(metric)
                .filters(filters)
                .params(TimeSeriesParams.builder()
                        .mode(TimeSeriesMode.MOVING_AVERAGE)
                        .granularity(EnumSettings.parse(Granularity.class, granularity, "granularity"))
                        .lookbackDays(lookbackDays)
                        .windowSize(windowSize)
                        .thresholdStd(thresholdStd)
                        .build())
                .build());
    }

    public DetectionReport forecast(String metric, int lookbackDays, int forecastDays, double intervalWidth,
                                    Map<String, String> filters) {
        return runSingle(DetectionConfig.builder()
                .name("adhoc_forecast")
                .kind(DetectorKind.TIME_SERIES)
                .metric(metric)
                .filters(filters)
                .params(TimeSeriesParams.builder()
                        .mode(TimeSeriesMode.FORECAST)
                        .lookbackDays(lookbackDays)
                        .forecastDays(forecastDays)
                        .intervalWidth(intervalWidth)
                        .build())
                .build());
    }

    public DetectionReport statistical(String dimension, String metric, String method, int lookbackDays,
                                       double threshold, long minTransactions, double contamination,
                                       Map<String, String> filters) {
        return runSingle(DetectionConfig.builder()
                .name("adhoc_statistical")
                .kind(DetectorKind.STATISTICAL)
                .dimension(dimension)
                .metric(metric)
                .filters(filters)
                .params(StatisticalParams.builder()
                        .method(EnumSettings.parse(StatisticalMethod.class, method, "method"))
                        .lookbackDays(lookbackDays)
                        .threshold(threshold)
                        .minTransactions(minTransactions)
                        .contamination(contamination)
                        .build())
                .build());
    }

    public DetectionReport comparative(String metric, String comparisonType, double thresholdPct, double minValue,
                                       int lookbackDays, Map<String, String> filters) {
        return runSingle(DetectionConfig.builder()
                .name("adhoc_comparative")
                .kind(DetectorKind.COMPARATIVE)
                .metric(metric)
                .filters(filters)
                .params(ComparativeParams.builder()
                        .comparisonType(EnumSettings.parse(ComparisonType.class, comparisonType, "comparison_type"))
                        .thresholdPct(thresholdPct)
                        .minValue(minValue)
                        .lookbackDays(lookbackDays)
                        .build())
                .build());
    }

    public DetectionReport dayOnDay(String dimension, String metric, double thresholdPct, int lookbackDays, int topN,
                                    Map<String, String> filters, List<String> additionalColumns) {
        return runSingle(DetectionConfig.builder()
                .name("adhoc_day_on_day")
                .kind(DetectorKind.DAY_ON_DAY)
                .dimension(dimension)
                .metric(metric)
                .filters(filters)
                .additionalColumns(additionalColumns)
                .params(DayOnDayParams.builder()
                        .thresholdPct(thresholdPct)
                        .lookbackDays(lookbackDays)
                        .topN(topN)
                        .build())
                .build());
    }

    private DetectionReport runSingle(DetectionConfig config) {
        List<String> problems = DetectionConfigValidator.problems(config);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        log.debug("Running single detector '{}'", config.getName());
        DetectionResponse response = orchestrator.run(List.of(config), orchestrator.defaultTimeout());
        DetectionReport report = response.getAnomalyTypes().get(config.getName());
        // Single-detector requests surface a store outage instead of a FAILED section.
        if (report.getStatus() == SectionStatus.FAILED
                && DataUnavailableException.ERROR_CODE.equals(report.getErrorCode())) {
            throw new DataUnavailableException(report.getError());
        }
        return report;
    }
}
