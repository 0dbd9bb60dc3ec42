package com.lbs.anomaly.engine;

import com.lbs.anomaly.config.DetectionConfigSource;
import com.lbs.anomaly.config.DetectionProperties;
import com.lbs.anomaly.config.MetricsConfig;
import com.lbs.anomaly.engine.classify.SeverityClassifier;
import com.lbs.anomaly.exception.ComputationException;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.exception.DetectionException;
import com.lbs.anomaly.exception.InsufficientDataException;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectionResponse;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.ReportSummary;
import com.lbs.anomaly.model.RunStatus;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.Severity;
import com.lbs.anomaly.repository.CacheKeys;
import com.lbs.anomaly.repository.DetectionCache;
import com.lbs.anomaly.repository.MetricDataSource;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs detector configurations and merges their reports into one response.
 * Uses the Strategy pattern: each {@link DetectorKind} is handled by a registered {@link AnomalyDetector}.
 *
 * <p>Sections run concurrently; forecast fits go to their own bounded pool. A section that
 * throws, or is still running at the deadline, becomes a FAILED or TIMED_OUT entry and never
 * affects the others. Sections are merged on the calling thread in configuration order.
 */
@Component
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final DetectionConfigSource configSource;
    private final Map<DetectorKind, AnomalyDetector> detectorMap;
    private final MetricDataSource dataSource;
    private final DetectionCache cache;
    private final SeverityClassifier classifier;
    private final DetectionProperties properties;
    private final ExecutorService detectionExecutor;
    private final ExecutorService forecastExecutor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DetectionOrchestrator(DetectionConfigSource configSource,
                                 List<AnomalyDetector> detectors,
                                 MetricDataSource dataSource,
                                 DetectionCache cache,
                                 SeverityClassifier classifier,
                                 DetectionProperties properties,
                                 @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
                                 @Qualifier("forecastExecutor") ExecutorService forecastExecutor,
                                 Tracer tracer,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.configSource = configSource;
        this.detectorMap = new EnumMap<>(DetectorKind.class);
        this.dataSource = dataSource;
        this.cache = cache;
        this.classifier = classifier;
        this.properties = properties;
        this.detectionExecutor = detectionExecutor;
        this.forecastExecutor = forecastExecutor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getSupportedKind(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getSupportedKind(), detector.getClass().getSimpleName());
        }
    }

    /** Runs the configurations selected by {@code method} with the default timeout. */
    public DetectionResponse detect(String method) {
        if (!configSource.isDetectionEnabled()) {
            return disabled();
        }
        return run(configSource.resolve(method), defaultTimeout());
    }

    @Observed(name = "detection.run", contextualName = "detection-run")
    public DetectionResponse run(List<DetectionConfig> configs, Duration timeout) {
        long started = clock.millis();
        LocalDate asOf = LocalDate.now(clock);
        boolean cacheEnabled = properties.getCache().isEnabled();

        Map<String, String> cacheKeys = new LinkedHashMap<>();
        Map<String, Future<DetectionReport>> futures = new LinkedHashMap<>();
        Map<String, DetectionConfig> byName = new LinkedHashMap<>();
        for (DetectionConfig config : configs) {
            String key = cacheEnabled ? CacheKeys.of(config, asOf) : null;
            cacheKeys.put(config.getName(), key);
            byName.put(config.getName(), config);
            ExecutorService pool = config.isForecast() ? forecastExecutor : detectionExecutor;
            futures.put(config.getName(), pool.submit(() -> runSection(config, key, asOf)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        Map<String, DetectionReport> sections = new LinkedHashMap<>();
        for (Map.Entry<String, Future<DetectionReport>> entry : futures.entrySet()) {
            DetectionConfig config = byName.get(entry.getKey());
            sections.put(entry.getKey(), await(config, entry.getValue(), deadline, timeout));
        }

        // Write back after the merge so a slow cache never holds up detection.
        if (cacheEnabled) {
            sections.forEach((name, report) -> {
                if (report.isSuccessful() && !report.isCached()) {
                    cache.put(cacheKeys.get(name), report, properties.getCache().getTtlSeconds());
                }
            });
        }

        DetectionResponse response = DetectionResponse.builder()
                .timestamp(clock.millis())
                .summary(summarize(sections))
                .anomalyTypes(sections)
                .build();

        DetectionResponse.RunSummary summary = response.getSummary();
        log.info("Detection run finished in {} ms: {} sections, {} anomalies, status {}",
                clock.millis() - started, sections.size(), summary.getTotalAnomalies(), summary.getStatus());
        int severe = summary.getBySeverity().get(Severity.HIGH) + summary.getBySeverity().get(Severity.CRITICAL);
        if (severe > 0) {
            log.warn("Detection run flagged {} HIGH/CRITICAL anomalies", severe);
        }
        return response;
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(properties.getExecution().getTimeoutMs());
    }

    private DetectionReport runSection(DetectionConfig config, String cacheKey, LocalDate asOf) {
        if (cacheKey != null) {
            Optional<DetectionReport> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                metricsConfig.recordCacheResult("hit");
                log.debug("Serving '{}' from cache", config.getName());
                DetectionReport hit = cached.get();
                hit.setCached(true);
                return hit;
            }
            metricsConfig.recordCacheResult("miss");
        }

        AnomalyDetector detector = detectorMap.get(config.getKind());
        if (detector == null) {
            throw new ComputationException("No detector registered for kind " + config.getKind());
        }

        Span span = tracer.nextSpan()
                .name("detector." + config.getKind().key())
                .tag("detector.name", config.getName())
                .tag("detector.kind", config.getKind().name())
                .start();
        long started = clock.millis();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectionReport raw = detector.detect(config, dataSource, asOf);
            List<AnomalyRecord> enriched = classifier.enrichAll(raw.getAnomalies());
            DetectionReport report = raw.toBuilder()
                    .anomalies(new ArrayList<>(enriched))
                    .summary(ReportSummary.of(enriched))
                    .computedAt(clock.millis())
                    .cached(false)
                    .build();

            span.tag("anomaly.count", String.valueOf(enriched.size()));
            metricsConfig.recordSection(config.getName(), SectionStatus.SUCCESS.name(), clock.millis() - started);
            for (AnomalyRecord record : enriched) {
                metricsConfig.recordAnomaly(config.getName(), record.getSeverity().name());
            }
            return report;
        } catch (DetectionException e) {
            span.error(e);
            metricsConfig.recordSection(config.getName(), SectionStatus.FAILED.name(), clock.millis() - started);
            throw e;
        } catch (RuntimeException e) {
            span.error(e);
            metricsConfig.recordSection(config.getName(), SectionStatus.FAILED.name(), clock.millis() - started);
            throw new ComputationException("Detector '" + config.getName() + "' failed: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    private DetectionReport await(DetectionConfig config, Future<DetectionReport> future, long deadline,
                                  Duration timeout) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsConfig.recordSection(config.getName(), SectionStatus.TIMED_OUT.name(), timeout.toMillis());
            log.warn("Detector '{}' timed out after {} ms", config.getName(), timeout.toMillis());
            return DetectionReport.timedOut(config.getName(), config.getKind(), timeout.toMillis(), clock.millis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DetectionReport.failed(config.getName(), config.getKind(), "Detection run was interrupted",
                    clock.millis());
        } catch (ExecutionException e) {
            return failure(config, e.getCause());
        }
    }

    private DetectionReport failure(DetectionConfig config, Throwable cause) {
        if (cause instanceof InsufficientDataException || cause instanceof DataUnavailableException) {
            log.warn("Detector '{}' failed: {}", config.getName(), cause.getMessage());
        } else if (cause instanceof DetectionException && !(cause instanceof ComputationException)) {
            log.warn("Detector '{}' rejected its configuration: {}", config.getName(), cause.getMessage());
        } else {
            log.error("Detector '{}' failed unexpectedly: {}", config.getName(), cause.getMessage(), cause);
        }
        String errorCode = cause instanceof DetectionException de
                ? de.getErrorCode()
                : ComputationException.ERROR_CODE;
        return DetectionReport.failed(config.getName(), config.getKind(), cause.getMessage(), errorCode,
                clock.millis());
    }

    private DetectionResponse.RunSummary summarize(Map<String, DetectionReport> sections) {
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> timedOut = new ArrayList<>();
        Map<Severity, Integer> bySeverity = ReportSummary.empty().getBySeverity();
        int total = 0;

        for (Map.Entry<String, DetectionReport> entry : sections.entrySet()) {
            DetectionReport report = entry.getValue();
            switch (report.getStatus()) {
                case SUCCESS -> {
                    succeeded.add(entry.getKey());
                    total += report.getAnomalies().size();
                    report.getSummary().getBySeverity().forEach((s, n) -> bySeverity.merge(s, n, Integer::sum));
                }
                case FAILED -> failed.add(entry.getKey());
                case TIMED_OUT -> timedOut.add(entry.getKey());
            }
        }

        RunStatus status;
        if (failed.isEmpty() && timedOut.isEmpty()) {
            status = RunStatus.SUCCESS;
        } else if (succeeded.isEmpty()) {
            status = RunStatus.FAILED;
        } else {
            status = RunStatus.PARTIAL;
        }

        return DetectionResponse.RunSummary.builder()
                .totalAnomalies(total)
                .detectionMethods(sections.size())
                .status(status)
                .succeeded(succeeded)
                .failed(failed)
                .timedOut(timedOut)
                .bySeverity(bySeverity)
                .build();
    }

    private DetectionResponse disabled() {
        log.info("Detection requested while globally disabled");
        return DetectionResponse.builder()
                .timestamp(clock.millis())
                .summary(DetectionResponse.RunSummary.builder()
                        .status(RunStatus.DISABLED)
                        .succeeded(List.of())
                        .failed(List.of())
                        .timedOut(List.of())
                        .bySeverity(ReportSummary.empty().getBySeverity())
                        .build())
                .build();
    }
}
