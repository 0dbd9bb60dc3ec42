package com.lbs.anomaly.engine;

import com.lbs.anomaly.config.DetectionConfigSource;
import com.lbs.anomaly.config.DetectionProperties;
import com.lbs.anomaly.config.MetricsConfig;
import com.lbs.anomaly.engine.classify.AnomalyNarrator;
import com.lbs.anomaly.engine.classify.SeverityClassifier;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectionResponse;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.RunStatus;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.Severity;
import com.lbs.anomaly.model.SeverityThresholds;
import com.lbs.anomaly.model.TimeSeriesMode;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import com.lbs.anomaly.repository.InMemoryDetectionCache;
import com.lbs.anomaly.repository.MetricDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static com.lbs.anomaly.testutil.TestDataFactory.anomaly;
import static com.lbs.anomaly.testutil.TestDataFactory.dayOnDayConfig;
import static com.lbs.anomaly.testutil.TestDataFactory.statisticalConfig;
import static com.lbs.anomaly.testutil.TestDataFactory.timeSeriesConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectionOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T10:00:00Z"), ZoneOffset.UTC);

    private final DetectionConfigSource configSource = mock(DetectionConfigSource.class);
    private final MetricDataSource dataSource = mock(MetricDataSource.class);
    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final DetectionProperties properties = new DetectionProperties();

    private ExecutorService detectionExecutor;
    private ExecutorService forecastExecutor;
    private InMemoryDetectionCache cache;

    private final StubDetector timeSeries = new StubDetector(DetectorKind.TIME_SERIES);
    private final StubDetector statistical = new StubDetector(DetectorKind.STATISTICAL);
    private final StubDetector dayOnDay = new StubDetector(DetectorKind.DAY_ON_DAY);

    private DetectionOrchestrator orchestrator;

    private final DetectionConfig dailySales = timeSeriesConfig("daily_sales", TimeSeriesParams.builder().build());
    private final DetectionConfig productOutliers = statisticalConfig("product_outliers", StatisticalParams.builder().build());
    private final DetectionConfig productDayOnDay = dayOnDayConfig("product_day_on_day", DayOnDayParams.builder().build());

    @BeforeEach
    void setUp() {
        detectionExecutor = Executors.newFixedThreadPool(3, r -> new Thread(r, "detector-test"));
        forecastExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "forecast-test"));
        cache = new InMemoryDetectionCache(CLOCK);
        SeverityClassifier classifier = new SeverityClassifier(SeverityThresholds.builder().build(), Map.of(),
                List.of(), new AnomalyNarrator());

        orchestrator = new DetectionOrchestrator(configSource, List.of(timeSeries, statistical, dayOnDay),
                dataSource, cache, classifier, properties, detectionExecutor, forecastExecutor,
                Tracer.NOOP, new MetricsConfig(registry), CLOCK);

        timeSeries.respond(() -> report(dailySales, 150.0));
        statistical.respond(() -> report(productOutliers, 40.0));
        dayOnDay.respond(() -> report(productDayOnDay, -60.0));
    }

    @AfterEach
    void tearDown() {
        detectionExecutor.shutdownNow();
        forecastExecutor.shutdownNow();
    }

    private static DetectionReport report(DetectionConfig config, double deviation) {
        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(config.getKind())
                .method(config.getKind().key())
                .status(SectionStatus.SUCCESS)
                .anomalies(new ArrayList<>(List.of(anomaly(config.getKind(), deviation)
                        .detectorSource(config.getName()).build())))
                .build();
    }

    @Test
    void run_allSectionsSucceed_enrichesAndSummarises() {
        DetectionResponse response = orchestrator.run(List.of(dailySales, productOutliers, productDayOnDay),
                Duration.ofSeconds(5));

        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(response.getSummary().getTotalAnomalies()).isEqualTo(3);
        assertThat(response.getSummary().getDetectionMethods()).isEqualTo(3);
        assertThat(response.getAnomalyTypes()).containsOnlyKeys("daily_sales", "product_outliers", "product_day_on_day");
        assertThat(response.getAnomalyTypes().keySet())
                .containsExactly("daily_sales", "product_outliers", "product_day_on_day");

        DetectionReport daily = response.getAnomalyTypes().get("daily_sales");
        assertThat(daily.getAnomalies().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(daily.getAnomalies().get(0).getDescription()).isNotBlank();
        assertThat(daily.getSummary().getTotal()).isEqualTo(1);
        assertThat(daily.getComputedAt()).isEqualTo(CLOCK.millis());
        assertThat(response.getSummary().getBySeverity())
                .containsEntry(Severity.CRITICAL, 1)
                .containsEntry(Severity.HIGH, 1)
                .containsEntry(Severity.MEDIUM, 1);
        assertThat(registry.find("detection.run.count").tag("status", "SUCCESS").counters()).hasSize(3);
    }

    @Test
    void run_failingSection_isIsolatedAndRunIsPartial() {
        dayOnDay.respond(() -> {
            throw new DataUnavailableException("metric store unreachable");
        });

        DetectionResponse response = orchestrator.run(List.of(dailySales, productDayOnDay), Duration.ofSeconds(5));

        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.PARTIAL);
        assertThat(response.getSummary().getFailed()).containsExactly("product_day_on_day");
        assertThat(response.getSummary().getSucceeded()).containsExactly("daily_sales");
        DetectionReport failed = response.getAnomalyTypes().get("product_day_on_day");
        assertThat(failed.getStatus()).isEqualTo(SectionStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("metric store unreachable");
        assertThat(failed.getErrorCode()).isEqualTo("DATA_UNAVAILABLE");
        assertThat(failed.getAnomalies()).isEmpty();
        assertThat(response.getSummary().getTotalAnomalies()).isEqualTo(1);
    }

    @Test
    void run_unexpectedException_becomesFailedSection() {
        statistical.respond(() -> {
            throw new IllegalStateException("boom");
        });

        DetectionResponse response = orchestrator.run(List.of(productOutliers), Duration.ofSeconds(5));

        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(response.getAnomalyTypes().get("product_outliers").getError())
                .contains("product_outliers").contains("boom");
    }

    @Test
    void run_slowSection_timesOutWithoutBlockingOthers() {
        timeSeries.respond(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return report(dailySales, 150.0);
        });

        DetectionResponse response = orchestrator.run(List.of(dailySales, productOutliers), Duration.ofMillis(200));

        assertThat(response.getAnomalyTypes().get("daily_sales").getStatus()).isEqualTo(SectionStatus.TIMED_OUT);
        assertThat(response.getAnomalyTypes().get("product_outliers").getStatus()).isEqualTo(SectionStatus.SUCCESS);
        assertThat(response.getSummary().getTimedOut()).containsExactly("daily_sales");
        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.PARTIAL);
    }

    @Test
    void run_secondRunIsServedFromCache() {
        DetectionResponse first = orchestrator.run(List.of(dailySales), Duration.ofSeconds(5));
        DetectionResponse second = orchestrator.run(List.of(dailySales), Duration.ofSeconds(5));

        assertThat(timeSeries.calls.get()).isEqualTo(1);
        DetectionReport cached = second.getAnomalyTypes().get("daily_sales");
        assertThat(cached.isCached()).isTrue();
        assertThat(cached.getComputedAt()).isEqualTo(first.getAnomalyTypes().get("daily_sales").getComputedAt());
        assertThat(cached.getAnomalies()).isEqualTo(first.getAnomalyTypes().get("daily_sales").getAnomalies());
        assertThat(cache.stats().getHits()).isEqualTo(1);
    }

    @Test
    void run_failedSectionsAreNotCached() {
        dayOnDay.respond(() -> {
            throw new DataUnavailableException("down");
        });

        orchestrator.run(List.of(productDayOnDay), Duration.ofSeconds(5));

        assertThat(cache.stats().getSets()).isZero();
    }

    @Test
    void run_cacheDisabled_alwaysRecomputes() {
        properties.getCache().setEnabled(false);

        orchestrator.run(List.of(dailySales), Duration.ofSeconds(5));
        orchestrator.run(List.of(dailySales), Duration.ofSeconds(5));

        assertThat(timeSeries.calls.get()).isEqualTo(2);
        assertThat(cache.stats().getSets()).isZero();
    }

    @Test
    void run_forecastConfigRunsOnForecastPool() {
        DetectionConfig forecast = timeSeriesConfig("sales_forecast",
                TimeSeriesParams.builder().mode(TimeSeriesMode.FORECAST).build());
        AtomicReference<String> thread = new AtomicReference<>();
        timeSeries.respond(() -> {
            thread.set(Thread.currentThread().getName());
            return report(forecast, 10.0);
        });

        orchestrator.run(List.of(forecast), Duration.ofSeconds(5));

        assertThat(thread.get()).isEqualTo("forecast-test");
    }

    @Test
    void detect_globallyDisabled_returnsDisabledWithoutRunning() {
        when(configSource.isDetectionEnabled()).thenReturn(false);

        DetectionResponse response = orchestrator.detect("all");

        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.DISABLED);
        assertThat(response.getAnomalyTypes()).isEmpty();
        verify(configSource, never()).resolve("all");
    }

    @Test
    void detect_resolvesMethodThroughConfigSource() {
        when(configSource.isDetectionEnabled()).thenReturn(true);
        when(configSource.resolve("statistical")).thenReturn(List.of(productOutliers));

        DetectionResponse response = orchestrator.detect("statistical");

        assertThat(response.getAnomalyTypes()).containsOnlyKeys("product_outliers");
    }

    @Test
    void run_noConfigs_isSuccessfulAndEmpty() {
        DetectionResponse response = orchestrator.run(List.of(), Duration.ofSeconds(1));

        assertThat(response.getSummary().getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(response.getSummary().getTotalAnomalies()).isZero();
    }

    private static final class StubDetector implements AnomalyDetector {
        private final DetectorKind kind;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Supplier<DetectionReport> response;

        StubDetector(DetectorKind kind) {
            this.kind = kind;
        }

        void respond(Supplier<DetectionReport> response) {
            this.response = response;
        }

        @Override
        public DetectorKind getSupportedKind() {
            return kind;
        }

        @Override
        public DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf) {
            calls.incrementAndGet();
            return response.get();
        }
    }
}
