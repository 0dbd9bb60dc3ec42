package com.lbs.anomaly.service;

import com.lbs.anomaly.config.DetectionConfigSource;
import com.lbs.anomaly.engine.DetectionOrchestrator;
import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.model.*;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.lbs.anomaly.testutil.TestDataFactory.dayOnDayConfig;
import static com.lbs.anomaly.testutil.TestDataFactory.successReport;
import static com.lbs.anomaly.testutil.TestDataFactory.timeSeriesConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @Mock private DetectionOrchestrator orchestrator;
    @Mock private DetectionConfigSource configSource;

    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyDetectionService(orchestrator, configSource);
    }

    private static DetectionResponse responseWith(DetectionReport report) {
        Map<String, DetectionReport> sections = new LinkedHashMap<>();
        sections.put(report.getDetectorName(), report);
        return DetectionResponse.builder().anomalyTypes(sections).build();
    }

    @SuppressWarnings("unchecked")
    private DetectionConfig capturedConfig() {
        ArgumentCaptor<List<DetectionConfig>> captor = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).run(captor.capture(), eq(TIMEOUT));
        return captor.getValue().get(0);
    }

    @Test
    void detect_delegatesToOrchestrator() {
        DetectionResponse expected = DetectionResponse.builder().timestamp(1L).build();
        when(orchestrator.detect("comparative")).thenReturn(expected);

        assertThat(service.detect("comparative")).isSameAs(expected);
    }

    @Test
    void timeSeries_buildsAdHocMovingAverageConfig() {
        DetectionReport report = successReport("adhoc_time_series", DetectorKind.TIME_SERIES, List.of());
        when(orchestrator.defaultTimeout()).thenReturn(TIMEOUT);
        when(orchestrator.run(anyList(), eq(TIMEOUT))).thenReturn(responseWith(report));

        DetectionReport result = service.timeSeries("SalesAmount", "weekly", 180, 4, 2.5, Map.of("category", "Bikes"));

        assertThat(result).isSameAs(report);
        DetectionConfig config = capturedConfig();
        assertThat(config.getName()).isEqualTo("adhoc_time_series");
        assertThat(config.timeSeriesParams().getGranularity()).isEqualTo(Granularity.WEEKLY);
        assertThat(config.timeSeriesParams().getWindowSize()).isEqualTo(4);
        assertThat(config.getFilters()).containsEntry("category", "Bikes");
    }

    @Test
    void forecast_buildsForecastModeConfig() {
        DetectionReport report = successReport("adhoc_forecast", DetectorKind.TIME_SERIES, List.of());
        when(orchestrator.defaultTimeout()).thenReturn(TIMEOUT);
        when(orchestrator.run(anyList(), eq(TIMEOUT))).thenReturn(responseWith(report));

        service.forecast("SalesAmount", 365, 14, 0.9, Map.of());

        DetectionConfig config = capturedConfig();
        assertThat(config.isForecast()).isTrue();
        assertThat(config.timeSeriesParams().getForecastDays()).isEqualTo(14);
        assertThat(config.timeSeriesParams().hasYearlySeasonality()).isTrue();
    }

    @Test
    void statistical_unknownMethod_isRejectedBeforeRunning() {
        assertThatThrownBy(() -> service.statistical("ProductKey", "SalesAmount", "autoencoder", 365, 3.0, 5, 0.1, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("autoencoder");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void dayOnDay_invalidTopN_isRejectedBeforeRunning() {
        assertThatThrownBy(() -> service.dayOnDay("ProductKey", "SalesAmount", 20, 30, 0, Map.of(), List.of()))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getProblems()).anySatisfy(p -> assertThat(p).contains("top_n")));
        verify(orchestrator, never()).run(anyList(), any());
    }

    @Test
    void comparative_parsesComparisonTypeCaseInsensitively() {
        DetectionReport report = successReport("adhoc_comparative", DetectorKind.COMPARATIVE, List.of());
        when(orchestrator.defaultTimeout()).thenReturn(TIMEOUT);
        when(orchestrator.run(anyList(), eq(TIMEOUT))).thenReturn(responseWith(report));

        service.comparative("SalesAmount", "QoQ", 15, 0, 730, Map.of());

        assertThat(capturedConfig().comparativeParams().getComparisonType()).isEqualTo(ComparisonType.QOQ);
    }

    @Test
    void runConfigured_unknownName_returnsEmpty() {
        when(configSource.findByName("ghost")).thenReturn(Optional.empty());

        assertThat(service.runConfigured("ghost")).isEmpty();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void runConfigured_disabled_throws() {
        DetectionConfig disabled = dayOnDayConfig("bike_day_on_day", DayOnDayParams.builder().build())
                .toBuilder().enabled(false).build();
        when(configSource.findByName("bike_day_on_day")).thenReturn(Optional.of(disabled));

        assertThatThrownBy(() -> service.runConfigured("bike_day_on_day"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("disabled");
    }

    @Test
    void runConfigured_returnsSectionOfThatDetector() {
        DetectionConfig daily = timeSeriesConfig("daily_sales", TimeSeriesParams.builder().build());
        DetectionReport report = successReport("daily_sales", DetectorKind.TIME_SERIES, List.of());
        when(configSource.findByName("daily_sales")).thenReturn(Optional.of(daily));
        when(orchestrator.defaultTimeout()).thenReturn(TIMEOUT);
        when(orchestrator.run(List.of(daily), TIMEOUT)).thenReturn(responseWith(report));

        assertThat(service.runConfigured("daily_sales")).contains(report);
    }
}
