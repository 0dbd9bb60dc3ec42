package com.lbs.anomaly.controller;

import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.*;
import com.lbs.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.lbs.anomaly.testutil.TestDataFactory.anomaly;
import static com.lbs.anomaly.testutil.TestDataFactory.successReport;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    private static DetectionResponse response(RunStatus status, DetectionReport... reports) {
        Map<String, DetectionReport> sections = new LinkedHashMap<>();
        for (DetectionReport report : reports) sections.put(report.getDetectorName(), report);
        return DetectionResponse.builder()
                .timestamp(1_717_430_400_000L)
                .summary(DetectionResponse.RunSummary.builder()
                        .status(status)
                        .detectionMethods(reports.length)
                        .totalAnomalies(1)
                        .succeeded(List.of("daily_sales"))
                        .failed(List.of())
                        .timedOut(List.of())
                        .build())
                .anomalyTypes(sections)
                .build();
    }

    // ── Run all ──

    @Test
    void detectAll_defaultMethod_returnsSectionsByName() throws Exception {
        AnomalyRecord spike = anomaly(DetectorKind.TIME_SERIES, 150.0).severity(Severity.CRITICAL).build();
        when(detectionService.detect("all")).thenReturn(response(RunStatus.SUCCESS,
                successReport("daily_sales", DetectorKind.TIME_SERIES, List.of(spike))));

        mockMvc.perform(get("/api/v1/anomalies/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.status").value("SUCCESS"))
                .andExpect(jsonPath("$.anomalyTypes.daily_sales.status").value("SUCCESS"))
                .andExpect(jsonPath("$.anomalyTypes.daily_sales.anomalies[0].severity").value("CRITICAL"))
                .andExpect(jsonPath("$.anomalyTypes.daily_sales.anomalies[0].dimensionLabel").value("Road-150 Red, 62"))
                .andExpect(jsonPath("$.anomalyTypes.daily_sales.anomalies[0].bounds").doesNotExist());
    }

    @Test
    void detectAll_unknownMethod_returns400WithDetails() throws Exception {
        when(detectionService.detect("neural")).thenThrow(new ConfigurationException("Unknown detection method 'neural'"));

        mockMvc.perform(get("/api/v1/anomalies/all").param("method", "neural"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIGURATION_ERROR"))
                .andExpect(jsonPath("$.details[0]").value("Unknown detection method 'neural'"));
    }

    // ── Configured detector ──

    @Test
    void runConfigured_unknownName_returns404() throws Exception {
        when(detectionService.runConfigured("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/anomalies/configs/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    void runConfigured_failedSection_isStill200() throws Exception {
        when(detectionService.runConfigured("sales_forecast")).thenReturn(Optional.of(
                DetectionReport.failed("sales_forecast", DetectorKind.TIME_SERIES, "Forecast needs at least 14 days of data", 1L)));

        mockMvc.perform(get("/api/v1/anomalies/configs/sales_forecast"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.error").value("Forecast needs at least 14 days of data"))
                .andExpect(jsonPath("$.anomalies").isEmpty());
    }

    // ── Ad-hoc detectors ──

    @Test
    void timeSeries_passesParametersThrough() throws Exception {
        when(detectionService.timeSeries(any(), any(), anyInt(), anyInt(), anyDouble(), anyMap()))
                .thenReturn(successReport("adhoc_time_series", DetectorKind.TIME_SERIES, List.of()));

        mockMvc.perform(get("/api/v1/anomalies/time-series")
                        .param("granularity", "weekly")
                        .param("lookbackDays", "180")
                        .param("windowSize", "4")
                        .param("filter", "category=Bikes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detectorName").value("adhoc_time_series"));

        verify(detectionService).timeSeries("SalesAmount", "weekly", 180, 4, 2.0, Map.of("category", "Bikes"));
    }

    @Test
    void timeSeries_windowBelowTwo_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/time-series").param("windowSize", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(detectionService);
    }

    @Test
    void statistical_nonNumericLookback_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/statistical").param("lookbackDays", "a-year"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void statistical_storeDown_returns503() throws Exception {
        when(detectionService.statistical(any(), any(), any(), anyInt(), anyDouble(), anyLong(), anyDouble(), anyMap()))
                .thenThrow(new DataUnavailableException("Metric store unavailable"));

        mockMvc.perform(get("/api/v1/anomalies/statistical"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("DATA_UNAVAILABLE"));
    }

    @Test
    void comparative_defaultsToYearOverYear() throws Exception {
        when(detectionService.comparative(any(), any(), anyDouble(), anyDouble(), anyInt(), anyMap()))
                .thenReturn(successReport("adhoc_comparative", DetectorKind.COMPARATIVE, List.of()));

        mockMvc.perform(get("/api/v1/anomalies/comparative"))
                .andExpect(status().isOk());

        verify(detectionService).comparative("SalesAmount", "yoy", 20.0, 0.0, 1095, Map.of());
    }

    @Test
    void forecast_intervalWidthOutOfRange_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/forecast").param("intervalWidth", "1.5"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void dayOnDay_passesFiltersAndAdditionalColumns() throws Exception {
        AnomalyRecord record = anomaly(DetectorKind.DAY_ON_DAY, 60.0)
                .additionalColumns(Map.of("category", "Bikes"))
                .build();
        when(detectionService.dayOnDay(any(), any(), anyDouble(), anyInt(), anyInt(), anyMap(), anyList()))
                .thenReturn(successReport("adhoc_day_on_day", DetectorKind.DAY_ON_DAY, List.of(record)));

        mockMvc.perform(get("/api/v1/anomalies/day-on-day")
                        .param("topN", "10")
                        .param("filter", "category=Bikes|Clothing", "SalesTerritoryKey=4")
                        .param("additionalColumn", "category"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalies[0].additionalColumns.category").value("Bikes"));

        verify(detectionService).dayOnDay("ProductKey", "SalesAmount", 20.0, 30, 10,
                Map.of("category", "Bikes|Clothing", "SalesTerritoryKey", "4"), List.of("category"));
    }

    @Test
    void dayOnDay_malformedFilter_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/day-on-day").param("filter", "category"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIGURATION_ERROR"));
    }

    @Test
    void filters_rejectsMissingValue() {
        assertThat(AnomalyController.filters(null)).isEmpty();
        assertThat(AnomalyController.filters(List.of(" region = Europe "))).containsEntry("region", "Europe");
        assertThatThrownBy(() -> AnomalyController.filters(List.of("region=")))
                .isInstanceOf(ConfigurationException.class);
    }
}
