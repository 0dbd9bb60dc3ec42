package com.lbs.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of one detector invocation")
public class DetectionReport {

    @Schema(description = "Detector configuration name", example = "daily_sales")
    private String detectorName;

    @Schema(example = "TIME_SERIES")
    private DetectorKind detectorKind;

    @Schema(description = "Concrete method used", example = "moving_average")
    private String method;

    @Schema(example = "SUCCESS")
    private SectionStatus status;

    @Schema(description = "Failure message for FAILED or TIMED_OUT sections")
    private String error;

    @Schema(description = "Error code of the failure, e.g. DATA_UNAVAILABLE", example = "DATA_UNAVAILABLE")
    private String errorCode;

    @Builder.Default
    private List<AnomalyRecord> anomalies = new ArrayList<>();

    private ReportSummary summary;

    @Schema(description = "Method specific statistics")
    @Builder.Default
    private Map<String, Object> statistics = new LinkedHashMap<>();

    @Schema(description = "Forward predictions; forecast mode only")
    private List<ForecastPoint> futureForecast;

    @Schema(description = "Chart feed: the analysed series or comparison pairs")
    private List<Map<String, Object>> seriesData;

    @Schema(description = "Epoch millis when the report was computed; preserved on cache hits", example = "1717430400000")
    private long computedAt;

    @Schema(description = "True when served from the result cache")
    private boolean cached;

    @JsonIgnore
    public boolean isSuccessful() {
        return status == SectionStatus.SUCCESS;
    }

    public static DetectionReport failed(String detectorName, DetectorKind kind, String error, long now) {
        return failed(detectorName, kind, error, null, now);
    }

    public static DetectionReport failed(String detectorName, DetectorKind kind, String error, String errorCode,
                                         long now) {
        return DetectionReport.builder()
                .detectorName(detectorName)
                .detectorKind(kind)
                .status(SectionStatus.FAILED)
                .error(error)
                .errorCode(errorCode)
                .summary(ReportSummary.empty())
                .computedAt(now)
                .build();
    }

    public static DetectionReport timedOut(String detectorName, DetectorKind kind, long timeoutMs, long now) {
        return DetectionReport.builder()
                .detectorName(detectorName)
                .detectorKind(kind)
                .status(SectionStatus.TIMED_OUT)
                .error("Detector did not finish within " + timeoutMs + " ms")
                .errorCode("TIMED_OUT")
                .summary(ReportSummary.empty())
                .computedAt(now)
                .build();
    }
}
