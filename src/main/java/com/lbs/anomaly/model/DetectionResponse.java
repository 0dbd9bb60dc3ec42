package com.lbs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Reports of one detection run, keyed by detector name")
public class DetectionResponse {

    @Schema(description = "Epoch millis when the run was assembled", example = "1717430400000")
    private long timestamp;

    private RunSummary summary;

    @Builder.Default
    private Map<String, DetectionReport> anomalyTypes = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Run level outcome")
    public static class RunSummary {

        @Schema(example = "12")
        private int totalAnomalies;

        @Schema(description = "Number of detector sections in the run", example = "6")
        private int detectionMethods;

        @Schema(example = "PARTIAL")
        private RunStatus status;

        private List<String> succeeded;
        private List<String> failed;
        private List<String> timedOut;

        private Map<Severity, Integer> bySeverity;
    }
}
