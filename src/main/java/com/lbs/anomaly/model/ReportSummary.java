package com.lbs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counts over the anomalies of one detector section")
public class ReportSummary {

    @Schema(example = "7")
    private int total;

    @Schema(description = "Upward anomalies (spikes and increases)", example = "5")
    private int spikeCount;

    @Schema(description = "Downward anomalies (drops and decreases)", example = "2")
    private int dropCount;

    private Map<Severity, Integer> bySeverity;

    public static ReportSummary of(List<AnomalyRecord> anomalies) {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        int spikes = 0;
        for (AnomalyRecord record : anomalies) {
            if (record.getKind() != null && record.getKind().isUpward()) spikes++;
            if (record.getSeverity() != null) bySeverity.merge(record.getSeverity(), 1, Integer::sum);
        }
        return ReportSummary.builder()
                .total(anomalies.size())
                .spikeCount(spikes)
                .dropCount(anomalies.size() - spikes)
                .bySeverity(bySeverity)
                .build();
    }

    public static ReportSummary empty() {
        return of(List.of());
    }
}
