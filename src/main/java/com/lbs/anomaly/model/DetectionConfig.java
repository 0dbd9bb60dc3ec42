package com.lbs.anomaly.model;

import com.lbs.anomaly.model.params.ComparativeParams;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.DetectorParams;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One validated detector instance. The {@link #kind} decides which params type is carried;
 * the typed accessors fail fast when the pairing is wrong.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Validated configuration of one detector instance")
public class DetectionConfig {

    @Schema(example = "product_day_on_day")
    String name;

    @Schema(example = "DAY_ON_DAY")
    DetectorKind kind;

    @Builder.Default
    boolean enabled = true;

    @Schema(description = "Dimension the metric is grouped by; empty for whole-series detectors", example = "ProductKey")
    String dimension;

    @Schema(example = "SalesAmount")
    String metric;

    @Builder.Default
    Map<String, String> filters = Map.of();

    @Builder.Default
    List<String> additionalColumns = List.of();

    DetectorParams params;

    public TimeSeriesParams timeSeriesParams() {
        return cast(DetectorKind.TIME_SERIES, TimeSeriesParams.class);
    }

    public StatisticalParams statisticalParams() {
        return cast(DetectorKind.STATISTICAL, StatisticalParams.class);
    }

    public ComparativeParams comparativeParams() {
        return cast(DetectorKind.COMPARATIVE, ComparativeParams.class);
    }

    public DayOnDayParams dayOnDayParams() {
        return cast(DetectorKind.DAY_ON_DAY, DayOnDayParams.class);
    }

    /** True for configurations that run on the isolated forecast pool. */
    public boolean isForecast() {
        return kind == DetectorKind.TIME_SERIES && params instanceof TimeSeriesParams ts && ts.isForecast();
    }

    private <T extends DetectorParams> T cast(DetectorKind expected, Class<T> type) {
        if (kind != expected || !type.isInstance(params)) {
            throw new IllegalStateException("Detector '" + name + "' of kind " + kind
                    + " does not carry " + type.getSimpleName());
        }
        return type.cast(params);
    }
}
