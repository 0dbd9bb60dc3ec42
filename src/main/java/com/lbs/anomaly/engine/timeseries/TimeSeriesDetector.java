package com.lbs.anomaly.engine.timeseries;

import com.lbs.anomaly.engine.AnomalyDetector;
import com.lbs.anomaly.engine.stats.BaselineCalculator;
import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.exception.InsufficientDataException;
import com.lbs.anomaly.model.AnomalyKind;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.BaselineStats;
import com.lbs.anomaly.model.Bounds;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.ForecastPoint;
import com.lbs.anomaly.model.MetricPoint;
import com.lbs.anomaly.model.SectionStatus;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import com.lbs.anomaly.repository.MetricDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flags points of one metric series that leave their expected band.
 *
 * <p>Moving-average mode: the window of {@code windowSize} periods ends at the point under test;
 * the band is built from the {@code windowSize - 1} periods before it, so the first
 * {@code windowSize - 1} periods are never judged. Forecast mode fits {@link SeasonalTrendModel}
 * on daily totals and flags actuals outside the prediction interval.
 */
@Component
public class TimeSeriesDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesDetector.class);

    private static final String WHOLE_SERIES = "all";

    @Override
    public DetectorKind getSupportedKind() {
        return DetectorKind.TIME_SERIES;
    }

    @Override
    public DetectionReport detect(DetectionConfig config, MetricDataSource dataSource, LocalDate asOf) {
        TimeSeriesParams params = config.timeSeriesParams();
        if (params.isForecast() && params.getLookbackDays() < TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS) {
            throw new InsufficientDataException("Forecast needs a lookback of at least "
                    + TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS + " days",
                    params.getLookbackDays(), TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS);
        }
        if (!params.isForecast() && params.getWindowSize() < 2) {
            throw new ConfigurationException("window_size must be at least 2 for '" + config.getName() + "'");
        }
        if (!params.isForecast() && params.getLookbackDays() < params.getWindowSize()) {
            throw new InsufficientDataException("Lookback is shorter than the moving window",
                    params.getLookbackDays(), params.getWindowSize());
        }

        LocalDate start = asOf.minusDays(params.getLookbackDays());
        // a week or month still in progress would read as a drop
        LocalDate end = params.isForecast() ? asOf : params.getGranularity().lastCompleteDay(asOf);
        List<MetricPoint> points = dataSource.fetchSeries(config.getDimension(), config.getMetric(),
                start, end, config.getFilters());
        TreeMap<LocalDate, PeriodTotal> series = bucket(points, params);

        return params.isForecast()
                ? forecast(config, params, series)
                : movingAverage(config, params, series);
    }

    /** Moving-average pass over an already bucketed series. */
    public DetectionReport movingAverage(DetectionConfig config, TimeSeriesParams params,
                                         TreeMap<LocalDate, PeriodTotal> series) {
        List<LocalDate> periods = new ArrayList<>(series.keySet());
        double[] values = series.values().stream().mapToDouble(PeriodTotal::value).toArray();
        int window = params.getWindowSize();
        double k = params.getThresholdStd();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<Map<String, Object>> chart = new ArrayList<>();

        for (int i = 0; i < values.length; i++) {
            Map<String, Object> row = chartRow(periods.get(i), values[i], series.get(periods.get(i)).orders());
            chart.add(row);
            if (i < window - 1) continue;

            double[] preceding = Arrays.copyOfRange(values, i - window + 1, i);
            BaselineStats baseline = BaselineCalculator.compute(preceding, 1);
            double ma = baseline.getMean();
            double sd = baseline.getStddev();
            Bounds bounds = new Bounds(ma - k * sd, ma + k * sd);
            boolean flagged = bounds.isAbove(values[i]) || bounds.isBelow(values[i]);

            row.put("moving_average", ma);
            row.put("lower_bound", bounds.lower());
            row.put("upper_bound", bounds.upper());
            row.put("is_anomaly", flagged);

            if (flagged) {
                anomalies.add(record(config, periods.get(i), values[i], series.get(periods.get(i)).orders(), ma, bounds)
                        .zscore(sd > 0 ? (values[i] - ma) / sd : null)
                        .build());
            }
        }

        BaselineStats overall = BaselineCalculator.compute(values, 1);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mode", "moving_average");
        stats.put("granularity", params.getGranularity().name().toLowerCase(Locale.ROOT));
        stats.put("lookback_days", params.getLookbackDays());
        stats.put("window_size", window);
        stats.put("threshold_std", k);
        stats.put("total_periods", values.length);
        stats.put("evaluated_periods", Math.max(0, values.length - (window - 1)));
        stats.put("anomaly_count", anomalies.size());
        stats.put("mean_value", overall.getMean());
        stats.put("std_dev", overall.getStddev());
        stats.put("min_value", overall.getMin());
        stats.put("max_value", overall.getMax());

        if (values.length < window) {
            log.debug("Series for '{}' has {} periods, fewer than window {}; nothing evaluated",
                    config.getName(), values.length, window);
        }

        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(DetectorKind.TIME_SERIES)
                .method("moving_average")
                .status(SectionStatus.SUCCESS)
                .anomalies(anomalies)
                .statistics(stats)
                .seriesData(chart)
                .build();
    }

    /** Forecast pass over a daily series. */
    public DetectionReport forecast(DetectionConfig config, TimeSeriesParams params,
                                    TreeMap<LocalDate, PeriodTotal> series) {
        if (series.size() < TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS) {
            throw new InsufficientDataException("Forecast needs at least "
                    + TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS + " days of data",
                    series.size(), TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS);
        }
        List<LocalDate> dates = new ArrayList<>(series.keySet());
        double[] values = series.values().stream().mapToDouble(PeriodTotal::value).toArray();
        SeasonalTrendModel model = SeasonalTrendModel.fit(dates, values,
                params.hasYearlySeasonality(), params.getIntervalWidth());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<Map<String, Object>> chart = new ArrayList<>();
        double deviationSum = 0;
        int spikes = 0;

        for (int i = 0; i < values.length; i++) {
            LocalDate date = dates.get(i);
            SeasonalTrendModel.Prediction p = model.predict(date);
            // A perfect fit leaves sigma at rounding level; ignore differences of that size.
            double tolerance = 1e-9 * Math.max(1.0, Math.abs(p.yhat()));
            Bounds bounds = new Bounds(p.lower() - tolerance, p.upper() + tolerance);
            boolean flagged = !bounds.contains(values[i]);

            Map<String, Object> row = chartRow(date, values[i], series.get(date).orders());
            row.put("forecast", p.yhat());
            row.put("lower_bound", p.lower());
            row.put("upper_bound", p.upper());
            row.put("trend", p.trend());
            row.put("is_anomaly", flagged);
            chart.add(row);

            if (flagged) {
                AnomalyRecord anomaly = record(config, date, values[i], series.get(date).orders(), p.yhat(),
                        new Bounds(p.lower(), p.upper()))
                        .zscore(model.getSigma() > 0 ? (values[i] - p.yhat()) / model.getSigma() : null)
                        .trend(p.trend())
                        .build();
                anomalies.add(anomaly);
                deviationSum += anomaly.absoluteDeviationPct();
                if (anomaly.getKind().isUpward()) spikes++;
            }
        }

        List<ForecastPoint> future = new ArrayList<>();
        LocalDate last = dates.get(dates.size() - 1);
        for (int d = 1; d <= params.getForecastDays(); d++) {
            LocalDate date = last.plusDays(d);
            SeasonalTrendModel.Prediction p = model.predict(date);
            future.add(new ForecastPoint(date.toString(), p.yhat(), p.lower(), p.upper(), p.trend()));
        }

        List<String> components = new ArrayList<>();
        components.add("trend");
        if (model.hasWeeklySeasonality()) components.add("weekly");
        if (model.hasYearlySeasonality()) components.add("yearly");

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mode", "forecast");
        stats.put("lookback_days", params.getLookbackDays());
        stats.put("total_days_analyzed", values.length);
        stats.put("anomaly_count", anomalies.size());
        stats.put("anomaly_rate_pct", values.length == 0 ? 0.0 : anomalies.size() * 100.0 / values.length);
        stats.put("spike_count", spikes);
        stats.put("drop_count", anomalies.size() - spikes);
        stats.put("avg_abs_deviation_pct", anomalies.isEmpty() ? 0.0 : deviationSum / anomalies.size());
        stats.put("model_components", components);
        stats.put("confidence_interval", Math.round(params.getIntervalWidth() * 100) + "%");
        stats.put("residual_std", model.getSigma());
        stats.put("forecast_days", params.getForecastDays());

        return DetectionReport.builder()
                .detectorName(config.getName())
                .detectorKind(DetectorKind.TIME_SERIES)
                .method("forecast")
                .status(SectionStatus.SUCCESS)
                .anomalies(anomalies)
                .statistics(stats)
                .futureForecast(future)
                .seriesData(chart)
                .build();
    }

    /** Sums valid points per bucket; forecast mode always works on days. */
    public static TreeMap<LocalDate, PeriodTotal> bucket(List<MetricPoint> points, TimeSeriesParams params) {
        TreeMap<LocalDate, PeriodTotal> series = new TreeMap<>();
        for (MetricPoint point : points) {
            if (!point.isValid()) continue;
            LocalDate key = params.isForecast() ? point.timePeriod() : params.getGranularity().bucket(point.timePeriod());
            series.merge(key, new PeriodTotal(point.value(), point.orderCount()), PeriodTotal::plus);
        }
        return series;
    }

    private AnomalyRecord.AnomalyRecordBuilder record(DetectionConfig config, LocalDate period, double value,
                                                      long orders, double expected, Bounds bounds) {
        double signed = value - expected;
        return AnomalyRecord.builder()
                .detectorSource(config.getName())
                .detectorKind(DetectorKind.TIME_SERIES)
                .timePeriod(period.toString())
                .dimensionName(config.getDimension() == null ? "total" : config.getDimension())
                .dimensionValue(WHOLE_SERIES)
                .metricName(config.getMetric())
                .metricValue(value)
                .expectedValue(expected)
                .bounds(bounds)
                .deviationPct(expected != 0 ? signed / Math.abs(expected) * 100.0 : null)
                .kind(AnomalyKind.ofDeviation(signed))
                .orderCount(orders);
    }

    private static Map<String, Object> chartRow(LocalDate period, double value, long orders) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("period", period.toString());
        row.put("value", value);
        row.put("order_count", orders);
        row.put("is_anomaly", false);
        return row;
    }

    public record PeriodTotal(double value, long orders) {
        PeriodTotal plus(PeriodTotal other) {
            return new PeriodTotal(value + other.value, orders + other.orders);
        }
    }
}
