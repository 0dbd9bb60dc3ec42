package com.lbs.anomaly.config;

import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.model.ComparisonType;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.Granularity;
import com.lbs.anomaly.model.Severity;
import com.lbs.anomaly.model.SeverityRule;
import com.lbs.anomaly.model.SeverityThresholds;
import com.lbs.anomaly.model.StatisticalMethod;
import com.lbs.anomaly.model.TimeSeriesMode;
import com.lbs.anomaly.model.params.ComparativeParams;
import com.lbs.anomaly.model.params.DayOnDayParams;
import com.lbs.anomaly.model.params.StatisticalParams;
import com.lbs.anomaly.model.params.TimeSeriesParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts {@link DetectionProperties} into typed {@link DetectionConfig}s once, at startup.
 * Every problem found is collected and reported together in a single {@link ConfigurationException}.
 */
@Component
public class PropertiesDetectionConfigSource implements DetectionConfigSource {

    private static final Logger log = LoggerFactory.getLogger(PropertiesDetectionConfigSource.class);

    private final boolean detectionEnabled;
    private final List<DetectionConfig> configs;
    private final SeverityThresholds severityDefaults;
    private final Map<DetectorKind, SeverityThresholds> severityOverrides;
    private final List<SeverityRule> severityRules;

    public PropertiesDetectionConfigSource(DetectionProperties properties) {
        List<String> problems = new ArrayList<>();
        List<DetectionConfig> parsed = new ArrayList<>();

        properties.getTimeSeries().forEach(s -> parsed.add(timeSeries(s, problems)));
        properties.getStatistical().forEach(s -> parsed.add(statistical(s, problems)));
        properties.getComparative().forEach(s -> parsed.add(comparative(s, problems)));
        properties.getDayOnDay().forEach(s -> parsed.add(dayOnDay(s, problems)));

        Set<String> names = new HashSet<>();
        for (DetectionConfig config : parsed) {
            problems.addAll(DetectionConfigValidator.problems(config));
            if (config.getName() != null && !names.add(config.getName())) {
                problems.add("duplicate detector name '" + config.getName() + "'");
            }
        }

        this.severityDefaults = thresholds(properties.getSeverity());
        this.severityOverrides = overrides(properties.getSeverity(), severityDefaults, problems);
        this.severityRules = rules(properties.getCustomRules(), names, problems);

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        this.detectionEnabled = properties.isEnabled();
        this.configs = List.copyOf(parsed);

        long enabled = configs.stream().filter(DetectionConfig::isEnabled).count();
        log.info("Loaded {} detector configurations ({} enabled), {} custom severity rules",
                configs.size(), enabled, severityRules.size());
        if (!detectionEnabled) {
            log.warn("Anomaly detection is globally disabled");
        } else if (enabled == 0) {
            log.warn("No detector is enabled; detection runs will be empty");
        }
        for (DetectionConfig config : configs) {
            if (config.isForecast() && config.getParams().getLookbackDays() < TimeSeriesParams.MIN_FORECAST_LOOKBACK_DAYS) {
                log.warn("Forecast detector '{}' has lookback_days {} and will fail with insufficient data",
                        config.getName(), config.getParams().getLookbackDays());
            }
        }
    }

    @Override
    public boolean isDetectionEnabled() {
        return detectionEnabled;
    }

    @Override
    public List<DetectionConfig> getConfigs() {
        return configs;
    }

    @Override
    public List<DetectionConfig> getEnabledConfigs() {
        return configs.stream().filter(DetectionConfig::isEnabled).toList();
    }

    @Override
    public Optional<DetectionConfig> findByName(String name) {
        return configs.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    @Override
    public List<DetectionConfig> resolve(String method) {
        String selector = method == null ? "all" : method.trim();
        if (selector.equalsIgnoreCase("all")) {
            return getEnabledConfigs();
        }
        Optional<DetectionConfig> named = findByName(selector);
        if (named.isPresent()) {
            if (!named.get().isEnabled()) {
                throw new ConfigurationException("Detector '" + selector + "' is disabled");
            }
            return List.of(named.get());
        }
        if (selector.equalsIgnoreCase("forecast") || selector.equalsIgnoreCase("prophet")) {
            return getEnabledConfigs().stream().filter(DetectionConfig::isForecast).toList();
        }
        DetectorKind kind = DetectorKind.fromKey(selector);
        if (kind == null) {
            throw new ConfigurationException("Unknown detection method '" + selector + "'");
        }
        return getEnabledConfigs().stream().filter(c -> c.getKind() == kind).toList();
    }

    public SeverityThresholds getSeverityDefaults() {
        return severityDefaults;
    }

    public Map<DetectorKind, SeverityThresholds> getSeverityOverrides() {
        return Collections.unmodifiableMap(severityOverrides);
    }

    public List<SeverityRule> getSeverityRules() {
        return severityRules;
    }

    // --- conversion ---

    private DetectionConfig.DetectionConfigBuilder base(DetectionProperties.DetectorSettings s, DetectorKind kind) {
        return DetectionConfig.builder()
                .name(s.getName())
                .kind(kind)
                .enabled(s.isEnabled())
                .dimension(s.getDimension())
                .metric(s.getMetric())
                .filters(Map.copyOf(s.getFilters()))
                .additionalColumns(List.copyOf(s.getAdditionalColumns()));
    }

    private DetectionConfig timeSeries(DetectionProperties.TimeSeriesSettings s, List<String> problems) {
        TimeSeriesMode mode = "prophet".equalsIgnoreCase(s.getMode())
                ? TimeSeriesMode.FORECAST
                : parse(TimeSeriesMode.class, s.getMode(), s.getName(), "mode", problems);
        return base(s, DetectorKind.TIME_SERIES)
                .params(TimeSeriesParams.builder()
                        .mode(mode == null ? TimeSeriesMode.MOVING_AVERAGE : mode)
                        .granularity(orDefault(parse(Granularity.class, s.getGranularity(), s.getName(),
                                "granularity", problems), Granularity.DAILY))
                        .lookbackDays(s.getLookbackDays())
                        .windowSize(s.getWindowSize())
                        .thresholdStd(s.getThresholdStd())
                        .forecastDays(s.getForecastDays())
                        .intervalWidth(s.getIntervalWidth())
                        .build())
                .build();
    }

    private DetectionConfig statistical(DetectionProperties.StatisticalSettings s, List<String> problems) {
        return base(s, DetectorKind.STATISTICAL)
                .params(StatisticalParams.builder()
                        .method(orDefault(parse(StatisticalMethod.class, s.getMethod(), s.getName(),
                                "method", problems), StatisticalMethod.ZSCORE))
                        .lookbackDays(s.getLookbackDays())
                        .threshold(s.getThreshold())
                        .iqrMultiplier(s.getIqrMultiplier())
                        .minTransactions(s.getMinTransactions())
                        .minSampleSize(s.getMinSampleSize())
                        .contamination(s.getContamination())
                        .numTrees(s.getNumTrees())
                        .sampleSize(s.getSampleSize())
                        .seed(s.getSeed())
                        .minGroups(s.getMinGroups())
                        .useOrderCountFeature(s.isUseOrderCountFeature())
                        .build())
                .build();
    }

    private DetectionConfig comparative(DetectionProperties.ComparativeSettings s, List<String> problems) {
        return base(s, DetectorKind.COMPARATIVE)
                .params(ComparativeParams.builder()
                        .comparisonType(orDefault(parse(ComparisonType.class, s.getComparisonType(), s.getName(),
                                "comparison_type", problems), ComparisonType.YOY))
                        .thresholdPct(s.getThresholdPct())
                        .minValue(s.getMinValue())
                        .lookbackDays(s.getLookbackDays())
                        .build())
                .build();
    }

    private DetectionConfig dayOnDay(DetectionProperties.DayOnDaySettings s, List<String> problems) {
        return base(s, DetectorKind.DAY_ON_DAY)
                .params(DayOnDayParams.builder()
                        .thresholdPct(s.getThresholdPct())
                        .lookbackDays(s.getLookbackDays())
                        .topN(s.getTopN())
                        .zeroBaselineCapPct(s.getZeroBaselineCapPct())
                        .build())
                .build();
    }

    private static SeverityThresholds thresholds(DetectionProperties.Severity s) {
        return SeverityThresholds.builder()
                .criticalPct(s.getCriticalPct())
                .highPct(s.getHighPct())
                .highZ(s.getHighZ())
                .mediumPct(s.getMediumPct())
                .lowTierEnabled(s.isLowTierEnabled())
                .build();
    }

    private static Map<DetectorKind, SeverityThresholds> overrides(DetectionProperties.Severity s,
                                                                  SeverityThresholds defaults,
                                                                  List<String> problems) {
        Map<DetectorKind, SeverityThresholds> result = new EnumMap<>(DetectorKind.class);
        s.getOverrides().forEach((key, o) -> {
            DetectorKind kind = DetectorKind.fromKey(key);
            if (kind == null) {
                problems.add("severity override for unknown detector kind '" + key + "'");
                return;
            }
            SeverityThresholds.SeverityThresholdsBuilder b = defaults.toBuilder();
            if (o.getCriticalPct() != null) b.criticalPct(o.getCriticalPct());
            if (o.getHighPct() != null) b.highPct(o.getHighPct());
            if (o.getHighZ() != null) b.highZ(o.getHighZ());
            if (o.getMediumPct() != null) b.mediumPct(o.getMediumPct());
            if (o.getLowTierEnabled() != null) b.lowTierEnabled(o.getLowTierEnabled());
            result.put(kind, b.build());
        });
        return result;
    }

    private static List<SeverityRule> rules(List<DetectionProperties.CustomRuleSettings> settings,
                                            Set<String> detectorNames, List<String> problems) {
        List<SeverityRule> rules = new ArrayList<>();
        for (DetectionProperties.CustomRuleSettings s : settings) {
            if (!s.isEnabled()) continue;
            Severity severity = parse(Severity.class, s.getSeverity(), s.getName(), "severity", problems);
            DetectorKind kind = null;
            String detectorName = null;
            if (s.getDetector() != null) {
                kind = DetectorKind.fromKey(s.getDetector());
                if (kind == null) {
                    if (detectorNames.contains(s.getDetector())) {
                        detectorName = s.getDetector();
                    } else {
                        problems.add("custom rule '" + s.getName() + "': unknown detector '" + s.getDetector() + "'");
                    }
                }
            }
            if (severity != null) {
                rules.add(SeverityRule.builder()
                        .name(s.getName())
                        .detectorKind(kind)
                        .detectorName(detectorName)
                        .dimensionValue(s.getDimensionValue())
                        .minAbsDeviationPct(s.getMinAbsDeviationPct())
                        .severity(severity)
                        .build());
            }
        }
        return List.copyOf(rules);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String owner, String field,
                                               List<String> problems) {
        if (value == null) return null;
        try {
            return EnumSettings.parse(type, value, field);
        } catch (ConfigurationException e) {
            problems.add("'" + owner + "': " + e.getMessage());
            return null;
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
