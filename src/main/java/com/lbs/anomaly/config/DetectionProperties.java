package com.lbs.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw detector settings bound from {@code detection.*}. Enum-valued fields stay strings here;
 * {@link PropertiesDetectionConfigSource} parses and validates them once at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    // Master switch for every detector.
    private boolean enabled = true;

    private List<TimeSeriesSettings> timeSeries = new ArrayList<>();
    private List<StatisticalSettings> statistical = new ArrayList<>();
    private List<ComparativeSettings> comparative = new ArrayList<>();
    private List<DayOnDaySettings> dayOnDay = new ArrayList<>();

    // Explicit severity overrides, first match wins.
    private List<CustomRuleSettings> customRules = new ArrayList<>();

    private Severity severity = new Severity();
    private Cache cache = new Cache();
    private Execution execution = new Execution();
    private Snapshot snapshot = new Snapshot();

    @Data
    public abstract static class DetectorSettings {
        private String name;
        private boolean enabled = true;
        private String dimension;
        private String metric = "SalesAmount";
        private Map<String, String> filters = new LinkedHashMap<>();
        private List<String> additionalColumns = new ArrayList<>();
    }

    @Data
    public static class TimeSeriesSettings extends DetectorSettings {
        private String mode = "moving_average";
        private String granularity = "daily";
        private int lookbackDays = 90;
        private int windowSize = 7;
        private double thresholdStd = 2.0;
        private int forecastDays = 30;
        private double intervalWidth = 0.95;
    }

    @Data
    public static class StatisticalSettings extends DetectorSettings {
        private String method = "zscore";
        private int lookbackDays = 365;
        private double threshold = 3.0;
        private double iqrMultiplier = 1.5;
        private long minTransactions = 5;
        private int minSampleSize = 3;
        private double contamination = 0.1;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
        private int minGroups = 10;
        // adds the order count as a second isolation-forest feature
        private boolean useOrderCountFeature = true;
    }

    @Data
    public static class ComparativeSettings extends DetectorSettings {
        private String comparisonType = "yoy";
        private double thresholdPct = 20.0;
        private double minValue = 0.0;
        private int lookbackDays = 1095;
    }

    @Data
    public static class DayOnDaySettings extends DetectorSettings {
        private double thresholdPct = 20.0;
        private int lookbackDays = 30;
        private int topN = 50;
        private double zeroBaselineCapPct = 1000.0;
    }

    @Data
    public static class CustomRuleSettings {
        private String name;
        private boolean enabled = true;
        private String detector;           // detector kind or configuration name
        private String dimensionValue;
        private double minAbsDeviationPct = 0.0;
        private String severity = "critical";
    }

    @Data
    public static class Severity {
        private double criticalPct = 100.0;
        private double highPct = 50.0;
        private double highZ = 4.0;
        private double mediumPct = 30.0;
        private boolean lowTierEnabled = false;

        // Keyed by detector kind (time_series, statistical, comparative, day_on_day).
        private Map<String, SeverityOverride> overrides = new HashMap<>();
    }

    @Data
    public static class SeverityOverride {
        private Double criticalPct;
        private Double highPct;
        private Double highZ;
        private Double mediumPct;
        private Boolean lowTierEnabled;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int ttlSeconds = 3600;
        private String backend = "memory";   // aerospike | memory
    }

    @Data
    public static class Execution {
        private int poolSize = 4;
        // Forecast fits are CPU heavy and get their own bounded pool.
        private int forecastPoolSize = 1;
        private long timeoutMs = 30000;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = false;
        private String cron = "0 30 2 * * *";
        private List<String> dimensions = new ArrayList<>(List.of("ProductKey", "SalesTerritoryKey"));
        private String metric = "SalesAmount";
        private int minSampleSize = 2;
    }
}
