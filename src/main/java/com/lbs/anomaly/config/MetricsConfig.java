package com.lbs.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSection(String detector, String status, long durationMs) {
        Counter.builder("detection.run.count")
                .tag("detector", detector)
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.duration")
                .tag("detector", detector)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordAnomaly(String detector, String severity) {
        Counter.builder("detection.anomaly.count")
                .tag("detector", detector)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordCacheResult(String result) {
        Counter.builder("detection.cache.count")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordSnapshot(String dimension, int groups) {
        Counter.builder("baseline.snapshot.groups")
                .tag("dimension", dimension)
                .register(registry)
                .increment(groups);
    }
}
