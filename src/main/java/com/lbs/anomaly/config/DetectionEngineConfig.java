package com.lbs.anomaly.config;

import com.lbs.anomaly.engine.classify.AnomalyNarrator;
import com.lbs.anomaly.engine.classify.SeverityClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DetectionEngineConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService detectionExecutor(DetectionProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecution().getPoolSize(), daemonThreads("detector"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService forecastExecutor(DetectionProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecution().getForecastPoolSize(), daemonThreads("forecast"));
    }

    @Bean
    public SeverityClassifier severityClassifier(PropertiesDetectionConfigSource configSource, AnomalyNarrator narrator) {
        return new SeverityClassifier(configSource.getSeverityDefaults(), configSource.getSeverityOverrides(),
                configSource.getSeverityRules(), narrator);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
