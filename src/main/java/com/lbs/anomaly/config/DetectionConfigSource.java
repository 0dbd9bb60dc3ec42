package com.lbs.anomaly.config;

import com.lbs.anomaly.model.DetectionConfig;

import java.util.List;
import java.util.Optional;

/** Supplies the validated detector configurations of this process. */
public interface DetectionConfigSource {

    boolean isDetectionEnabled();

    /** Every configured detector in declaration order, enabled or not. */
    List<DetectionConfig> getConfigs();

    List<DetectionConfig> getEnabledConfigs();

    Optional<DetectionConfig> findByName(String name);

    /**
     * Resolves a method selector: {@code all}, a detector kind key ({@code time_series},
     * {@code statistical}, ...), {@code forecast}, or a configuration name.
     *
     * @throws com.lbs.anomaly.exception.ConfigurationException when nothing matches
     */
    List<DetectionConfig> resolve(String method);
}
