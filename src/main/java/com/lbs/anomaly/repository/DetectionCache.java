package com.lbs.anomaly.repository;

import com.lbs.anomaly.model.CacheStats;
import com.lbs.anomaly.model.DetectionReport;

import java.util.Optional;

/**
 * Result cache for detector sections. Implementations are best-effort: a backend failure
 * is counted and reported as a miss, never thrown to the caller.
 */
public interface DetectionCache {

    Optional<DetectionReport> get(String key);

    void put(String key, DetectionReport report, int ttlSeconds);

    /** Removes every entry, or only those of one detector kind when {@code detectorKey} is set. */
    long clear(String detectorKey);

    CacheStats stats();
}
