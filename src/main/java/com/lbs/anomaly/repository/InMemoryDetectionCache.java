package com.lbs.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbs.anomaly.model.CacheStats;
import com.lbs.anomaly.model.DetectionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local result cache. Reports are stored as JSON so a hit hands out an
 * independent copy, exactly as a remote backend would.
 */
@Repository
@ConditionalOnProperty(name = "detection.cache.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryDetectionCache implements DetectionCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDetectionCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public InMemoryDetectionCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<DetectionReport> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.expiresAt <= clock.millis()) {
            if (entry != null) entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        try {
            DetectionReport report = objectMapper.readValue(entry.json, DetectionReport.class);
            hits.incrementAndGet();
            return Optional.of(report);
        } catch (JsonProcessingException e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            entries.remove(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, DetectionReport report, int ttlSeconds) {
        try {
            entries.put(key, new Entry(objectMapper.writeValueAsString(report), clock.millis() + ttlSeconds * 1000L));
            sets.incrementAndGet();
        } catch (JsonProcessingException e) {
            errors.incrementAndGet();
            log.warn("Could not cache report {}: {}", key, e.getMessage());
        }
    }

    @Override
    public long clear(String detectorKey) {
        if (detectorKey == null) {
            long removed = entries.size();
            entries.clear();
            return removed;
        }
        String prefix = CacheKeys.prefix(detectorKey);
        long removed = entries.keySet().stream().filter(k -> k.startsWith(prefix)).count();
        entries.keySet().removeIf(k -> k.startsWith(prefix));
        return removed;
    }

    @Override
    public CacheStats stats() {
        return CacheKeys.stats("memory", hits.get(), misses.get(), sets.get(), errors.get());
    }

    private record Entry(String json, long expiresAt) {}
}
