package com.lbs.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbs.anomaly.config.AerospikeConfig;
import com.lbs.anomaly.model.CacheStats;
import com.lbs.anomaly.model.DetectionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Result cache in the {@code detection_cache} set. Record TTL carries the expiry, so stale
 * entries disappear server-side. Any Aerospike failure degrades to a miss.
 */
@Repository
@ConditionalOnProperty(name = "detection.cache.backend", havingValue = "aerospike")
public class AerospikeDetectionCache implements DetectionCache {

    private static final Logger log = LoggerFactory.getLogger(AerospikeDetectionCache.class);

    private static final String BIN_KEY = "cacheKey";
    private static final String BIN_JSON = "report";

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public AerospikeDetectionCache(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<DetectionReport> get(String key) {
        try {
            Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_DETECTION_CACHE, key));
            if (record == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            DetectionReport report = objectMapper.readValue(record.getString(BIN_JSON), DetectionReport.class);
            hits.incrementAndGet();
            return Optional.of(report);
        } catch (AerospikeException | JsonProcessingException e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, DetectionReport report, int ttlSeconds) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = ttlSeconds;
        try {
            client.put(policy, new Key(namespace, AerospikeConfig.SET_DETECTION_CACHE, key),
                    new Bin(BIN_KEY, key),
                    new Bin(BIN_JSON, objectMapper.writeValueAsString(report)));
            sets.incrementAndGet();
        } catch (AerospikeException | JsonProcessingException e) {
            errors.incrementAndGet();
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public long clear(String detectorKey) {
        String prefix = detectorKey == null ? "anomaly:" : CacheKeys.prefix(detectorKey);
        AtomicLong removed = new AtomicLong();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_CACHE, (key, record) -> {
                String cacheKey = record.getString(BIN_KEY);
                if (cacheKey != null && cacheKey.startsWith(prefix) && client.delete(writePolicy, key)) {
                    removed.incrementAndGet();
                }
            });
        } catch (AerospikeException e) {
            errors.incrementAndGet();
            log.warn("Cache clear failed after {} deletions: {}", removed.get(), e.getMessage());
        }
        return removed.get();
    }

    @Override
    public CacheStats stats() {
        return CacheKeys.stats("aerospike", hits.get(), misses.get(), sets.get(), errors.get());
    }
}
