package com.lbs.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lbs.anomaly.exception.ComputationException;
import com.lbs.anomaly.model.CacheStats;
import com.lbs.anomaly.model.DetectionConfig;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * Cache keys have the form {@code anomaly:<kind>:<md5>} where the digest covers the detector
 * name, every parameter and the as-of date, serialised with sorted keys.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CacheKeys() {}

    public static String of(DetectionConfig config, LocalDate asOf) {
        try {
            String canonical = CANONICAL.writeValueAsString(config) + "|" + asOf;
            String digest = DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
            return prefix(config.getKind().key()) + digest;
        } catch (JsonProcessingException e) {
            throw new ComputationException("Could not build cache key for '" + config.getName() + "'", e);
        }
    }

    public static String prefix(String detectorKey) {
        return "anomaly:" + detectorKey + ":";
    }

    static CacheStats stats(String backend, long hits, long misses, long sets, long errors) {
        long lookups = hits + misses;
        return CacheStats.builder()
                .backend(backend)
                .hits(hits)
                .misses(misses)
                .sets(sets)
                .errors(errors)
                .hitRatePct(lookups == 0 ? 0.0 : Math.round(hits * 10000.0 / lookups) / 100.0)
                .build();
    }
}
