package com.lbs.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbs.anomaly.config.AerospikeConfig;
import com.lbs.anomaly.exception.ComputationException;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.BaselineStats;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Daily baseline snapshots in the {@code daily_stats} set, one record per
 * (business date, dimension, metric) holding every dimension value's stats.
 */
@Repository
public class BaselineSnapshotRepository {

    private static final TypeReference<List<BaselineStats>> STATS_LIST = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public BaselineSnapshotRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(LocalDate date, String dimension, String metric, List<BaselineStats> stats) {
        try {
            client.put(writePolicy, key(date, dimension, metric),
                    new Bin("date", date.toString()),
                    new Bin("dimension", dimension),
                    new Bin("metric", metric),
                    new Bin("groups", stats.size()),
                    new Bin("stats", objectMapper.writeValueAsString(stats)),
                    new Bin("createdAt", System.currentTimeMillis()));
        } catch (JsonProcessingException e) {
            throw new ComputationException("Could not serialise baseline snapshot", e);
        } catch (AerospikeException e) {
            throw new DataUnavailableException("Failed to store baseline snapshot for " + date, e);
        }
    }

    public Optional<List<BaselineStats>> find(LocalDate date, String dimension, String metric) {
        try {
            Record record = client.get(readPolicy, key(date, dimension, metric));
            if (record == null) return Optional.empty();
            return Optional.of(objectMapper.readValue(record.getString("stats"), STATS_LIST));
        } catch (JsonProcessingException e) {
            throw new ComputationException("Stored baseline snapshot is unreadable", e);
        } catch (AerospikeException e) {
            throw new DataUnavailableException("Baseline store unavailable: " + e.getMessage(), e);
        }
    }

    private Key key(LocalDate date, String dimension, String metric) {
        return new Key(namespace, AerospikeConfig.SET_DAILY_STATS, date + ":" + dimension + ":" + metric);
    }
}
