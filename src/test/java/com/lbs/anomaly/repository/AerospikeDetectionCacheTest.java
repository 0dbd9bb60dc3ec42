package com.lbs.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.lbs.anomaly.model.AnomalyRecord;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.Invocation;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.lbs.anomaly.testutil.TestDataFactory.anomaly;
import static com.lbs.anomaly.testutil.TestDataFactory.successReport;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AerospikeDetectionCacheTest {

    @Mock
    private AerospikeClient client;

    private AerospikeDetectionCache cache;

    @BeforeEach
    void setUp() {
        cache = new AerospikeDetectionCache(client, "test", new Policy(), new WritePolicy());
    }

    private Invocation lastPut() {
        return mockingDetails(client).getInvocations().stream()
                .filter(i -> i.getMethod().getName().equals("put"))
                .reduce((first, second) -> second)
                .orElseThrow();
    }

    private static Record cached(String cacheKey, String json) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("cacheKey", cacheKey);
        bins.put("report", json);
        return new Record(bins, 1, 0);
    }

    // ── put / get ──

    @Test
    void put_writesTtlAndJson_thenGetReadsItBack() {
        AnomalyRecord record = anomaly(DetectorKind.STATISTICAL, 80.0).severity(Severity.CRITICAL).build();
        DetectionReport report = successReport("product_outliers", DetectorKind.STATISTICAL, List.of(record));

        cache.put("anomaly:statistical:abc", report, 3600);

        Invocation put = lastPut();
        WritePolicy policy = (WritePolicy) put.getRawArguments()[0];
        Key key = (Key) put.getRawArguments()[1];
        Bin[] bins = (Bin[]) put.getRawArguments()[2];
        assertThat(policy.expiration).isEqualTo(3600);
        assertThat(key.setName).isEqualTo("detection_cache");
        assertThat(bins[0].value.toString()).isEqualTo("anomaly:statistical:abc");
        String json = bins[1].value.toString();

        when(client.get(any(Policy.class), any(Key.class))).thenReturn(cached("anomaly:statistical:abc", json));
        Optional<DetectionReport> hit = cache.get("anomaly:statistical:abc");

        assertThat(hit).isPresent();
        assertThat(hit.get().getAnomalies()).containsExactly(record);
        assertThat(hit.get().getComputedAt()).isEqualTo(report.getComputedAt());
        assertThat(cache.stats().getSets()).isEqualTo(1);
        assertThat(cache.stats().getHits()).isEqualTo(1);
    }

    @Test
    void get_missingRecord_isMiss() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(cache.get("anomaly:time_series:none")).isEmpty();
        assertThat(cache.stats().getMisses()).isEqualTo(1);
        assertThat(cache.stats().getErrors()).isZero();
    }

    // ── Degradation ──

    @Test
    void get_clusterFailure_degradesToMiss() {
        when(client.get(any(Policy.class), any(Key.class)))
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));

        assertThat(cache.get("anomaly:time_series:k")).isEmpty();
        assertThat(cache.stats().getMisses()).isEqualTo(1);
        assertThat(cache.stats().getErrors()).isEqualTo(1);
    }

    @Test
    void get_corruptJson_degradesToMiss() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(cached("anomaly:time_series:k", "{not json"));

        assertThat(cache.get("anomaly:time_series:k")).isEmpty();
        assertThat(cache.stats().getErrors()).isEqualTo(1);
    }

    @Test
    void put_clusterFailure_isSwallowedAndCounted() {
        doThrow(new AerospikeException(ResultCode.SERVER_NOT_AVAILABLE, "down"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        cache.put("anomaly:time_series:k", successReport("daily_sales", DetectorKind.TIME_SERIES, List.of()), 60);

        assertThat(cache.stats().getSets()).isZero();
        assertThat(cache.stats().getErrors()).isEqualTo(1);
    }

    // ── clear ──

    @Test
    void clear_byDetectorKind_deletesOnlyMatchingEntries() {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(new Key("test", "detection_cache", "a"), cached(CacheKeys.prefix("time_series") + "1", "{}"));
            callback.scanCallback(new Key("test", "detection_cache", "b"), cached(CacheKeys.prefix("statistical") + "2", "{}"));
            callback.scanCallback(new Key("test", "detection_cache", "c"), cached(CacheKeys.prefix("time_series") + "3", "{}"));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("detection_cache"), any(ScanCallback.class));
        when(client.delete(any(WritePolicy.class), any(Key.class))).thenReturn(true);

        assertThat(cache.clear("time_series")).isEqualTo(2);
    }

    @Test
    void stats_reportsBackendName() {
        assertThat(cache.stats().getBackend()).isEqualTo("aerospike");
        assertThat(cache.stats().getHitRatePct()).isZero();
    }
}
