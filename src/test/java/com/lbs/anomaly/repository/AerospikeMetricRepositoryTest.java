package com.lbs.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.model.DimensionAggregate;
import com.lbs.anomaly.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class AerospikeMetricRepositoryTest {

    private static final LocalDate START = LocalDate.of(2024, 6, 1);
    private static final LocalDate END = LocalDate.of(2024, 6, 30);

    @Mock
    private AerospikeClient client;

    private AerospikeMetricRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AerospikeMetricRepository(client, "test", new WritePolicy(), new ScanPolicy());
    }

    private static Record fact(String date, String product, String category, Object sales, long orders) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("ProductKey", product);
        attrs.put("ProductKey_label", "Product " + product);
        attrs.put("category", category);
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("SalesAmount", sales);
        Map<String, Object> bins = new HashMap<>();
        bins.put("date", date);
        bins.put("attrs", attrs);
        bins.put("metrics", metrics);
        bins.put("orders", orders);
        return new Record(bins, 1, 0);
    }

    private void givenFacts(Record... records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (int i = 0; i < records.length; i++) {
                callback.scanCallback(new Key("test", "metric_points", "f" + i), records[i]);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("metric_points"), any(ScanCallback.class));
    }

    @Test
    void fetchSeries_groupsByDimensionAndKeepsWindow() {
        givenFacts(
                fact("2024-06-10", "310", "Bikes", 1200.5, 2L),
                fact("2024-05-31", "310", "Bikes", 999.0, 1L),
                fact("2024-06-30", "345", "Clothing", 80L, 1L));

        List<MetricPoint> points = repository.fetchSeries("ProductKey", "SalesAmount", START, END, Map.of());

        assertThat(points).hasSize(2);
        MetricPoint bike = points.stream().filter(p -> p.dimensionKey().equals("310")).findFirst().orElseThrow();
        assertThat(bike.dimensionLabel()).isEqualTo("Product 310");
        assertThat(bike.value()).isEqualTo(1200.5);
        assertThat(bike.orderCount()).isEqualTo(2L);
        assertThat(bike.attribute("category")).isEqualTo("Bikes");
        assertThat(points).extracting(MetricPoint::value).contains(80.0);
    }

    @Test
    void fetchSeries_withoutDimension_usesWholeSeriesKey() {
        givenFacts(fact("2024-06-10", "310", "Bikes", 100.0, 1L));

        List<MetricPoint> points = repository.fetchSeries(null, "SalesAmount", START, END, Map.of());

        assertThat(points).singleElement()
                .satisfies(p -> assertThat(p.dimensionKey()).isEqualTo(AerospikeMetricRepository.WHOLE_SERIES_KEY));
    }

    @Test
    void fetchSeries_appliesFiltersAndSkipsBadRows() {
        givenFacts(
                fact("2024-06-10", "310", "Bikes", 100.0, 1L),
                fact("2024-06-11", "500", "Accessories", 100.0, 1L),
                fact("not-a-date", "310", "Bikes", 100.0, 1L),
                fact("2024-06-12", "310", "Bikes", Double.NaN, 1L),
                fact("2024-06-13", "310", "Bikes", "n/a", 1L));

        List<MetricPoint> points = repository.fetchSeries("ProductKey", "SalesAmount", START, END,
                Map.of("category", "Bikes"));

        assertThat(points).extracting(MetricPoint::timePeriod).containsExactly(LocalDate.of(2024, 6, 10));
    }

    @Test
    void fetchAggregate_sumsPerDimensionValue() {
        givenFacts(
                fact("2024-06-10", "310", "Bikes", 100.0, 1L),
                fact("2024-06-11", "310", "Bikes", 150.0, 3L),
                fact("2024-06-11", "345", "Clothing", 40.0, 1L));

        Map<String, DimensionAggregate> aggregates =
                repository.fetchAggregate("ProductKey", "SalesAmount", START, END, Map.of());

        assertThat(aggregates).containsOnlyKeys("310", "345");
        DimensionAggregate bike = aggregates.get("310");
        assertThat(bike.total()).isEqualTo(250.0);
        assertThat(bike.observationCount()).isEqualTo(2);
        assertThat(bike.orderCount()).isEqualTo(4);
        assertThat(bike.dimensionLabel()).isEqualTo("Product 310");
    }

    @Test
    void fetchSeries_storeFailure_raisesDataUnavailable() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "scan timed out"))
                .when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("metric_points"), any(ScanCallback.class));

        assertThatThrownBy(() -> repository.fetchSeries(null, "SalesAmount", START, END, Map.of()))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("Metric store unavailable");
    }
}
