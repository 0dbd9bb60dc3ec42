package com.lbs.anomaly.controller;

import com.lbs.anomaly.model.BaselineStats;
import com.lbs.anomaly.service.BaselineSnapshotService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BaselineController.class)
class BaselineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BaselineSnapshotService snapshotService;

    private static BaselineStats stats(String key, double sum) {
        return BaselineStats.builder()
                .dimensionValue(key)
                .metricName("SalesAmount")
                .timeWindow("2024-05-31..2024-06-29")
                .count(30)
                .sum(sum)
                .mean(sum / 30)
                .percentiles(Map.of("p50", sum / 30))
                .build();
    }

    @Test
    void getSnapshot_appliesLimit() throws Exception {
        LocalDate date = LocalDate.of(2024, 6, 29);
        when(snapshotService.getOrCompute(date, "ProductKey", "SalesAmount"))
                .thenReturn(List.of(stats("310", 9000), stats("345", 3000), stats("212", 300)));

        mockMvc.perform(get("/api/v1/baselines").param("date", "2024-06-29").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].dimensionValue").value("310"))
                .andExpect(jsonPath("$[0].percentiles.p50").value(300.0));
    }

    @Test
    void getSnapshot_badDate_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/baselines").param("date", "29/06/2024"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(snapshotService);
    }
}
