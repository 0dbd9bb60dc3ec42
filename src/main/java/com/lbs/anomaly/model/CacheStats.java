package com.lbs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Detection result cache statistics")
public class CacheStats {

    @Schema(example = "aerospike", allowableValues = {"aerospike", "memory"})
    private String backend;

    private long hits;
    private long misses;
    private long sets;

    @Schema(description = "Operations that failed against the backend and degraded to a miss")
    private long errors;

    @Schema(example = "62.5")
    private double hitRatePct;
}
