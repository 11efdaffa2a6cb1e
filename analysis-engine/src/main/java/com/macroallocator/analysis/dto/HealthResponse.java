package com.macroallocator.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * @param catalogLoadedAt null until the first universe load has finished
 */
public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("catalog_size") int catalogSize,
    @JsonProperty("synthetic_tickers") long syntheticTickers,
    @JsonProperty("catalog_loaded_at") Instant catalogLoadedAt,
    @JsonProperty("news_configured") boolean newsConfigured,
    @JsonProperty("economic_data_configured") boolean economicDataConfigured
) {}
