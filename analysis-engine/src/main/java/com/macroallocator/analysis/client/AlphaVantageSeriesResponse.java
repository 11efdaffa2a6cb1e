package com.macroallocator.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Alpha Vantage economic-indicator payload ({@code CPI}, {@code FEDERAL_FUNDS_RATE},
 * {@code REAL_GDP}). Observations arrive newest first; missing values are reported as ".".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageSeriesResponse(
    @JsonProperty("name") String name,
    @JsonProperty("interval") String interval,
    @JsonProperty("unit") String unit,
    @JsonProperty("data") List<Observation> data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Observation(
        @JsonProperty("date") String date,
        @JsonProperty("value") String value
    ) {
        public OptionalDouble numericValue() {
            if (value == null) return OptionalDouble.empty();
            try {
                double v = Double.parseDouble(value.trim());
                return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
    }

    /** Numeric observations only, newest first. */
    public List<Double> values() {
        if (data == null) return List.of();
        return data.stream()
            .map(Observation::numericValue)
            .filter(OptionalDouble::isPresent)
            .map(OptionalDouble::getAsDouble)
            .toList();
    }
}
