package com.macroallocator.analysis.client;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface for per-ticker price history. The live implementation reads the
 * Yahoo chart API; tests substitute their own.
 */
public interface MarketDataProvider {

    /**
     * @return roughly one year of daily closing prices, oldest first; errors with
     *         {@link com.macroallocator.common.exception.DataUnavailableException} when the
     *         upstream has no usable data
     */
    Mono<List<Double>> dailyCloses(String symbol);
}
