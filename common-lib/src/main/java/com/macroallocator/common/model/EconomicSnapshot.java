package com.macroallocator.common.model;

/**
 * Macro indicators and the economic regime derived from them.
 *
 * @param recommendation posture the macro picture alone would suggest
 * @param fallback       true when at least one indicator is a fallback value
 */
public record EconomicSnapshot(
    double cpiYoyChange,
    double fedRate,
    double gdpGrowth,
    String label,
    String description,
    Regime recommendation,
    boolean fallback
) {
    public EconomicSnapshot withFallback(boolean fallback) {
        return new EconomicSnapshot(cpiYoyChange, fedRate, gdpGrowth, label, description,
            recommendation, fallback);
    }
}
