package com.macroallocator.common.model;

import java.util.List;

/**
 * Everything one analysis request produced. Built once per request and never mutated.
 */
public record AnalysisResult(
    RegimeAssessment assessment,
    PortfolioSelection selection,
    RiskMetrics risk,
    List<Ticker> candidates,
    EconomicSnapshot economic
) {
    public AnalysisResult {
        candidates = List.copyOf(candidates);
    }

    /** True when the classifier or any candidate series had to fall back to synthetic data. */
    public boolean synthetic() {
        return assessment.synthetic() || candidates.stream().anyMatch(Ticker::synthetic);
    }
}
