package com.macroallocator.common.classifier;

import java.util.List;

/**
 * Signals extracted from one narrative, evaluated by the {@link RegimeRule} table.
 *
 * @param sentiment   blended sentiment score in [0,1]
 * @param riskOffHits risk-off keywords found in the narrative, lexicon order
 * @param riskOnHits  risk-on keywords found in the narrative, lexicon order
 */
public record NarrativeSignals(double sentiment, List<String> riskOffHits, List<String> riskOnHits) {

    public NarrativeSignals {
        riskOffHits = List.copyOf(riskOffHits);
        riskOnHits = List.copyOf(riskOnHits);
    }

    public boolean hasRiskOff() {
        return !riskOffHits.isEmpty();
    }

    public boolean hasRiskOn() {
        return !riskOnHits.isEmpty();
    }
}
