package com.macroallocator.common.model;

import java.util.List;

/**
 * Output of the regime classifier for one request.
 *
 * @param regime     detected posture
 * @param sectors    favored sector tags; non-empty for every regime
 * @param reasoning  short explanation naming the rule and the detected signals
 * @param sentiment  blended sentiment in [0,1]
 * @param headlines  headlines that took part in scoring
 * @param synthetic  true when a requested news signal was unavailable and the text-only heuristic was used
 */
public record RegimeAssessment(
    Regime regime,
    List<String> sectors,
    String reasoning,
    double sentiment,
    List<String> headlines,
    boolean synthetic
) {
    public RegimeAssessment {
        sectors = List.copyOf(sectors);
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }
}
