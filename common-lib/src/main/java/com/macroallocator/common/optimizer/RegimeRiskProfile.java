package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.Regime;

/**
 * Risk preferences the optimizer applies under each regime.
 *
 * <pre>
 *   DEFENSIVE   λ = 4.0   volatility ceiling 18%
 *   NEUTRAL     λ = 2.0   volatility ceiling 25%
 *   AGGRESSIVE  λ = 0.5   volatility ceiling 40%
 * </pre>
 *
 * @param riskAversion      λ in the objective {@code w·μ − λ·wᵀΣw}
 * @param volatilityCeiling maximum annualized portfolio volatility of a feasible mix
 */
public record RegimeRiskProfile(double riskAversion, double volatilityCeiling) {

    public static final RegimeRiskProfile DEFENSIVE  = new RegimeRiskProfile(4.0, 0.18);
    public static final RegimeRiskProfile NEUTRAL    = new RegimeRiskProfile(2.0, 0.25);
    public static final RegimeRiskProfile AGGRESSIVE = new RegimeRiskProfile(0.5, 0.40);

    public RegimeRiskProfile {
        if (!(riskAversion > 0.0) || !(volatilityCeiling > 0.0)) {
            throw new IllegalArgumentException("riskAversion and volatilityCeiling must be positive");
        }
    }

    public static RegimeRiskProfile forRegime(Regime regime) {
        return switch (regime) {
            case DEFENSIVE  -> DEFENSIVE;
            case AGGRESSIVE -> AGGRESSIVE;
            case NEUTRAL    -> NEUTRAL;
        };
    }
}
