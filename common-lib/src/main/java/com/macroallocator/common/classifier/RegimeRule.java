package com.macroallocator.common.classifier;

import com.macroallocator.common.model.Regime;

import java.util.function.Predicate;

/**
 * One row of the classifier's ordered rule table.
 *
 * @param name      stable identifier quoted in the reasoning text
 * @param condition predicate over the extracted signals
 * @param regime    regime assigned when {@code condition} holds
 */
public record RegimeRule(String name, Predicate<NarrativeSignals> condition, Regime regime) {

    public boolean matches(NarrativeSignals signals) {
        return condition.test(signals);
    }
}
