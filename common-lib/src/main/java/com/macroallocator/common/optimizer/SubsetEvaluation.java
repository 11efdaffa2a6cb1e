package com.macroallocator.common.optimizer;

import java.util.Arrays;

/**
 * Optimal weights and scores of one candidate subset.
 *
 * <p>{@code members} and {@code weights} are parallel; members carrying a pruned weight
 * are already removed, so {@code members} may be shorter than the subset that was
 * evaluated. {@code key} is the comma-joined sorted symbol list of the members.
 */
public record SubsetEvaluation(
    int[] members,
    double[] weights,
    double expectedReturn,
    double volatility,
    double objective,
    boolean feasible,
    String key
) {
    public int cardinality() {
        return members.length;
    }

    @Override
    public String toString() {
        return "SubsetEvaluation{key=" + key + ", weights=" + Arrays.toString(weights)
            + ", objective=" + objective + ", volatility=" + volatility + ", feasible=" + feasible + '}';
    }
}
