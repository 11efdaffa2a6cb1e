package com.macroallocator.common.exception;

/**
 * The exact solver ran past its time budget. The optimizer recovers by switching
 * to the approximate solver.
 */
public class OptimizationTimeoutException extends AllocatorException {

    private final long evaluatedSubsets;

    public OptimizationTimeoutException(String component, long evaluatedSubsets) {
        super(component, "time budget exhausted after " + evaluatedSubsets + " subsets");
        this.evaluatedSubsets = evaluatedSubsets;
    }

    public long getEvaluatedSubsets() {
        return evaluatedSubsets;
    }
}
