package com.macroallocator.common.model;

import java.util.List;

/**
 * Auxiliary headlines handed to the classifier.
 *
 * @param headlines  fetched headline titles, possibly empty
 * @param requested  whether a news fetch was attempted for this request
 * @param available  whether the fetch succeeded
 */
public record HeadlineBatch(List<String> headlines, boolean requested, boolean available) {

    public HeadlineBatch {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }

    public static HeadlineBatch notRequested() {
        return new HeadlineBatch(List.of(), false, false);
    }

    public static HeadlineBatch of(List<String> headlines) {
        return new HeadlineBatch(headlines, true, true);
    }

    public static HeadlineBatch unavailable() {
        return new HeadlineBatch(List.of(), true, false);
    }

    public boolean fellBack() {
        return requested && !available;
    }
}
