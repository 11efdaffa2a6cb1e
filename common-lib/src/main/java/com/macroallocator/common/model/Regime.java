package com.macroallocator.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse market posture derived from a narrative. Drives the sector tilt and the
 * optimizer's risk profile.
 */
public enum Regime {
    AGGRESSIVE,
    DEFENSIVE,
    NEUTRAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
