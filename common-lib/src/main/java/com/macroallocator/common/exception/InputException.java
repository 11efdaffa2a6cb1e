package com.macroallocator.common.exception;

/**
 * The caller supplied a narrative or indicator that cannot be analyzed.
 * Surfaced to the caller; the request is aborted before any data fetch.
 */
public class InputException extends AllocatorException {

    private final String reason;

    public InputException(String component, String reason) {
        super(component, reason);
        this.reason = reason;
    }

    /** Message without the component prefix, safe to return to the caller. */
    public String getReason() {
        return reason;
    }
}
