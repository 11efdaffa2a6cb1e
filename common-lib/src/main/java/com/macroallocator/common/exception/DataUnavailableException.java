package com.macroallocator.common.exception;

/**
 * An upstream market, news or macro source could not be reached after all retries.
 * Always recovered locally by a synthetic or fallback value.
 */
public class DataUnavailableException extends AllocatorException {

    public DataUnavailableException(String component, String message) {
        super(component, message);
    }

    public DataUnavailableException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
