package com.macroallocator.common.exception;

/**
 * Base of the allocator's failure taxonomy. Carries the name of the component that
 * raised it so log lines and error payloads can point at the failing stage.
 */
public class AllocatorException extends RuntimeException {
    private final String component;

    public AllocatorException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AllocatorException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
