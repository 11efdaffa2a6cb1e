package com.macroallocator.common.exception;

public class InternalException extends AllocatorException {

    public InternalException(String component, String message) {
        super(component, message);
    }

    public InternalException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
