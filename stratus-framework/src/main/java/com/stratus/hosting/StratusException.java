package com.stratus.hosting;

/**
 * Base class of the failures raised by the framework itself.
 */
public class StratusException extends RuntimeException {

    public StratusException(String message) {
        super(message);
    }

    public StratusException(String message, Throwable cause) {
        super(message, cause);
    }
}
