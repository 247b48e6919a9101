package com.stratus.binding;

/**
 * The request could not be turned into the function's request type.
 * Reported to the client as a 400.
 */
public class BindingException extends RuntimeException {

    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
