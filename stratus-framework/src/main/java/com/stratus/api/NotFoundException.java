package com.stratus.api;

/**
 * Raised by function code when the requested resource does not exist.
 * Dispatchers answer it with 404 and the exception message.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
