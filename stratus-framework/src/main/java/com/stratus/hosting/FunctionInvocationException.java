package com.stratus.hosting;

import lombok.Getter;

/**
 * A function could not be resolved or started in the current host.
 */
@Getter
public class FunctionInvocationException extends StratusException {
    private final String functionName;

    public FunctionInvocationException(String functionName, String message) {
        super(message);
        this.functionName = functionName;
    }

    public FunctionInvocationException(String functionName, String message, Throwable cause) {
        super(message, cause);
        this.functionName = functionName;
    }
}
