package com.stratus.hosting;

/**
 * Service-loader entry point that makes a runtime available for an execution
 * mode. Implementations are listed in
 * {@code META-INF/services/com.stratus.hosting.RuntimeProvider}.
 */
public interface RuntimeProvider {

    ExecutionMode mode();

    StratusRuntime create();
}
