package com.stratus.hosting;

import lombok.Data;

/**
 * Explicit per-function overrides. Unset values fall through to
 * {@link com.stratus.api.FunctionConfig} and then to {@link CloudDefaults}.
 */
@Data
public class FunctionOptions {
    private Integer memoryMb;
    private Integer timeoutSeconds;
}
