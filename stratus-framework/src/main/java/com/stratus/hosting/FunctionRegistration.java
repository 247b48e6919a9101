package com.stratus.hosting;

import com.stratus.api.HttpMethod;
import lombok.Builder;
import lombok.Value;

import java.lang.reflect.Type;

/**
 * An HTTP function found by discovery or registered explicitly, with its
 * resource options already resolved.
 */
@Value
@Builder(toBuilder = true)
public class FunctionRegistration {
    Class<?> functionType;
    Type requestType;
    Type responseType;
    HttpMethod method;
    String route;
    int memoryMb;
    int timeoutSeconds;

    /**
     * Simple type name. Also the value of {@code STRATUS_FUNCTION} for the
     * Lambda that hosts this function.
     */
    public String getName() {
        return functionType.getSimpleName();
    }
}
