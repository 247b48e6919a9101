package com.stratus.binding;

import lombok.Value;

import java.util.Map;

/**
 * Transport-neutral view of an incoming HTTP request. Query parameters carry
 * only the first value of a repeated name.
 */
@Value
public class FunctionRequest {
    Map<String, String> pathParameters;
    Map<String, String> queryParameters;
    String body;

    public FunctionRequest(Map<String, String> pathParameters, Map<String, String> queryParameters, String body) {
        this.pathParameters = pathParameters == null ? Map.of() : pathParameters;
        this.queryParameters = queryParameters == null ? Map.of() : queryParameters;
        this.body = body;
    }
}
