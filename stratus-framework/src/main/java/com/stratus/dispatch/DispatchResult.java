package com.stratus.dispatch;

import lombok.Value;

import java.util.Map;

/**
 * Status and JSON body ready to be written by a transport.
 */
@Value
public class DispatchResult {
    public static final Map<String, String> HEADERS = Map.of("Content-Type", "application/json");

    /** Reported when the caller went away before the pipeline finished; never written to anyone. */
    public static final int CLIENT_CLOSED = 499;

    int statusCode;
    String body;

    public Map<String, String> getHeaders() {
        return HEADERS;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
