package com.stratus.api;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH;

    /**
     * GET and DELETE bind from route captures and query parameters, everything else from the body.
     */
    public boolean bindsFromRoute() {
        return this == GET || this == DELETE;
    }
}
