package com.stratus.api;

import io.vertx.core.Future;

/**
 * HTTP-triggered function. Routed by the {@link HttpApi} annotation on the implementing class.
 *
 * @param <Q> request shape, bound from the route, query string or JSON body
 * @param <R> response shape, serialized as camelCase JSON
 */
public interface HttpFunction<Q, R> extends CloudFunction {

    /**
     * Handles one request. Fail the future (or throw) with {@link NotFoundException}
     * to answer 404; any other failure answers 500.
     */
    Future<R> handle(Q request);
}
