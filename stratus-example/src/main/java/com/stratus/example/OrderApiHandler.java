package com.stratus.example;

import com.stratus.hosting.CloudApplicationBuilder;
import com.stratus.runtime.lambda.StratusRequestHandler;

/**
 * Lambda handler for every Order API function; {@code STRATUS_FUNCTION}
 * selects which one a deployed instance serves.
 */
public class OrderApiHandler extends StratusRequestHandler {

    @Override
    protected void configure(CloudApplicationBuilder builder) {
        OrderApi.configure(builder);
    }
}
