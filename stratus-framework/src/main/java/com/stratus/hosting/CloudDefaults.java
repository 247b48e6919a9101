package com.stratus.hosting;

import lombok.Getter;
import lombok.Setter;

/**
 * Application-wide defaults, the lowest layer of resource options.
 * Adjusted through {@link CloudApplicationBuilder#configureDefaults}.
 */
@Getter
@Setter
public class CloudDefaults {

    private String stackName = "stratus-app";
    private final Lambda lambda = new Lambda();
    private final DynamoDb dynamoDb = new DynamoDb();
    private final Local local = new Local();

    @Setter
    @Getter
    public static class Lambda {
        private int memoryMb = 256;
        private int timeoutSeconds = 30;
        private String runtime = "java17";
        // "com.acme.OrdersHandler::handleRequest"
        private String handler;
    }

    @Setter
    @Getter
    public static class DynamoDb {
        private String billingMode = "PAY_PER_REQUEST";
    }

    @Setter
    @Getter
    public static class Local {
        private int port = 8080;
    }
}
