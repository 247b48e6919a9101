package com.stratus.runtime.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.stratus.hosting.CloudApplication;
import com.stratus.hosting.CloudApplicationBuilder;
import lombok.extern.slf4j.Slf4j;

/**
 * Lambda entry point. Subclass it, register the application in
 * {@link #configure(CloudApplicationBuilder)} and point the deployed handler
 * at the subclass:
 *
 * <pre>
 * public class OrdersHandler extends StratusRequestHandler {
 *     protected void configure(CloudApplicationBuilder builder) {
 *         builder.addFunctions(CreateOrder.class).addTables(Order.class);
 *     }
 * }
 * </pre>
 *
 * The application is built once, in the constructor, during the Lambda init
 * phase. {@code configure} therefore runs before subclass fields are set.
 */
@Slf4j
public abstract class StratusRequestHandler implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {
    private final LambdaDispatcher dispatcher;

    protected StratusRequestHandler() {
        CloudApplicationBuilder builder = CloudApplication.createBuilder(new String[0]);
        configure(builder);
        CloudApplication application = builder.build();
        this.dispatcher = LambdaDispatcher.create(application.getContext(), application.getModules());
    }

    protected abstract void configure(CloudApplicationBuilder builder);

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        log.debug("Request {} for {}", context == null ? "-" : context.getAwsRequestId(),
                dispatcher.getFunction().getName());
        return dispatcher.handle(event);
    }
}
