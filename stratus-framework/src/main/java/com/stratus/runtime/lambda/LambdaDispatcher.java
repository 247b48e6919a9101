package com.stratus.runtime.lambda;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.stratus.binding.FunctionRequest;
import com.stratus.binding.JsonMappers;
import com.stratus.dispatch.DispatchResult;
import com.stratus.dispatch.FunctionInvoker;
import com.stratus.hosting.CloudApplicationContext;
import com.stratus.hosting.FunctionInvocationException;
import com.stratus.hosting.FunctionRegistration;
import com.stratus.table.DynamoDbTableModule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Serves API Gateway HTTP events for the one function this Lambda was
 * deployed for, named by {@code STRATUS_FUNCTION}.
 */
@Slf4j
public class LambdaDispatcher {
    public static final String FUNCTION_VARIABLE = "STRATUS_FUNCTION";

    @Getter
    private final FunctionRegistration function;
    private final FunctionInvoker invoker;

    LambdaDispatcher(FunctionRegistration function, FunctionInvoker invoker) {
        this.function = function;
        this.invoker = invoker;
    }

    public static LambdaDispatcher create(CloudApplicationContext context, List<Module> modules) {
        return create(context, modules, new DynamoDbTableModule(context.getTables(), context.getEnvironment()));
    }

    /**
     * @throws FunctionInvocationException when {@code STRATUS_FUNCTION} is unset or names no known function
     */
    public static LambdaDispatcher create(CloudApplicationContext context, List<Module> modules, Module tableModule) {
        FunctionRegistration function = resolveFunction(context);

        List<Module> allModules = new ArrayList<>(modules);
        allModules.add(tableModule);
        Injector injector = Guice.createInjector(allModules);

        log.info("Lambda host ready for {} {} -> {}", function.getMethod(), function.getRoute(), function.getName());
        return new LambdaDispatcher(function, new FunctionInvoker(injector, JsonMappers.create()));
    }

    static FunctionRegistration resolveFunction(CloudApplicationContext context) {
        String name = context.getEnvironment().get(FUNCTION_VARIABLE);
        if (name == null || name.isBlank()) {
            throw new FunctionInvocationException(null, FUNCTION_VARIABLE
                    + " environment variable is not set. This Lambda was not deployed by the Stratus deploy pipeline.");
        }
        return context.getFunctions().stream()
                .filter(candidate -> candidate.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new FunctionInvocationException(name, "Function '" + name
                        + "' was not found among the discovered functions."));
    }

    public APIGatewayV2HTTPResponse handle(APIGatewayV2HTTPEvent event) {
        FunctionRequest request = new FunctionRequest(
                event.getPathParameters(),
                event.getQueryStringParameters(),
                decodeBody(event));

        DispatchResult result = invoker.invoke(function, request)
                .toCompletionStage()
                .toCompletableFuture()
                .join();

        return APIGatewayV2HTTPResponse.builder()
                .withStatusCode(result.getStatusCode())
                .withHeaders(result.getHeaders())
                .withBody(result.getBody())
                .withIsBase64Encoded(false)
                .build();
    }

    private static String decodeBody(APIGatewayV2HTTPEvent event) {
        String body = event.getBody();
        if (body == null || !event.getIsBase64Encoded()) {
            return body;
        }
        return new String(Base64.getDecoder().decode(body), StandardCharsets.UTF_8);
    }
}
