package com.stratus.runtime.local;

import com.stratus.binding.FunctionRequest;
import com.stratus.dispatch.DispatchResult;
import com.stratus.dispatch.FunctionInvoker;
import com.stratus.hosting.FunctionRegistration;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each function's route onto a Vert.x router.
 */
@Slf4j
public class FunctionRoutes {
    private final FunctionInvoker invoker;

    public FunctionRoutes(FunctionInvoker invoker) {
        this.invoker = invoker;
    }

    public void register(Router router, List<FunctionRegistration> functions) {
        for (FunctionRegistration function : functions) {
            String path = toRouterPath(function.getRoute());
            router.route(HttpMethod.valueOf(function.getMethod().name()), path)
                    .handler(rc -> handle(rc, function));
            log.info("Mapped {} {} -> {}", function.getMethod(), function.getRoute(), function.getName());
        }
    }

    private void handle(RoutingContext rc, FunctionRegistration function) {
        FunctionRequest request = new FunctionRequest(
                rc.pathParams(),
                firstValues(rc.queryParams()),
                rc.body().asString());

        invoker.invoke(function, request, () -> rc.response().closed())
                .onSuccess(result -> write(rc, function, result));
    }

    private static void write(RoutingContext rc, FunctionRegistration function, DispatchResult result) {
        if (rc.response().closed() || rc.response().ended()) {
            log.debug("Response for {} dropped, connection already closed", function.getName());
            return;
        }
        rc.response().setStatusCode(result.getStatusCode());
        result.getHeaders().forEach((name, value) -> rc.response().putHeader(name, value));
        rc.response().end(result.getBody());
    }

    /**
     * {@code /orders/{id}} becomes {@code /orders/:id}.
     */
    static String toRouterPath(String route) {
        return route.replaceAll("\\{([^}/]+)}", ":$1");
    }

    private static Map<String, String> firstValues(MultiMap params) {
        Map<String, String> values = new HashMap<>();
        for (String name : params.names()) {
            values.put(name, params.get(name));
        }
        return values;
    }
}
