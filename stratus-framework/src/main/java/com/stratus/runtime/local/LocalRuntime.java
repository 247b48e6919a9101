package com.stratus.runtime.local;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.stratus.binding.JsonMappers;
import com.stratus.dispatch.FunctionInvoker;
import com.stratus.hosting.CloudApplicationContext;
import com.stratus.hosting.StratusRuntime;
import com.stratus.table.InMemoryTableModule;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Development server: every function on one Vert.x HTTP server, tables in
 * memory.
 */
@Slf4j
public class LocalRuntime implements StratusRuntime {
    public static final String PORT_VARIABLE = "PORT";

    @Override
    public void run(CloudApplicationContext context, List<Module> modules) {
        Vertx vertx = Vertx.vertx();
        start(vertx, context, modules, port(context))
                .onFailure(err -> {
                    log.error("Failed to start server", err);
                    vertx.close();
                })
                .toCompletionStage()
                .toCompletableFuture()
                .join();
    }

    /**
     * Starts the server on the given port, 0 for any free port.
     */
    public Future<HttpServer> start(Vertx vertx, CloudApplicationContext context, List<Module> modules, int port) {
        List<Module> allModules = new ArrayList<>(modules);
        allModules.add(new InMemoryTableModule(context.getTables()));
        Injector injector = Guice.createInjector(allModules);

        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        new FunctionRoutes(new FunctionInvoker(injector, JsonMappers.create()))
                .register(router, context.getFunctions());

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(http -> log.info("Server started on http://localhost:{}", http.actualPort()));
    }

    static int port(CloudApplicationContext context) {
        String value = context.getEnvironment().get(PORT_VARIABLE);
        if (value == null || value.isBlank()) {
            return context.getDefaults().getLocal().getPort();
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}", PORT_VARIABLE, value);
            return context.getDefaults().getLocal().getPort();
        }
    }
}
