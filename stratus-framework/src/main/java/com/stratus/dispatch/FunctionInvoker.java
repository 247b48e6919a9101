package com.stratus.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import com.stratus.api.HttpFunction;
import com.stratus.api.NotFoundException;
import com.stratus.binding.BindingException;
import com.stratus.binding.FunctionRequest;
import com.stratus.binding.RequestBinder;
import com.stratus.hosting.FunctionRegistration;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;

/**
 * The request pipeline shared by every runtime: resolve the function from
 * the injector, bind the request, invoke, serialize. Any failure along the
 * way becomes an error response; the returned future never fails.
 */
@Slf4j
public class FunctionInvoker {
    static final String INTERNAL_ERROR = "Internal server error";

    private final Injector injector;
    private final RequestBinder binder;
    private final ObjectMapper objectMapper;

    public FunctionInvoker(Injector injector, ObjectMapper objectMapper) {
        this.injector = injector;
        this.objectMapper = objectMapper;
        this.binder = new RequestBinder(objectMapper);
    }

    public Future<DispatchResult> invoke(FunctionRegistration function, FunctionRequest request) {
        return invoke(function, request, () -> false);
    }

    /**
     * @param cancelled polled between stages; once true the remaining stages are skipped
     */
    @SuppressWarnings("unchecked")
    public Future<DispatchResult> invoke(FunctionRegistration function, FunctionRequest request,
                                         BooleanSupplier cancelled) {
        Future<Object> response;
        try {
            Object instance = injector.getInstance(function.getFunctionType());
            Object boundRequest = binder.bind(function.getRequestType(), function.getMethod(), request);
            if (cancelled.getAsBoolean()) {
                return Future.succeededFuture(abandoned(function));
            }
            response = ((HttpFunction<Object, Object>) instance).handle(boundRequest);
            if (response == null) {
                throw new IllegalStateException(function.getName() + " returned a null future");
            }
        } catch (Exception e) {
            return Future.succeededFuture(toErrorResult(function, e));
        }

        return response
                .map(value -> cancelled.getAsBoolean() ? abandoned(function) : serialize(value))
                .otherwise(err -> toErrorResult(function, err));
    }

    private DispatchResult serialize(Object value) {
        try {
            return new DispatchResult(200, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response", e);
        }
    }

    private DispatchResult abandoned(FunctionRegistration function) {
        log.debug("Client went away, skipping the rest of {}", function.getName());
        return new DispatchResult(DispatchResult.CLIENT_CLOSED, error("Client closed request"));
    }

    DispatchResult toErrorResult(FunctionRegistration function, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof NotFoundException) {
            log.debug("{}: {}", function.getName(), cause.getMessage());
            return new DispatchResult(404, error(cause.getMessage()));
        }
        if (cause instanceof BindingException) {
            log.warn("Could not bind request for {}: {}", function.getName(), cause.getMessage());
            return new DispatchResult(400, error(cause.getMessage()));
        }
        log.error("Unhandled error in {}", function.getName(), cause);
        return new DispatchResult(500, error(INTERNAL_ERROR));
    }

    private String error(String message) {
        return objectMapper.createObjectNode().put("error", message).toString();
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ProvisionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
