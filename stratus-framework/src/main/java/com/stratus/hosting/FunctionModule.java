package com.stratus.hosting;

import com.google.inject.AbstractModule;
import com.google.inject.PrivateModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Binds every registered function type. Each function gets its own private
 * module so that the {@link Logger} it receives is named after it.
 * Functions are unscoped: one instance per request.
 */
public class FunctionModule extends AbstractModule {
    private final List<FunctionRegistration> functions;

    public FunctionModule(List<FunctionRegistration> functions) {
        this.functions = functions;
    }

    @Override
    protected void configure() {
        for (FunctionRegistration function : functions) {
            install(new SingleFunctionModule<>(function.getFunctionType()));
        }
    }

    /**
     * The public constructor with the most parameters, the one used both for
     * dependency validation and for construction.
     */
    static Optional<Constructor<?>> selectConstructor(Class<?> type) {
        return Arrays.stream(type.getConstructors())
                .max(Comparator.comparingInt(Constructor::getParameterCount));
    }

    private static class SingleFunctionModule<T> extends PrivateModule {
        private final Class<T> type;

        SingleFunctionModule(Class<T> type) {
            this.type = type;
        }

        @Override
        @SuppressWarnings("unchecked")
        protected void configure() {
            bind(Logger.class).toInstance(LoggerFactory.getLogger(type));
            Optional<Constructor<?>> constructor = selectConstructor(type);
            if (constructor.isPresent()) {
                bind(type).toConstructor((Constructor<T>) constructor.get());
            } else {
                bind(type);
            }
            expose(type);
        }
    }
}
