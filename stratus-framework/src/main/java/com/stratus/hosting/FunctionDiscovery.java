package com.stratus.hosting;

import com.google.inject.TypeLiteral;
import com.stratus.api.FunctionConfig;
import com.stratus.api.HttpApi;
import com.stratus.api.HttpFunction;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Collects HTTP functions from the classes handed to it. A class qualifies
 * when it is concrete, carries {@link HttpApi} and implements
 * {@link HttpFunction} with concrete type arguments, directly or through a
 * superclass. Anything else is skipped.
 */
@Slf4j
public class FunctionDiscovery {
    private final CloudDefaults defaults;
    private final Set<Class<?>> candidates = new LinkedHashSet<>();
    private Predicate<Class<?>> filter = type -> true;

    public FunctionDiscovery(CloudDefaults defaults) {
        this.defaults = defaults;
    }

    public FunctionDiscovery from(Class<?>... types) {
        return from(Arrays.asList(types));
    }

    public FunctionDiscovery from(Collection<Class<?>> types) {
        candidates.addAll(types);
        return this;
    }

    public FunctionDiscovery withFilter(Predicate<Class<?>> filter) {
        this.filter = filter;
        return this;
    }

    public List<FunctionRegistration> discover() {
        List<FunctionRegistration> registrations = new ArrayList<>();
        for (Class<?> candidate : candidates) {
            if (!filter.test(candidate)) {
                continue;
            }
            inspect(candidate, defaults).ifPresent(registrations::add);
        }
        log.debug("Discovered {} function(s) from {} candidate class(es)", registrations.size(), candidates.size());
        return registrations;
    }

    /**
     * Builds the registration for a single type, with options resolved from
     * the defaults and the type's {@link FunctionConfig}.
     */
    static Optional<FunctionRegistration> inspect(Class<?> type, CloudDefaults defaults) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return Optional.empty();
        }
        HttpApi api = type.getAnnotation(HttpApi.class);
        if (api == null) {
            return Optional.empty();
        }
        Optional<Type[]> arguments = httpFunctionArguments(type);
        if (arguments.isEmpty()) {
            return Optional.empty();
        }

        int memoryMb = defaults.getLambda().getMemoryMb();
        int timeoutSeconds = defaults.getLambda().getTimeoutSeconds();
        FunctionConfig config = type.getAnnotation(FunctionConfig.class);
        if (config != null) {
            if (config.memoryMb() > 0) {
                memoryMb = config.memoryMb();
            }
            if (config.timeoutSeconds() > 0) {
                timeoutSeconds = config.timeoutSeconds();
            }
        }

        return Optional.of(FunctionRegistration.builder()
                .functionType(type)
                .requestType(arguments.get()[0])
                .responseType(arguments.get()[1])
                .method(api.method())
                .route(api.route())
                .memoryMb(memoryMb)
                .timeoutSeconds(timeoutSeconds)
                .build());
    }

    /**
     * Resolves {@code Q} and {@code R} of {@code HttpFunction<Q, R>} through
     * the type hierarchy. Empty when the type does not implement it or leaves
     * an argument unresolved.
     */
    static Optional<Type[]> httpFunctionArguments(Class<?> type) {
        if (!HttpFunction.class.isAssignableFrom(type)) {
            return Optional.empty();
        }
        Type supertype = TypeLiteral.get(type).getSupertype(HttpFunction.class).getType();
        if (!(supertype instanceof ParameterizedType)) {
            return Optional.empty();
        }
        Type[] arguments = ((ParameterizedType) supertype).getActualTypeArguments();
        for (Type argument : arguments) {
            if (!(argument instanceof Class) && !(argument instanceof ParameterizedType)) {
                return Optional.empty();
            }
        }
        return Optional.of(arguments);
    }
}
