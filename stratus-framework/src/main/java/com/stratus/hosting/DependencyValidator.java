package com.stratus.hosting;

import com.google.inject.Binding;
import com.google.inject.BindingAnnotation;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.spi.Element;
import com.google.inject.spi.Elements;
import com.google.inject.spi.PrivateElements;
import com.stratus.api.EntityTable;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import javax.inject.Qualifier;
import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks, before any request is served, that every constructor dependency of
 * every function is bound by the application's modules. Tables and loggers
 * are supplied by the runtime and always pass. {@link Logger} is reserved:
 * each function gets one named after it, so application modules may not bind it.
 */
@Slf4j
public class DependencyValidator {

    /**
     * @throws DependencyValidationException listing every unsatisfied parameter
     * @throws StratusException if an application module binds {@link Logger}
     */
    public void validate(List<FunctionRegistration> functions, List<Module> userModules) {
        Set<Key<?>> registered = registeredKeys(userModules);
        if (!functions.isEmpty() && registered.contains(Key.get(Logger.class))) {
            throw new StratusException("org.slf4j.Logger is bound by an application module. "
                    + "Functions receive a Logger named after them; remove that binding.");
        }
        List<String> missing = new ArrayList<>();

        for (FunctionRegistration function : functions) {
            Optional<Constructor<?>> constructor = FunctionModule.selectConstructor(function.getFunctionType());
            if (constructor.isEmpty()) {
                continue;
            }
            for (Parameter parameter : constructor.get().getParameters()) {
                if (isRuntimeProvided(parameter.getParameterizedType())) {
                    continue;
                }
                Key<?> key = keyFor(parameter);
                if (!registered.contains(key)) {
                    missing.add(function.getName() + " requires " + describe(parameter.getParameterizedType())
                            + " (parameter '" + parameter.getName() + "')");
                }
            }
        }

        if (!missing.isEmpty()) {
            throw new DependencyValidationException(missing);
        }
        log.debug("Validated dependencies of {} function(s)", functions.size());
    }

    private static Set<Key<?>> registeredKeys(List<Module> modules) {
        Set<Key<?>> keys = new HashSet<>();
        for (Element element : Elements.getElements(modules)) {
            if (element instanceof Binding) {
                keys.add(((Binding<?>) element).getKey());
            } else if (element instanceof PrivateElements) {
                keys.addAll(((PrivateElements) element).getExposedKeys());
            }
        }
        return keys;
    }

    private static boolean isRuntimeProvided(Type type) {
        Class<?> raw = rawType(type);
        return EntityTable.class.equals(raw) || Logger.class.equals(raw);
    }

    private static Key<?> keyFor(Parameter parameter) {
        for (Annotation annotation : parameter.getAnnotations()) {
            Class<? extends Annotation> annotationType = annotation.annotationType();
            if (annotationType.isAnnotationPresent(BindingAnnotation.class)
                    || annotationType.isAnnotationPresent(Qualifier.class)) {
                return Key.get(parameter.getParameterizedType(), annotation);
            }
        }
        return Key.get(parameter.getParameterizedType());
    }

    private static Class<?> rawType(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        return Object.class;
    }

    private static String describe(Type type) {
        return rawType(type).getSimpleName();
    }
}
