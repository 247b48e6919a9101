package com.stratus.hosting;

import com.google.inject.Module;

import java.util.List;

/**
 * Hosts a built application in one execution context.
 */
public interface StratusRuntime {

    /**
     * @param context immutable description of the application
     * @param modules the application's Guice modules, function bindings included
     */
    void run(CloudApplicationContext context, List<Module> modules) throws Exception;
}
