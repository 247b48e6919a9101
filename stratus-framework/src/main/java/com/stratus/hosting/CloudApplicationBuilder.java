package com.stratus.hosting;

import com.google.inject.Module;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Consumer;

/**
 * Assembles a {@link CloudApplication}: what functions and tables it has,
 * which services they may depend on and where it runs.
 *
 * <pre>
 * CloudApplication.createBuilder(args)
 *     .addFunctions(CreateOrder.class, GetOrder.class)
 *     .addTables(Order.class)
 *     .services(new OrderServicesModule())
 *     .build()
 *     .run();
 * </pre>
 */
@Slf4j
public class CloudApplicationBuilder {
    public static final String LAMBDA_RUNTIME_VARIABLE = "AWS_LAMBDA_RUNTIME_API";

    private final List<String> args;
    private final Map<String, String> environment;
    private final CloudDefaults defaults = new CloudDefaults();
    private final FunctionDiscovery functionDiscovery = new FunctionDiscovery(defaults);
    private final TableDiscovery tableDiscovery = new TableDiscovery();
    private final Map<Class<?>, FunctionOptions> functionOverrides = new LinkedHashMap<>();
    private final Map<Class<?>, TableOptions> tableOverrides = new LinkedHashMap<>();
    private final List<Module> modules = new ArrayList<>();
    private StratusRuntime runtime;

    CloudApplicationBuilder(String[] args, Map<String, String> environment) {
        this.args = List.of(args);
        this.environment = Map.copyOf(environment);
    }

    public CloudApplicationBuilder addFunctions(Class<?>... types) {
        functionDiscovery.from(types);
        return this;
    }

    public CloudApplicationBuilder addFunctions(Consumer<FunctionDiscovery> configure) {
        configure.accept(functionDiscovery);
        return this;
    }

    public CloudApplicationBuilder addTables(Class<?>... types) {
        tableDiscovery.from(types);
        return this;
    }

    public CloudApplicationBuilder addTables(Consumer<TableDiscovery> configure) {
        configure.accept(tableDiscovery);
        return this;
    }

    /**
     * Registers a single function, overlaying explicit options on whatever
     * discovery and {@link com.stratus.api.FunctionConfig} resolve.
     */
    public CloudApplicationBuilder addFunction(Class<?> type, Consumer<FunctionOptions> configure) {
        FunctionOptions options = functionOverrides.computeIfAbsent(type, t -> new FunctionOptions());
        configure.accept(options);
        return this;
    }

    public CloudApplicationBuilder addFunction(Class<?> type) {
        return addFunction(type, options -> { });
    }

    public CloudApplicationBuilder addTable(Class<?> type, Consumer<TableOptions> configure) {
        TableOptions options = tableOverrides.computeIfAbsent(type, t -> new TableOptions());
        configure.accept(options);
        return this;
    }

    public CloudApplicationBuilder addTable(Class<?> type) {
        return addTable(type, options -> { });
    }

    public CloudApplicationBuilder configureDefaults(Consumer<CloudDefaults> configure) {
        configure.accept(defaults);
        return this;
    }

    /**
     * Registers the Guice modules that bind the services functions depend on.
     */
    public CloudApplicationBuilder services(Module... serviceModules) {
        modules.addAll(Arrays.asList(serviceModules));
        return this;
    }

    public CloudApplicationBuilder useRuntime(StratusRuntime runtime) {
        this.runtime = runtime;
        return this;
    }

    public CloudApplication build() {
        DetectedMode detected = detectModeAndCommand(args, environment);
        List<FunctionRegistration> functions = resolveFunctions();
        List<TableRegistration> tables = resolveTables();

        if (detected.getCommand() != CliCommand.LIST) {
            new DependencyValidator().validate(functions, modules);
        }

        List<Module> applicationModules = new ArrayList<>(modules);
        applicationModules.add(new FunctionModule(functions));

        StratusRuntime selected = runtime != null ? runtime : loadRuntime(detected.getMode()).orElse(null);

        CloudApplicationContext context = CloudApplicationContext.builder()
                .args(args)
                .mode(detected.getMode())
                .command(detected.getCommand())
                .functions(List.copyOf(functions))
                .tables(List.copyOf(tables))
                .defaults(defaults)
                .environment(environment)
                .build();

        log.info("Built application: mode={}, command={}, {} function(s), {} table(s)",
                context.getMode(), context.getCommand(), functions.size(), tables.size());
        return new CloudApplication(context, List.copyOf(applicationModules), selected);
    }

    private List<FunctionRegistration> resolveFunctions() {
        Map<Class<?>, FunctionRegistration> resolved = new LinkedHashMap<>();
        for (FunctionRegistration registration : functionDiscovery.discover()) {
            resolved.putIfAbsent(registration.getFunctionType(), registration);
        }

        for (Map.Entry<Class<?>, FunctionOptions> override : functionOverrides.entrySet()) {
            Class<?> type = override.getKey();
            FunctionRegistration registration = resolved.get(type);
            if (registration == null) {
                registration = FunctionDiscovery.inspect(type, defaults)
                        .orElseThrow(() -> new StratusException(type.getName()
                                + " is not an HTTP function. It must be a concrete class annotated with @HttpApi "
                                + "that implements HttpFunction<Q, R>."));
            }
            FunctionOptions options = override.getValue();
            FunctionRegistration.FunctionRegistrationBuilder builder = registration.toBuilder();
            if (options.getMemoryMb() != null) {
                builder.memoryMb(options.getMemoryMb());
            }
            if (options.getTimeoutSeconds() != null) {
                builder.timeoutSeconds(options.getTimeoutSeconds());
            }
            resolved.put(type, builder.build());
        }
        return new ArrayList<>(resolved.values());
    }

    private List<TableRegistration> resolveTables() {
        Map<Class<?>, TableRegistration> resolved = new LinkedHashMap<>();
        for (TableRegistration registration : tableDiscovery.discover()) {
            resolved.putIfAbsent(registration.getEntityType(), registration);
        }

        for (Map.Entry<Class<?>, TableOptions> override : tableOverrides.entrySet()) {
            Class<?> type = override.getKey();
            TableRegistration registration = resolved.get(type);
            if (registration == null) {
                registration = TableDiscovery.inspect(type)
                        .orElseThrow(() -> new StratusException(type.getName()
                                + " is not a table entity. It must be a concrete class implementing TableEntity."));
            }
            String tableName = override.getValue().getTableName();
            if (tableName != null) {
                registration = new TableRegistration(type, tableName);
            }
            resolved.put(type, registration);
        }
        return new ArrayList<>(resolved.values());
    }

    private static Optional<StratusRuntime> loadRuntime(ExecutionMode mode) {
        for (RuntimeProvider provider : ServiceLoader.load(RuntimeProvider.class)) {
            if (provider.mode() == mode) {
                return Optional.of(provider.create());
            }
        }
        return Optional.empty();
    }

    /**
     * Lambda is recognised by its runtime API variable; otherwise the first
     * recognised CLI verb decides.
     */
    public static DetectedMode detectModeAndCommand(List<String> args, Map<String, String> environment) {
        String lambdaApi = environment.get(LAMBDA_RUNTIME_VARIABLE);
        if (lambdaApi != null && !lambdaApi.isEmpty()) {
            return new DetectedMode(ExecutionMode.LAMBDA, CliCommand.NONE);
        }
        for (String arg : args) {
            switch (arg.toLowerCase()) {
                case "deploy":
                    return new DetectedMode(ExecutionMode.DEPLOY, CliCommand.DEPLOY);
                case "synth":
                    return new DetectedMode(ExecutionMode.DEPLOY, CliCommand.SYNTH);
                case "destroy":
                    return new DetectedMode(ExecutionMode.DEPLOY, CliCommand.DESTROY);
                case "diff":
                    return new DetectedMode(ExecutionMode.DEPLOY, CliCommand.DIFF);
                case "list":
                    return new DetectedMode(ExecutionMode.LOCAL, CliCommand.LIST);
                default:
                    break;
            }
        }
        return new DetectedMode(ExecutionMode.LOCAL, CliCommand.NONE);
    }

    @Value
    public static class DetectedMode {
        ExecutionMode mode;
        CliCommand command;
    }
}
