package com.stratus.hosting;

import com.google.inject.Module;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A built application, ready to run in the execution mode detected at build
 * time.
 */
@Slf4j
public class CloudApplication {
    @Getter
    private final CloudApplicationContext context;
    @Getter
    private final List<Module> modules;
    private final StratusRuntime runtime;

    CloudApplication(CloudApplicationContext context, List<Module> modules, StratusRuntime runtime) {
        this.context = context;
        this.modules = modules;
        this.runtime = runtime;
    }

    public static CloudApplicationBuilder createBuilder(String[] args) {
        return new CloudApplicationBuilder(args, System.getenv());
    }

    public static CloudApplicationBuilder createBuilder(String[] args, Map<String, String> environment) {
        return new CloudApplicationBuilder(args, environment);
    }

    public Optional<StratusRuntime> getRuntime() {
        return Optional.ofNullable(runtime);
    }

    public void run() throws Exception {
        if (context.getCommand() == CliCommand.LIST) {
            System.out.print(describeResources());
            return;
        }
        if (runtime == null) {
            throw new StratusException("No runtime available for execution mode " + context.getMode()
                    + ". Add the matching runtime to the classpath or call useRuntime(...) on the builder.");
        }
        log.info("Starting {} runtime", context.getMode());
        runtime.run(context, modules);
    }

    /**
     * Human-readable listing of the functions and tables, as printed by the
     * {@code list} command.
     */
    public String describeResources() {
        StringBuilder out = new StringBuilder();
        out.append("Functions (").append(context.getFunctions().size()).append("):\n");
        for (FunctionRegistration function : context.getFunctions()) {
            out.append(String.format("  %-6s %-30s %s (%d MB, %ds)%n",
                    function.getMethod(), function.getRoute(), function.getName(),
                    function.getMemoryMb(), function.getTimeoutSeconds()));
        }
        out.append("Tables (").append(context.getTables().size()).append("):\n");
        for (TableRegistration table : context.getTables()) {
            String name = table.getTableName() != null ? table.getTableName() : "<needs @TableName>";
            out.append(String.format("  %-20s -> %s%n", table.getEntityName(), name));
        }
        return out.toString();
    }
}
