package com.stratus.deploy;

import com.google.inject.Module;
import com.stratus.hosting.CliCommand;
import com.stratus.hosting.CloudApplicationContext;
import com.stratus.hosting.DeploymentException;
import com.stratus.hosting.StratusRuntime;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Packages the application, synthesizes its CDK stack and hands the cloud
 * assembly to the CDK CLI. Runs from the application's project directory.
 */
@Slf4j
public class DeployRuntime implements StratusRuntime {
    private final ToolRunner tools;
    private final Path projectDirectory;

    public DeployRuntime() {
        this(new ToolRunner(), Paths.get("").toAbsolutePath());
    }

    public DeployRuntime(ToolRunner tools, Path projectDirectory) {
        this.tools = tools;
        this.projectDirectory = projectDirectory;
    }

    @Override
    public void run(CloudApplicationContext context, List<Module> modules) {
        tools.check("mvn", "Maven (mvn)");
        tools.check("npx", "npx (Node.js)");

        Path cdkOut = projectDirectory.resolve("cdk.out");
        CliCommand command = context.getCommand();
        log.info("=== Stratus {} ===", command.name().toLowerCase());

        log.info("[1/3] Packaging application...");
        Path jar = packageApplication();
        log.info("Packaged {}", jar);

        log.info("[2/3] Synthesizing CDK stack...");
        synth(context, jar, cdkOut);
        log.info("Cloud assembly written to {}", cdkOut);

        switch (command) {
            case SYNTH:
                return;
            case DIFF:
                log.info("[3/3] Comparing with deployed stack...");
                cdk(cdkOut, "diff");
                break;
            case DESTROY:
                log.info("[3/3] Destroying stack...");
                cdk(cdkOut, "destroy", "--force");
                break;
            default:
                log.info("[3/3] Deploying to AWS...");
                cdk(cdkOut, "deploy", "--require-approval", "never", "--outputs-file", "cdk-outputs.json");
                printOutputs();
                break;
        }
        log.info("=== Done ===");
    }

    private Path packageApplication() {
        exec("package", List.of("mvn", "-B", "-q", "package", "-DskipTests"));
        return findJar(projectDirectory.resolve("target"));
    }

    static Path findJar(Path targetDirectory) {
        if (!Files.isDirectory(targetDirectory)) {
            throw new DeploymentException("package", "No target directory at " + targetDirectory);
        }
        try (DirectoryStream<Path> jars = Files.newDirectoryStream(targetDirectory, "*.jar")) {
            for (Path jar : jars) {
                String name = jar.getFileName().toString();
                if (!name.startsWith("original-") && !name.endsWith("-sources.jar") && !name.endsWith("-tests.jar")) {
                    return jar;
                }
            }
        } catch (IOException e) {
            throw new DeploymentException("package", "Could not read " + targetDirectory, e);
        }
        throw new DeploymentException("package", "No application jar found in " + targetDirectory);
    }

    private void synth(CloudApplicationContext context, Path jar, Path cdkOut) {
        String handler = context.getDefaults().getLambda().getHandler();
        if (handler == null || handler.isBlank()) {
            throw new DeploymentException("synth", "No Lambda handler configured. Set it with "
                    + "configureDefaults(d -> d.getLambda().setHandler(\"com.acme.MyHandler::handleRequest\")).");
        }
        try {
            DeploymentPlan plan = DeploymentPlan.from(context);
            new StackGenerator(handler, jar.toString(), cdkOut.toString()).generate(plan).synth();
        } catch (DeploymentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeploymentException("synth", "CDK synthesis failed: " + e.getMessage(), e);
        }
    }

    private void cdk(Path cdkOut, String... arguments) {
        List<String> command = new ArrayList<>(List.of("npx", "cdk"));
        command.addAll(List.of(arguments));
        command.add("--app");
        command.add(cdkOut.toString());
        exec(arguments[0], command);
    }

    private void exec(String stage, List<String> command) {
        int exitCode;
        try {
            exitCode = tools.run(projectDirectory, command);
        } catch (IOException e) {
            throw new DeploymentException(stage, "Could not start " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException(stage, "Interrupted during " + stage, e);
        }
        if (exitCode != 0) {
            throw new DeploymentException(stage, String.join(" ", command) + " failed (exit code " + exitCode + ")");
        }
    }

    private void printOutputs() {
        Path outputs = projectDirectory.resolve("cdk-outputs.json");
        if (!Files.exists(outputs)) {
            return;
        }
        try {
            log.info("Stack outputs:\n{}", Files.readString(outputs));
        } catch (IOException e) {
            log.warn("Could not read {}", outputs, e);
        }
    }
}
