package com.stratus.deploy;

import com.stratus.hosting.DeploymentException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external tools of the deploy pipeline, streaming their output to
 * the log.
 */
@Slf4j
public class ToolRunner {
    private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    /**
     * @throws DeploymentException in stage {@code prerequisites} when the tool is missing or broken
     */
    public void check(String tool, String displayName) {
        Process process;
        try {
            process = new ProcessBuilder(command(List.of(tool, "--version")))
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new DeploymentException("prerequisites", displayName + " is required but was not found. Please install it.", e);
        }
        try {
            if (!process.waitFor(30, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new DeploymentException("prerequisites", displayName + " did not respond.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException("prerequisites", "Interrupted while checking " + displayName, e);
        }
        if (process.exitValue() != 0) {
            throw new DeploymentException("prerequisites", displayName + " is not working correctly.");
        }
    }

    /**
     * Runs a command to completion.
     *
     * @return the exit code
     */
    public int run(Path workingDirectory, List<String> command) throws IOException, InterruptedException {
        log.info("> {}", String.join(" ", command));
        Process process = new ProcessBuilder(command(command))
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .start();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("      {}", line);
            }
        }
        return process.waitFor();
    }

    // npx and mvn are batch scripts on Windows
    private static List<String> command(List<String> command) {
        if (!WINDOWS) {
            return command;
        }
        List<String> wrapped = new ArrayList<>(List.of("cmd", "/c"));
        wrapped.addAll(command);
        return wrapped;
    }
}
