package com.stratus.hosting;

import lombok.Getter;

/**
 * Failure of the deploy pipeline, tagged with the stage it happened in
 * ("prerequisites", "package", "synth", "deploy", ...).
 */
@Getter
public class DeploymentException extends StratusException {
    private final String stage;

    public DeploymentException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public DeploymentException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
