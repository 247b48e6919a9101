package com.stratus.hosting;

public enum CliCommand {
    NONE,
    LIST,
    SYNTH,
    DEPLOY,
    DIFF,
    DESTROY
}
