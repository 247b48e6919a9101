package com.stratus.hosting;

public enum ExecutionMode {
    LOCAL,
    LAMBDA,
    DEPLOY
}
