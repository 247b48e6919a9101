package com.stratus.deploy;

import com.stratus.hosting.ExecutionMode;
import com.stratus.hosting.RuntimeProvider;
import com.stratus.hosting.StratusRuntime;

public class DeployRuntimeProvider implements RuntimeProvider {

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.DEPLOY;
    }

    @Override
    public StratusRuntime create() {
        return new DeployRuntime();
    }
}
