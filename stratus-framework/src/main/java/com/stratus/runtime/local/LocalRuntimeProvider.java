package com.stratus.runtime.local;

import com.stratus.hosting.ExecutionMode;
import com.stratus.hosting.RuntimeProvider;
import com.stratus.hosting.StratusRuntime;

public class LocalRuntimeProvider implements RuntimeProvider {

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.LOCAL;
    }

    @Override
    public StratusRuntime create() {
        return new LocalRuntime();
    }
}
