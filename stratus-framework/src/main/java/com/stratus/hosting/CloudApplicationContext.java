package com.stratus.hosting;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a built application, passed to the runtime that hosts it.
 */
@Value
@Builder
public class CloudApplicationContext {
    List<String> args;
    ExecutionMode mode;
    CliCommand command;
    List<FunctionRegistration> functions;
    List<TableRegistration> tables;
    CloudDefaults defaults;
    Map<String, String> environment;
}
