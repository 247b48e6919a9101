package com.stratus.hosting;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every unsatisfied function dependency found at startup, reported at once.
 */
@Getter
public class DependencyValidationException extends StratusException {
    private final List<String> missingServices;

    public DependencyValidationException(List<String> missingServices) {
        super("Missing service registrations:\n" + missingServices.stream()
                .map(s -> "  - " + s)
                .collect(Collectors.joining("\n")));
        this.missingServices = List.copyOf(missingServices);
    }
}
