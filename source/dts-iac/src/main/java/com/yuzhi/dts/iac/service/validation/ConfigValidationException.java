package com.yuzhi.dts.iac.service.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Desired config references something undefined. Raised before any mutation, listing every problem found.
 */
public class ConfigValidationException extends RuntimeException {

    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super("Configuration validation failed:\n" + errors.stream().map(e -> "- " + e).collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
