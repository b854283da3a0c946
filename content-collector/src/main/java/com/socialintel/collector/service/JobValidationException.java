package com.socialintel.collector.service;

import lombok.Getter;

import java.util.List;

/**
 * Job parameters rejected at submission. Never retried.
 */
@Getter
public class JobValidationException extends RuntimeException {

    private final List<String> violations;

    public JobValidationException(List<String> violations) {
        super("Invalid job parameters: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public JobValidationException(String violation) {
        this(List.of(violation));
    }
}
