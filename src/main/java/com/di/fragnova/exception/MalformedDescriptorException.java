package com.di.fragnova.exception;

import java.util.List;

/**
 * Thrown by {@link com.di.fragnova.descriptor.DescriptorLoader} when a descriptor is unreadable
 * or a fragment/node record fails validation. Carries every problem found, not just the first.
 *
 * <p>Caught by {@link GlobalExceptionHandler} and returned as a 400 Bad Request.
 */
public class MalformedDescriptorException extends RuntimeException {

    private final List<String> problems;

    public MalformedDescriptorException(List<String> problems) {
        super("Malformed descriptor: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public MalformedDescriptorException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
