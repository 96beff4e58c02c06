package com.di.fragnova.exception;

/**
 * A placement or residency invariant was about to be broken: a commit beyond a node's budget,
 * or a second in-flight migration for the same fragment.
 *
 * <p>Indicates a sequencing bug, never a recoverable runtime condition. Callers should not catch it;
 * {@link GlobalExceptionHandler} reports it as a 500.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
