package com.di.fragnova.transport;

/**
 * A migration did not complete. Recovered by the residency controller: residency stays at the source
 * and the fragment is reconsidered next epoch.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
