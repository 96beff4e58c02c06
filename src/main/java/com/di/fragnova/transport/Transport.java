package com.di.fragnova.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the physical move of a fragment between nodes and reports how long it took.
 * <p>
 * The returned future completes with a {@link TransferReceipt} on success, or exceptionally with a
 * {@link TransportException} (or any other throwable) on failure. Implementations must treat
 * {@code source == dest} as an immediate zero-latency success, although the residency controller
 * never issues such a request.
 * <p>
 * There is no cancellation: callers bound their wait and treat an unanswered request as failed.
 */
public interface Transport {

    CompletableFuture<TransferReceipt> migrate(TransferRequest request);
}
