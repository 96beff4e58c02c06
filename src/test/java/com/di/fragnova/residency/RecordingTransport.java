package com.di.fragnova.residency;

import com.di.fragnova.transport.TransferReceipt;
import com.di.fragnova.transport.TransferRequest;
import com.di.fragnova.transport.Transport;
import com.di.fragnova.transport.TransportException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Test transport: records every request and answers immediately, unless told to fail or hang for a fragment.
 */
class RecordingTransport implements Transport {

    final List<TransferRequest> requests = new ArrayList<>();
    final Set<String> failing = new HashSet<>();
    final Set<String> hanging = new HashSet<>();
    final Map<String, CompletableFuture<TransferReceipt>> hung = new HashMap<>();
    ResidencyMap observedMap;
    int maxInFlightSeen;

    @Override
    public CompletableFuture<TransferReceipt> migrate(TransferRequest request) {
        requests.add(request);
        if (observedMap != null) {
            maxInFlightSeen = Math.max(maxInFlightSeen, observedMap.inFlightCount());
        }
        if (failing.contains(request.fragmentId())) {
            return CompletableFuture.failedFuture(new TransportException("link down for " + request.fragmentId()));
        }
        if (hanging.contains(request.fragmentId())) {
            CompletableFuture<TransferReceipt> future = new CompletableFuture<>();
            hung.put(request.fragmentId(), future);
            return future;
        }
        return CompletableFuture.completedFuture(new TransferReceipt(request.fragmentId(), request.destNode(), 0.004));
    }

    /** Answers the hung transfer of a fragment late and stops hanging on it. */
    void release(String fragmentId) {
        hanging.remove(fragmentId);
        CompletableFuture<TransferReceipt> future = hung.remove(fragmentId);
        if (future != null) {
            future.complete(new TransferReceipt(fragmentId, "late", 0.5));
        }
    }

    List<String> requestedIds() {
        List<String> ids = new ArrayList<>();
        for (TransferRequest r : requests) {
            ids.add(r.fragmentId());
        }
        return ids;
    }
}
