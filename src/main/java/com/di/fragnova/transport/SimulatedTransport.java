package com.di.fragnova.transport;

import com.di.fragnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prioritized transfer engine that models latency instead of copying bytes.
 * <p>
 * Requests are queued by priority (lower first, FIFO within a priority) and dispatched by a single thread;
 * each dispatched transfer completes after {@code baseLatency + wholeMiB * perMibLatency}, halved for
 * priority &le; 0. A seeded failure rate turns some transfers into {@link TransportException}s.
 */
@Slf4j
public class SimulatedTransport implements Transport, AutoCloseable {

    private static final long MIB = 1L << 20;

    private final Duration baseLatency;
    private final Duration perMibLatency;
    private final double failureRate;
    private final Random random;

    private final PriorityBlockingQueue<Pending> queue = new PriorityBlockingQueue<>(16,
            Comparator.comparingInt((Pending p) -> p.request.priority()).thenComparingLong(p -> p.sequence));
    private final AtomicLong sequence = new AtomicLong();
    private final Set<CompletableFuture<TransferReceipt>> inFlight = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService completions;
    private final Thread dispatcher;
    private volatile boolean running = true;

    public SimulatedTransport(TransportProperties properties) {
        this.baseLatency = properties.getBaseLatency();
        this.perMibLatency = properties.getPerMibLatency();
        this.failureRate = properties.getFailureRate();
        this.random = new Random(properties.getSeed());
        AtomicInteger threadIndex = new AtomicInteger();
        this.completions = Executors.newScheduledThreadPool(Math.max(1, properties.getCompletionThreads()), r -> {
            Thread t = new Thread(r, "transport-completion-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = new Thread(this::dispatchLoop, "transport-dispatcher");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
        log.info("[TRANSPORT] Simulated transport started (base={}ms, perMiB={}ms, failureRate={})",
                baseLatency.toMillis(), perMibLatency.toMillis(), failureRate);
    }

    @Override
    public CompletableFuture<TransferReceipt> migrate(TransferRequest request) {
        if (request == null) {
            return CompletableFuture.failedFuture(new TransportException("nil transfer request"));
        }
        if (request.isNoOp()) {
            return CompletableFuture.completedFuture(TransferReceipt.immediate(request));
        }
        if (!running) {
            return CompletableFuture.failedFuture(new TransportException("transport stopped"));
        }
        CompletableFuture<TransferReceipt> future = new CompletableFuture<>();
        inFlight.add(future);
        future.whenComplete((r, e) -> inFlight.remove(future));
        queue.add(new Pending(request, sequence.getAndIncrement(), future, MdcPropagation.copyMdc()));
        return future;
    }

    /** Requests queued but not yet dispatched. */
    public int pendingCount() {
        return queue.size();
    }

    Duration latencyFor(TransferRequest request) {
        Duration latency = baseLatency.plus(perMibLatency.multipliedBy(request.sizeBytes() / MIB));
        if (request.priority() <= 0) {
            latency = latency.dividedBy(2);
        }
        return latency;
    }

    private void dispatchLoop() {
        while (running) {
            Pending next;
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            Duration latency = latencyFor(next.request);
            boolean fail = drawFailure();
            try {
                completions.schedule(
                        () -> MdcPropagation.runWithMdcContext(next.mdc, () -> complete(next, latency, fail)),
                        latency.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                next.future.completeExceptionally(new TransportException("transport stopped", e));
            }
        }
    }

    private void complete(Pending p, Duration latency, boolean fail) {
        TransferRequest r = p.request;
        if (fail) {
            log.debug("[TRANSPORT] Transfer of {} {} -> {} failed", r.fragmentId(), r.sourceNode(), r.destNode());
            p.future.completeExceptionally(new TransportException(String.format(
                    "transfer of %s from %s to %s failed", r.fragmentId(), r.sourceNode(), r.destNode())));
            return;
        }
        double seconds = latency.toNanos() / 1_000_000_000.0;
        log.debug("[TRANSPORT] Transfer of {} {} -> {} done in {}s", r.fragmentId(), r.sourceNode(), r.destNode(), seconds);
        p.future.complete(new TransferReceipt(r.fragmentId(), r.destNode(), seconds));
    }

    private boolean drawFailure() {
        if (failureRate <= 0.0) return false;
        synchronized (random) {
            return random.nextDouble() < failureRate;
        }
    }

    /**
     * Stops dispatching and fails every queued or in-flight transfer.
     */
    @Override
    public void close() {
        running = false;
        dispatcher.interrupt();
        completions.shutdownNow();
        TransportException stopped = new TransportException("transport stopped");
        Pending p;
        while ((p = queue.poll()) != null) {
            p.future.completeExceptionally(stopped);
        }
        for (CompletableFuture<TransferReceipt> f : inFlight) {
            f.completeExceptionally(stopped);
        }
        log.info("[TRANSPORT] Simulated transport stopped");
    }

    private static final class Pending {
        final TransferRequest request;
        final long sequence;
        final CompletableFuture<TransferReceipt> future;
        final Map<String, String> mdc;

        Pending(TransferRequest request, long sequence, CompletableFuture<TransferReceipt> future, Map<String, String> mdc) {
            this.request = request;
            this.sequence = sequence;
            this.future = future;
            this.mdc = mdc;
        }
    }
}
