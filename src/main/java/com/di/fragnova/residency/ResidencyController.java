package com.di.fragnova.residency;

import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;
import com.di.fragnova.placement.CostModel;
import com.di.fragnova.placement.PlacementPlan;
import com.di.fragnova.transport.TransferReceipt;
import com.di.fragnova.transport.TransferRequest;
import com.di.fragnova.transport.Transport;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Online residency state machine, advanced one epoch per {@link #step(Collection)}.
 * <p>
 * Each epoch runs three phases in order:
 * <ol>
 *   <li><b>access</b>: every accessed fragment gains {@code hotnessIncrement} and its lease is raised to at
 *       least {@code epoch + accessGrace};</li>
 *   <li><b>promotion</b> (epochs divisible by {@code promotionInterval}, more than one node): the
 *       {@code promotionFanOut} hottest fragments (ties by id) move to the fast node;</li>
 *   <li><b>eviction</b>: fragments with an expired lease and hotness below the threshold move to the fallback
 *       node and get a short lease of {@code epoch + evictionGrace}.</li>
 * </ol>
 * Migrations inside a phase are dispatched together and awaited before the next phase, so a fragment never
 * has two in flight. The epoch ends only when every migration has committed, failed or timed out; failures
 * leave residency unchanged and are returned in the {@link EpochReport}.
 * <p>
 * A transfer that times out is not cancelled. Until its future resolves, the fragment is not handed to the
 * transport again; moves of it fail with "previous transfer still outstanding".
 * <p>
 * Epochs are serialized: concurrent callers of {@link #step(Collection)} queue on an internal lock.
 */
@Slf4j
public class ResidencyController {

    private static final String MDC_EPOCH = "epoch";

    private final ResidencyPolicy policy;
    private final ResidencyMap residency;
    private final Transport transport;
    private final CostModel costModel;

    private final ReentrantLock epochLock = new ReentrantLock();
    private final Map<String, Fragment> fragments = new TreeMap<>();
    private final Map<String, Long> leases = new TreeMap<>();
    private final Map<String, Double> hotness = new TreeMap<>();
    private final Map<String, CompletableFuture<TransferReceipt>> outstanding = new ConcurrentHashMap<>();
    private volatile long epoch = 0L;

    public ResidencyController(ResidencyPolicy policy, ResidencyMap residency, Transport transport, CostModel costModel) {
        this.policy = policy;
        this.residency = residency;
        this.transport = transport;
        this.costModel = costModel;
        if (policy.fastNode() != null && !residency.hasNode(policy.fastNode())) {
            throw new IllegalArgumentException("Configured fast node " + policy.fastNode() + " is not a known node");
        }
        if (policy.fallbackNode() != null && !residency.hasNode(policy.fallbackNode())) {
            throw new IllegalArgumentException("Configured fallback node " + policy.fallbackNode() + " is not a known node");
        }
    }

    // ============================================================================
    // Registration
    // ============================================================================

    /**
     * Makes a fragment known on {@code nodeId} with the default lease and hotness.
     *
     * @return false if the node's remaining budget cannot hold it (the fragment stays unknown)
     */
    public boolean register(Fragment fragment, String nodeId) {
        epochLock.lock();
        try {
            return register(fragment, nodeId, epoch + policy.initialLeaseEpochs(), policy.initialHotness());
        } finally {
            epochLock.unlock();
        }
    }

    public boolean register(Fragment fragment, String nodeId, long expiryEpoch, double initialHotness) {
        if (initialHotness < 0 || !Double.isFinite(initialHotness)) {
            throw new IllegalArgumentException("Hotness must be a finite value >= 0, got " + initialHotness);
        }
        epochLock.lock();
        try {
            if (fragments.containsKey(fragment.getId())) {
                throw new IllegalArgumentException("Fragment " + fragment.getId() + " is already registered");
            }
            Node node = residency.node(nodeId);
            if (!residency.place(fragment.getId(), nodeId, costModel.usage(fragment, node))) {
                log.warn("[RESIDENCY] Node {} has no room for fragment {}", nodeId, fragment.getId());
                return false;
            }
            fragments.put(fragment.getId(), fragment);
            leases.put(fragment.getId(), expiryEpoch);
            hotness.put(fragment.getId(), initialHotness);
            return true;
        } finally {
            epochLock.unlock();
        }
    }

    // ============================================================================
    // Epoch processing
    // ============================================================================

    /**
     * Advances the epoch by exactly one and runs the access, promotion and eviction phases.
     *
     * @param accessedIds fragments accessed during this epoch; may be empty, may contain unknown ids
     */
    public EpochReport step(Collection<String> accessedIds) {
        epochLock.lock();
        try {
            long current = epoch + 1;
            epoch = current;
            MDC.put(MDC_EPOCH, String.valueOf(current));
            try {
                return runEpoch(current, accessedIds == null ? List.of() : accessedIds);
            } finally {
                MDC.remove(MDC_EPOCH);
            }
        } finally {
            epochLock.unlock();
        }
    }

    private EpochReport runEpoch(long current, Collection<String> accessedIds) {
        List<String> accessed = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        applyAccesses(current, accessedIds, accessed, unknown);

        List<MigrationOutcome> migrations = new ArrayList<>();
        List<String> promoted = new ArrayList<>();
        String fast = fastNode();
        boolean promotionRound = current % policy.promotionInterval() == 0
                && residency.nodeCount() > 1 && fast != null;
        if (promotionRound) {
            List<MigrationOutcome> outcomes = migrateAll(promotionMoves(fast), MigrationReason.PROMOTION, current);
            for (MigrationOutcome o : outcomes) {
                if (o.status() == MigrationStatus.COMMITTED) {
                    promoted.add(o.fragmentId());
                }
            }
            migrations.addAll(outcomes);
        }

        List<String> evicted = new ArrayList<>();
        List<MigrationOutcome> evictions = migrateAll(evictionMoves(current), MigrationReason.EVICTION, current);
        for (MigrationOutcome o : evictions) {
            if (o.reachedTarget()) {
                leases.put(o.fragmentId(), current + policy.evictionGrace());
                evicted.add(o.fragmentId());
            }
        }
        migrations.addAll(evictions);

        EpochReport report = EpochReport.builder()
                .epoch(current)
                .accessed(accessed)
                .unknownAccesses(unknown)
                .promotionRound(promotionRound)
                .promoted(promoted)
                .evicted(evicted)
                .migrations(migrations)
                .build();
        if (!promoted.isEmpty() || !evicted.isEmpty() || !report.getFailures().isEmpty()) {
            log.info("[RESIDENCY] Epoch {}: accessed={}, promoted={}, evicted={} (sample {}), failures={}",
                    current, accessed.size(), promoted.size(), evicted.size(),
                    evicted.subList(0, Math.min(3, evicted.size())), report.getFailures().size());
        } else {
            log.debug("[RESIDENCY] Epoch {}: accessed={}, nothing moved", current, accessed.size());
        }
        return report;
    }

    private void applyAccesses(long current, Collection<String> accessedIds, List<String> accessed, List<String> unknown) {
        for (String id : accessedIds) {
            if (!fragments.containsKey(id)) {
                unknown.add(id);
                continue;
            }
            hotness.merge(id, policy.hotnessIncrement(), Double::sum);
            leases.put(id, Math.max(leases.get(id), current + policy.accessGrace()));
            accessed.add(id);
        }
        if (!unknown.isEmpty()) {
            log.warn("[RESIDENCY] Epoch {}: ignored {} access(es) to unknown fragments {}", current, unknown.size(), unknown);
        }
    }

    /** The hottest fragments, hotness descending then id ascending, mapped to the fast node. */
    private List<Move> promotionMoves(String fast) {
        Comparator<String> hottestFirst = Comparator.comparingDouble((String id) -> hotness.get(id)).reversed()
                .thenComparing(Comparator.<String>naturalOrder());
        return hotness.keySet().stream()
                .sorted(hottestFirst)
                .limit(policy.promotionFanOut())
                .map(id -> new Move(id, residency.nodeOf(id), fast))
                .collect(Collectors.toList());
    }

    private List<Move> evictionMoves(long current) {
        String fallback = fallbackNode();
        List<Move> moves = new ArrayList<>();
        if (fallback == null) return moves;
        for (Map.Entry<String, Long> lease : leases.entrySet()) {
            String id = lease.getKey();
            if (lease.getValue() <= current && hotness.get(id) < policy.evictHotnessThreshold()) {
                moves.add(new Move(id, residency.nodeOf(id), fallback));
            }
        }
        return moves;
    }

    // ============================================================================
    // Plan application
    // ============================================================================

    /**
     * Moves every known fragment whose residency differs from the plan to its planned node.
     * Leases and hotness are untouched; the epoch does not advance.
     */
    public PlanApplication applyPlan(PlacementPlan plan) {
        epochLock.lock();
        try {
            List<Move> moves = new ArrayList<>();
            List<String> untracked = new ArrayList<>();
            for (Map.Entry<String, String> a : plan.assignments().entrySet()) {
                if (!fragments.containsKey(a.getKey())) {
                    untracked.add(a.getKey());
                    continue;
                }
                if (!residency.hasNode(a.getValue())) {
                    throw new IllegalArgumentException("Plan places " + a.getKey() + " on unknown node " + a.getValue());
                }
                String from = residency.nodeOf(a.getKey());
                if (!from.equals(a.getValue())) {
                    moves.add(new Move(a.getKey(), from, a.getValue()));
                }
            }
            List<MigrationOutcome> outcomes = migrateAll(moves, MigrationReason.REBALANCE, epoch);
            log.info("[RESIDENCY] Applied plan at epoch {}: {} move(s), {} failure(s), {} untracked",
                    epoch, outcomes.size(), outcomes.stream().filter(MigrationOutcome::isFailure).count(), untracked.size());
            return new PlanApplication(epoch, outcomes, untracked);
        } finally {
            epochLock.unlock();
        }
    }

    // ============================================================================
    // Migration
    // ============================================================================

    /**
     * Dispatches every move, then waits for all of them. Map updates happen here, on the calling thread.
     */
    private List<MigrationOutcome> migrateAll(List<Move> moves, MigrationReason reason, long current) {
        List<MigrationOutcome> outcomes = new ArrayList<>();
        List<InFlight> inFlight = new ArrayList<>();
        for (Move m : moves) {
            if (m.from.equals(m.to)) {
                outcomes.add(MigrationOutcome.noOp(m.fragmentId, m.to, reason));
                continue;
            }
            if (outstanding.containsKey(m.fragmentId)) {
                outcomes.add(softFailure(m, reason, MigrationStatus.FAILED,
                        "previous transfer still outstanding", current));
                continue;
            }
            if (!residency.tryBeginMigration(m.fragmentId, m.to)) {
                outcomes.add(softFailure(m, reason, MigrationStatus.REJECTED_CAPACITY,
                        "node " + m.to + " lacks remaining budget", current));
                continue;
            }
            TransferRequest request = new TransferRequest(m.fragmentId, m.from, m.to,
                    fragments.get(m.fragmentId).getSize(), reason.getTransportPriority());
            try {
                inFlight.add(new InFlight(m, transport.migrate(request)));
            } catch (RuntimeException e) {
                residency.abortMigration(m.fragmentId);
                outcomes.add(softFailure(m, reason, MigrationStatus.FAILED, describe(e), current));
            }
        }

        long deadline = System.nanoTime() + policy.migrationTimeout().toNanos();
        for (InFlight p : inFlight) {
            outcomes.add(settle(p, reason, deadline, current));
        }
        return outcomes;
    }

    private MigrationOutcome settle(InFlight p, MigrationReason reason, long deadline, long current) {
        Move m = p.move;
        try {
            TransferReceipt receipt = p.future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            residency.commitMigration(m.fragmentId);
            return MigrationOutcome.committed(m.fragmentId, m.from, m.to, reason, receipt.latencySeconds());
        } catch (TimeoutException e) {
            residency.abortMigration(m.fragmentId);
            abandon(m.fragmentId, p.future);
            return softFailure(m, reason, MigrationStatus.TIMED_OUT,
                    "no answer within " + policy.migrationTimeout().toMillis() + "ms", current);
        } catch (ExecutionException e) {
            residency.abortMigration(m.fragmentId);
            return softFailure(m, reason, MigrationStatus.FAILED, describe(e.getCause()), current);
        } catch (CancellationException e) {
            residency.abortMigration(m.fragmentId);
            return softFailure(m, reason, MigrationStatus.FAILED, "transfer cancelled", current);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            residency.abortMigration(m.fragmentId);
            return softFailure(m, reason, MigrationStatus.FAILED, "interrupted while waiting for transport", current);
        }
    }

    private void abandon(String fragmentId, CompletableFuture<TransferReceipt> future) {
        outstanding.put(fragmentId, future);
        future.whenComplete((receipt, error) -> outstanding.remove(fragmentId, future));
    }

    private MigrationOutcome softFailure(Move m, MigrationReason reason, MigrationStatus status, String message, long current) {
        log.warn("[RESIDENCY] Epoch {}: {} of {} {} -> {} {}: {}", current, reason, m.fragmentId, m.from, m.to, status, message);
        return MigrationOutcome.failed(m.fragmentId, m.from, m.to, reason, status, message);
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown transport error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    // ============================================================================
    // Views
    // ============================================================================

    /** Fragments whose timed-out transfer has not resolved yet. */
    public int outstandingTransfers() {
        return outstanding.size();
    }

    public long currentEpoch() {
        return epoch;
    }

    public String fastNode() {
        if (policy.fastNode() != null) return policy.fastNode();
        List<String> ids = residency.nodeIds();
        return ids.size() > 1 ? ids.get(1) : null;
    }

    public String fallbackNode() {
        if (policy.fallbackNode() != null) return policy.fallbackNode();
        List<String> ids = residency.nodeIds();
        return ids.isEmpty() ? null : ids.get(0);
    }

    public ResidencyMap residencyMap() {
        return residency;
    }

    public boolean isKnown(String fragmentId) {
        epochLock.lock();
        try {
            return fragments.containsKey(fragmentId);
        } finally {
            epochLock.unlock();
        }
    }

    public OptionalLong leaseExpiry(String fragmentId) {
        epochLock.lock();
        try {
            Long expiry = leases.get(fragmentId);
            return expiry == null ? OptionalLong.empty() : OptionalLong.of(expiry);
        } finally {
            epochLock.unlock();
        }
    }

    public OptionalDouble hotness(String fragmentId) {
        epochLock.lock();
        try {
            Double h = hotness.get(fragmentId);
            return h == null ? OptionalDouble.empty() : OptionalDouble.of(h);
        } finally {
            epochLock.unlock();
        }
    }

    public ResidencySnapshot snapshot() {
        epochLock.lock();
        try {
            return new ResidencySnapshot(epoch, fastNode(), fallbackNode(), residency.snapshot(),
                    new TreeMap<>(leases), new TreeMap<>(hotness));
        } finally {
            epochLock.unlock();
        }
    }

    private static final class Move {
        final String fragmentId;
        final String from;
        final String to;

        Move(String fragmentId, String from, String to) {
            this.fragmentId = fragmentId;
            this.from = from;
            this.to = to;
        }
    }

    private static final class InFlight {
        final Move move;
        final CompletableFuture<TransferReceipt> future;

        InFlight(Move move, CompletableFuture<TransferReceipt> future) {
            this.move = move;
            this.future = future;
        }
    }
}
