package com.di.fragnova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for placement planning and the per-epoch residency loop.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Placement Planning Metrics
    private final Counter planningCounter;
    private final Counter planningErrorCounter;
    private final Timer planningTimer;
    private final DistributionSummary placedDistribution;
    private final DistributionSummary unplacedDistribution;

    // Residency Metrics
    private final Timer epochTimer;
    private final Counter promotionCounter;
    private final Counter evictionCounter;
    private final Counter unknownAccessCounter;
    private final DistributionSummary migrationLatency;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.planningCounter = Counter.builder("placement.planning.total")
                .description("Total number of placement planning passes")
                .tag("status", "success")
                .register(meterRegistry);

        this.planningErrorCounter = Counter.builder("placement.planning.total")
                .description("Total number of failed placement planning passes")
                .tag("status", "error")
                .register(meterRegistry);

        this.planningTimer = Timer.builder("placement.planning.duration")
                .description("Time taken to compute a placement plan")
                .register(meterRegistry);

        this.placedDistribution = DistributionSummary.builder("placement.fragments.placed")
                .description("Fragments placed per planning pass")
                .baseUnit("fragments")
                .register(meterRegistry);

        this.unplacedDistribution = DistributionSummary.builder("placement.fragments.unplaced")
                .description("Fragments left unplaced per planning pass")
                .baseUnit("fragments")
                .register(meterRegistry);

        this.epochTimer = Timer.builder("residency.epoch.duration")
                .description("Time taken to process one epoch, including migrations")
                .register(meterRegistry);

        this.promotionCounter = Counter.builder("residency.promotions")
                .description("Fragments moved to the fast node by promotion")
                .register(meterRegistry);

        this.evictionCounter = Counter.builder("residency.evictions")
                .description("Fragments evicted to the fallback node")
                .register(meterRegistry);

        this.unknownAccessCounter = Counter.builder("residency.access.unknown")
                .description("Access events naming fragments the controller does not track")
                .register(meterRegistry);

        this.migrationLatency = DistributionSummary.builder("residency.migration.latency")
                .description("Transport-reported migration latency")
                .baseUnit("seconds")
                .register(meterRegistry);
    }

    // ============================================================================
    // Placement Planning Metrics
    // ============================================================================

    /**
     * Records a successful planning pass.
     *
     * @param placed     fragments that received a node
     * @param unplaced   fragments left without one
     * @param durationMs time taken in milliseconds
     */
    public void recordPlanning(int placed, int unplaced, long durationMs) {
        planningCounter.increment();
        planningTimer.record(durationMs, TimeUnit.MILLISECONDS);
        placedDistribution.record(placed);
        unplacedDistribution.record(unplaced);
        log.debug("Recorded planning: placed={}, unplaced={}, durationMs={}", placed, unplaced, durationMs);
    }

    public void recordPlanningError() {
        planningErrorCounter.increment();
    }

    // ============================================================================
    // Residency Metrics
    // ============================================================================

    public void recordEpoch(long durationMs, int promoted, int evicted, int unknownAccesses) {
        epochTimer.record(durationMs, TimeUnit.MILLISECONDS);
        promotionCounter.increment(promoted);
        evictionCounter.increment(evicted);
        unknownAccessCounter.increment(unknownAccesses);
    }

    /**
     * Records one migration outcome, tagged by why it was requested and how it ended.
     */
    public void recordMigration(String reason, String outcome, double latencySeconds) {
        meterRegistry.counter("residency.migrations", "reason", reason, "outcome", outcome).increment();
        if ("COMMITTED".equals(outcome)) {
            migrationLatency.record(latencySeconds);
        }
    }
}
