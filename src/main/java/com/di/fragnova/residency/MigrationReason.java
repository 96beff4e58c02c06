package com.di.fragnova.residency;

/**
 * Why a migration was requested. The priority is passed to the transport; lower runs first.
 */
public enum MigrationReason {
    PROMOTION(0),
    REBALANCE(0),
    EVICTION(1);

    private final int transportPriority;

    MigrationReason(int transportPriority) {
        this.transportPriority = transportPriority;
    }

    public int getTransportPriority() {
        return transportPriority;
    }
}
