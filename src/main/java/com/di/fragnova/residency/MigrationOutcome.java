package com.di.fragnova.residency;

/**
 * Result of one requested migration. Failures are soft: residency stays at {@code from} and the fragment
 * is reconsidered next epoch.
 */
public record MigrationOutcome(
        String fragmentId,
        String from,
        String to,
        MigrationReason reason,
        MigrationStatus status,
        double latencySeconds,
        String message) {

    public static MigrationOutcome committed(String fragmentId, String from, String to, MigrationReason reason, double latency) {
        return new MigrationOutcome(fragmentId, from, to, reason, MigrationStatus.COMMITTED, latency, null);
    }

    public static MigrationOutcome noOp(String fragmentId, String node, MigrationReason reason) {
        return new MigrationOutcome(fragmentId, node, node, reason, MigrationStatus.NO_OP, 0.0, null);
    }

    public static MigrationOutcome failed(String fragmentId, String from, String to, MigrationReason reason,
                                          MigrationStatus status, String message) {
        return new MigrationOutcome(fragmentId, from, to, reason, status, 0.0, message);
    }

    public boolean isFailure() {
        return status.isFailure();
    }

    /** True when the fragment now sits on {@code to}, whether it moved or already was there. */
    public boolean reachedTarget() {
        return status == MigrationStatus.COMMITTED || status == MigrationStatus.NO_OP;
    }
}
