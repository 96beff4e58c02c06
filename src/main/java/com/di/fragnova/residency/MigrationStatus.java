package com.di.fragnova.residency;

/**
 * How a requested migration ended.
 */
public enum MigrationStatus {
    /** Transport reported success; residency moved. */
    COMMITTED(false),
    /** Source equals destination; nothing was sent. */
    NO_OP(false),
    /** Transport reported an error. */
    FAILED(true),
    /** Transport did not answer within the migration timeout. */
    TIMED_OUT(true),
    /** The destination lacked remaining budget; nothing was sent. */
    REJECTED_CAPACITY(true);

    private final boolean failure;

    MigrationStatus(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }
}
