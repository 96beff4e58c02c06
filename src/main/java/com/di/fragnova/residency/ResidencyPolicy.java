package com.di.fragnova.residency;

import java.time.Duration;

/**
 * Immutable per-epoch policy for {@link ResidencyController}. Built from {@link ResidencyProperties}.
 * <p>
 * {@code fastNode} and {@code fallbackNode} may be null: the controller then uses the second and first
 * known node respectively.
 */
public record ResidencyPolicy(
        double hotnessIncrement,
        long accessGrace,
        long evictionGrace,
        double evictHotnessThreshold,
        long promotionInterval,
        int promotionFanOut,
        String fastNode,
        String fallbackNode,
        double initialHotness,
        long initialLeaseEpochs,
        Duration migrationTimeout) {

    public ResidencyPolicy {
        if (hotnessIncrement <= 0) {
            throw new IllegalArgumentException("hotnessIncrement must be > 0, got " + hotnessIncrement);
        }
        if (promotionInterval <= 0) {
            throw new IllegalArgumentException("promotionInterval must be > 0, got " + promotionInterval);
        }
        if (promotionFanOut < 0) {
            throw new IllegalArgumentException("promotionFanOut must be >= 0, got " + promotionFanOut);
        }
        if (initialHotness < 0) {
            throw new IllegalArgumentException("initialHotness must be >= 0, got " + initialHotness);
        }
        if (migrationTimeout == null || migrationTimeout.isNegative() || migrationTimeout.isZero()) {
            throw new IllegalArgumentException("migrationTimeout must be positive");
        }
    }

    public static ResidencyPolicy defaults() {
        return new ResidencyProperties().toPolicy();
    }

    public ResidencyPolicy withNodes(String fast, String fallback) {
        return new ResidencyPolicy(hotnessIncrement, accessGrace, evictionGrace, evictHotnessThreshold,
                promotionInterval, promotionFanOut, fast, fallback, initialHotness, initialLeaseEpochs, migrationTimeout);
    }

    public ResidencyPolicy withPromotion(long interval, int fanOut) {
        return new ResidencyPolicy(hotnessIncrement, accessGrace, evictionGrace, evictHotnessThreshold,
                interval, fanOut, fastNode, fallbackNode, initialHotness, initialLeaseEpochs, migrationTimeout);
    }

    public ResidencyPolicy withMigrationTimeout(Duration timeout) {
        return new ResidencyPolicy(hotnessIncrement, accessGrace, evictionGrace, evictHotnessThreshold,
                promotionInterval, promotionFanOut, fastNode, fallbackNode, initialHotness, initialLeaseEpochs, timeout);
    }
}
