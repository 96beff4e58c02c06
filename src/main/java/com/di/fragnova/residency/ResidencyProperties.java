package com.di.fragnova.residency;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Residency controller tuning.
 *
 * <pre>
 * fragnova:
 *   residency:
 *     hotness-increment: 0.01
 *     access-grace: 2
 *     eviction-grace: 1
 *     evict-hotness-threshold: 0.5
 *     promotion-interval: 5
 *     promotion-fan-out: 4
 *     fast-node: "1"
 *     fallback-node: "0"
 *     migration-timeout: 5s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "fragnova.residency")
public class ResidencyProperties {

    /** Hotness added per access event. */
    private double hotnessIncrement = 0.01;

    /** An access keeps the lease alive until at least epoch + accessGrace. */
    private long accessGrace = 2;

    /** An evicted fragment's lease is reset to epoch + evictionGrace. */
    private long evictionGrace = 1;

    /** Expired fragments with hotness below this are evicted. */
    private double evictHotnessThreshold = 0.5;

    /** Promotion runs on epochs divisible by this interval. */
    private long promotionInterval = 5;

    /** How many of the hottest fragments each promotion round considers. */
    private int promotionFanOut = 4;

    /** Promotion target. Blank = second known node. */
    private String fastNode;

    /** Eviction target. Blank = first known node. */
    private String fallbackNode;

    /** Hotness of a newly registered fragment. */
    private double initialHotness = 0.0;

    /** A newly registered fragment's lease runs until epoch + initialLeaseEpochs. */
    private long initialLeaseEpochs = 2;

    /** Bounded wait for a migration before it is treated as failed. */
    private Duration migrationTimeout = Duration.ofSeconds(5);

    public ResidencyPolicy toPolicy() {
        return new ResidencyPolicy(hotnessIncrement, accessGrace, evictionGrace, evictHotnessThreshold,
                promotionInterval, promotionFanOut, blankToNull(fastNode), blankToNull(fallbackNode),
                initialHotness, initialLeaseEpochs, migrationTimeout);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
