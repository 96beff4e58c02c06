package com.di.fragnova.transport;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the simulated transfer engine.
 *
 * <pre>
 * fragnova:
 *   transport:
 *     base-latency: 2ms
 *     per-mib-latency: 1ms
 *     failure-rate: 0.0
 *     seed: 42
 *     completion-threads: 4
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "fragnova.transport")
public class TransportProperties {

    /** Fixed latency charged to every transfer. */
    private Duration baseLatency = Duration.ofMillis(2);

    /** Additional latency per whole MiB moved. */
    private Duration perMibLatency = Duration.ofMillis(1);

    /** Probability in [0, 1] that a transfer fails; used to exercise the failure path. */
    private double failureRate = 0.0;

    /** Seed for the failure draw, so failure sequences are reproducible. */
    private long seed = 42L;

    /** Threads completing in-flight transfers. */
    private int completionThreads = 4;
}
