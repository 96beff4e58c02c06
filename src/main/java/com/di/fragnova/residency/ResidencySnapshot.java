package com.di.fragnova.residency;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of the controller state, taken between epochs.
 */
public record ResidencySnapshot(
        long epoch,
        String fastNode,
        String fallbackNode,
        Map<String, FragmentResidency> residency,
        Map<String, Long> leases,
        Map<String, Double> hotness) {

    public ResidencySnapshot {
        residency = Collections.unmodifiableMap(new TreeMap<>(residency));
        leases = Collections.unmodifiableMap(new TreeMap<>(leases));
        hotness = Collections.unmodifiableMap(new TreeMap<>(hotness));
    }
}
