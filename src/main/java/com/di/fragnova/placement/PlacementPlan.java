package com.di.fragnova.placement;

import com.di.fragnova.model.ResourceUsage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Planner output: placed fragments (in commit order), unplaced fragments (in descriptor order)
 * and the budget consumed per node.
 */
public record PlacementPlan(
        Map<String, String> assignments,
        List<UnplacedFragment> unplaced,
        Map<String, ResourceUsage> nodeUsage) {

    public PlacementPlan {
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        unplaced = List.copyOf(unplaced);
        nodeUsage = Collections.unmodifiableMap(new LinkedHashMap<>(nodeUsage));
    }

    public static PlacementPlan empty() {
        return new PlacementPlan(Map.of(), List.of(), Map.of());
    }

    public Optional<String> nodeFor(String fragmentId) {
        return Optional.ofNullable(assignments.get(fragmentId));
    }

    public boolean isPlaced(String fragmentId) {
        return assignments.containsKey(fragmentId);
    }

    public List<String> unplacedIds() {
        return unplaced.stream().map(UnplacedFragment::fragmentId).collect(Collectors.toList());
    }

    /** Fragments that no retry against the same nodes can place. */
    public List<String> neverPlaceableIds() {
        return unplaced.stream()
                .filter(u -> u.reason() == UnplacedReason.EXCEEDS_EVERY_BUDGET)
                .map(UnplacedFragment::fragmentId)
                .collect(Collectors.toList());
    }
}
