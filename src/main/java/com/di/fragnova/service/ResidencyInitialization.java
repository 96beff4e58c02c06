package com.di.fragnova.service;

import com.di.fragnova.placement.PlacementPlan;

import java.util.List;

/**
 * Result of seeding the residency controller from a descriptor.
 *
 * @param plan      the plan the controller was seeded from
 * @param untracked fragments the plan could not place; the controller does not know them
 */
public record ResidencyInitialization(PlacementPlan plan, List<String> untracked) {

    public ResidencyInitialization {
        untracked = List.copyOf(untracked);
    }
}
