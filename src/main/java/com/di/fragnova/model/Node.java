package com.di.fragnova.model;

import lombok.Builder;
import lombok.Value;

/**
 * A resource-constrained placement target.
 * <p>
 * {@code capacityBudget} is compared against the scalar placement cost. {@code unitBudget} is an optional
 * second dimension counting mapping-table slots (one slot per started unit of the configured unit size);
 * {@code null} leaves that dimension unconstrained.
 */
@Value
@Builder
public class Node {
    String id;
    long capacityBudget;
    Long unitBudget;
    @Builder.Default
    double predictedInterference = 0.0;

    public boolean hasUnitBudget() {
        return unitBudget != null;
    }
}
