package com.di.fragnova.model;

/**
 * Consumption against a node's budgets: scalar cost plus mapping units.
 */
public record ResourceUsage(double cost, long units) {

    public static final ResourceUsage NONE = new ResourceUsage(0.0, 0L);

    public ResourceUsage plus(ResourceUsage other) {
        return new ResourceUsage(cost + other.cost, units + other.units);
    }

    public ResourceUsage minus(ResourceUsage other) {
        return new ResourceUsage(cost - other.cost, units - other.units);
    }

    /**
     * Whether {@code demand} fits on top of this usage without exceeding the node's budgets.
     */
    public boolean admits(ResourceUsage demand, Node node) {
        if (cost + demand.cost > node.getCapacityBudget()) return false;
        return !node.hasUnitBudget() || units + demand.units <= node.getUnitBudget();
    }

    public boolean withinBudget(Node node) {
        return admits(NONE, node);
    }
}
