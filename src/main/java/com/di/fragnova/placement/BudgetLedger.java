package com.di.fragnova.placement;

import com.di.fragnova.exception.InvariantViolationException;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-node budget consumption for a single planning pass.
 * <p>
 * Immutable: {@link #commit(String, ResourceUsage)} returns a new ledger, so each pass threads its own
 * accumulator and independent passes never share bookkeeping.
 */
public final class BudgetLedger {

    private final Map<String, Node> nodes;
    private final Map<String, ResourceUsage> used;

    private BudgetLedger(Map<String, Node> nodes, Map<String, ResourceUsage> used) {
        this.nodes = nodes;
        this.used = used;
    }

    /** A ledger with nothing consumed on any node. */
    public static BudgetLedger open(Collection<Node> nodes) {
        Map<String, Node> byId = new LinkedHashMap<>();
        Map<String, ResourceUsage> usage = new LinkedHashMap<>();
        for (Node node : nodes) {
            byId.put(node.getId(), node);
            usage.put(node.getId(), ResourceUsage.NONE);
        }
        return new BudgetLedger(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(usage));
    }

    public boolean admits(String nodeId, ResourceUsage demand) {
        Node node = nodes.get(nodeId);
        return node != null && used.get(nodeId).admits(demand, node);
    }

    public BudgetLedger commit(String nodeId, ResourceUsage demand) {
        if (!admits(nodeId, demand)) {
            throw new InvariantViolationException(String.format(
                    "Commit of cost %.1f / %d units would exceed budget of node %s (used %s)",
                    demand.cost(), demand.units(), nodeId, used.get(nodeId)));
        }
        Map<String, ResourceUsage> next = new LinkedHashMap<>(used);
        next.put(nodeId, used.get(nodeId).plus(demand));
        return new BudgetLedger(nodes, Collections.unmodifiableMap(next));
    }

    public ResourceUsage used(String nodeId) {
        return used.getOrDefault(nodeId, ResourceUsage.NONE);
    }

    public double remainingCapacity(String nodeId) {
        Node node = nodes.get(nodeId);
        return node == null ? 0.0 : node.getCapacityBudget() - used(nodeId).cost();
    }

    public Map<String, ResourceUsage> usageByNode() {
        return used;
    }
}
