package com.di.fragnova.placement;

import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;

import java.util.Comparator;

/**
 * One (fragment, node) pair with its utility, cost and rho = utility / cost.
 */
public record PlacementCandidate(Fragment fragment, Node node, double utility, ResourceUsage usage) {

    /** rho descending, then fragment id, then node id (both lexical ascending). */
    public static final Comparator<PlacementCandidate> BY_RANK =
            Comparator.comparingDouble(PlacementCandidate::rho).reversed()
                    .thenComparing(PlacementCandidate::fragmentId)
                    .thenComparing(PlacementCandidate::nodeId);

    public double cost() {
        return usage.cost();
    }

    public double rho() {
        return utility / usage.cost();
    }

    public String fragmentId() {
        return fragment.getId();
    }

    public String nodeId() {
        return node.getId();
    }
}
