package com.di.fragnova.model;

import java.util.List;

/**
 * Validated snapshot handed to the planner: fragments and nodes in descriptor order.
 */
public record PlacementDescriptor(List<Fragment> fragments, List<Node> nodes) {

    public PlacementDescriptor {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
