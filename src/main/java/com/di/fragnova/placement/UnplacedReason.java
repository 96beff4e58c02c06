package com.di.fragnova.placement;

/**
 * Why a fragment ended a planning pass without a node.
 */
public enum UnplacedReason {
    /** Its cost exceeds every node's full budget; no retry with the same nodes can place it. */
    EXCEEDS_EVERY_BUDGET,
    /** It would fit on some empty node, but higher-ranked placements consumed the room. */
    CAPACITY_EXHAUSTED,
    /** There were no nodes to place on. */
    NO_NODES
}
