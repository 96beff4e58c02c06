package com.di.fragnova.residency;

import com.di.fragnova.exception.InvariantViolationException;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fragment to node mapping, total over the fragments it knows: each has exactly one current node.
 * <p>
 * Node usage counts resident fragments plus capacity reserved by inbound migrations, so a node never
 * holds more than its budget even while several moves toward it are outstanding. A fragment can only
 * start a migration while {@link ResidencyStatus#RESIDENT}; a second concurrent start is an
 * {@link InvariantViolationException}.
 * <p>
 * Mutated by one writer (the residency controller's epoch thread); methods are synchronized so readers
 * get a consistent view.
 */
public class ResidencyMap {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, ResourceUsage> nodeUsage = new LinkedHashMap<>();
    private final Map<String, FragmentResidency> entries = new TreeMap<>();
    private final Map<String, ResourceUsage> fragmentUsage = new TreeMap<>();

    public ResidencyMap(List<Node> nodes) {
        for (Node node : nodes) {
            addNode(node);
        }
    }

    public synchronized void addNode(Node node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Node " + node.getId() + " is already known");
        }
        nodes.put(node.getId(), node);
        nodeUsage.put(node.getId(), ResourceUsage.NONE);
    }

    /**
     * Initial placement of a fragment the map has never seen.
     *
     * @return false if the node's remaining budget cannot hold it
     */
    public synchronized boolean place(String fragmentId, String nodeId, ResourceUsage usage) {
        if (entries.containsKey(fragmentId)) {
            throw new IllegalArgumentException("Fragment " + fragmentId + " is already placed on "
                    + entries.get(fragmentId).node());
        }
        Node node = requireNode(nodeId);
        if (!nodeUsage.get(nodeId).admits(usage, node)) {
            return false;
        }
        nodeUsage.put(nodeId, nodeUsage.get(nodeId).plus(usage));
        entries.put(fragmentId, FragmentResidency.resident(nodeId));
        fragmentUsage.put(fragmentId, usage);
        return true;
    }

    /**
     * Moves a resident fragment to {@code MIGRATING(current -> target)} and reserves its usage on the target.
     *
     * @return false, leaving the fragment resident, when the target's remaining budget cannot take it
     * @throws InvariantViolationException if the fragment already has an outstanding migration
     */
    public synchronized boolean tryBeginMigration(String fragmentId, String target) {
        FragmentResidency current = require(fragmentId);
        if (current.isMigrating()) {
            throw new InvariantViolationException("Fragment " + fragmentId
                    + " already has an outstanding migration " + current);
        }
        if (current.node().equals(target)) {
            throw new IllegalArgumentException("Fragment " + fragmentId + " is already on " + target);
        }
        Node node = requireNode(target);
        ResourceUsage usage = fragmentUsage.get(fragmentId);
        if (!nodeUsage.get(target).admits(usage, node)) {
            return false;
        }
        nodeUsage.put(target, nodeUsage.get(target).plus(usage));
        entries.put(fragmentId, FragmentResidency.migrating(current.node(), target));
        return true;
    }

    /**
     * Commits an outstanding migration: the fragment becomes resident on the target and the source is released.
     */
    public synchronized void commitMigration(String fragmentId) {
        FragmentResidency current = requireMigrating(fragmentId);
        String target = current.target();
        if (!nodeUsage.get(target).withinBudget(nodes.get(target))) {
            throw new InvariantViolationException("Commit of " + fragmentId + " leaves node " + target
                    + " over budget: " + nodeUsage.get(target));
        }
        release(current.node(), fragmentUsage.get(fragmentId));
        entries.put(fragmentId, FragmentResidency.resident(target));
    }

    /**
     * Abandons an outstanding migration: the fragment stays on its source and the target reservation is dropped.
     */
    public synchronized void abortMigration(String fragmentId) {
        FragmentResidency current = requireMigrating(fragmentId);
        release(current.target(), fragmentUsage.get(fragmentId));
        entries.put(fragmentId, FragmentResidency.resident(current.node()));
    }

    public synchronized boolean contains(String fragmentId) {
        return entries.containsKey(fragmentId);
    }

    public synchronized boolean hasNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public synchronized Node node(String nodeId) {
        return requireNode(nodeId);
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    /** Node ids in registration order. */
    public synchronized List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public synchronized Optional<FragmentResidency> residency(String fragmentId) {
        return Optional.ofNullable(entries.get(fragmentId));
    }

    /** Current node of a known fragment (the source while it is migrating). */
    public synchronized String nodeOf(String fragmentId) {
        return require(fragmentId).node();
    }

    public synchronized ResourceUsage usage(String nodeId) {
        requireNode(nodeId);
        return nodeUsage.get(nodeId);
    }

    public synchronized int inFlightCount() {
        return (int) entries.values().stream().filter(FragmentResidency::isMigrating).count();
    }

    /** Fragment ids currently resident on (or migrating away from) the node, ascending. */
    public synchronized List<String> fragmentsOn(String nodeId) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, FragmentResidency> e : entries.entrySet()) {
            if (e.getValue().node().equals(nodeId)) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    /** Sorted copy of every entry. */
    public synchronized Map<String, FragmentResidency> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    /** One line per fragment, for diagnostics. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder("ResidencyMap dump:\n");
        entries.forEach((id, r) -> sb.append(String.format("%s -> %s cost=%.1f units=%d%n",
                id, r, fragmentUsage.get(id).cost(), fragmentUsage.get(id).units())));
        nodes.keySet().forEach(n -> sb.append(String.format("node %s used=%.1f/%d units=%d%n",
                n, nodeUsage.get(n).cost(), nodes.get(n).getCapacityBudget(), nodeUsage.get(n).units())));
        return sb.toString();
    }

    private void release(String nodeId, ResourceUsage usage) {
        nodeUsage.put(nodeId, nodeUsage.get(nodeId).minus(usage));
    }

    private FragmentResidency require(String fragmentId) {
        FragmentResidency r = entries.get(fragmentId);
        if (r == null) {
            throw new IllegalArgumentException("Unknown fragment " + fragmentId);
        }
        return r;
    }

    private FragmentResidency requireMigrating(String fragmentId) {
        FragmentResidency r = require(fragmentId);
        if (!r.isMigrating()) {
            throw new InvariantViolationException("Fragment " + fragmentId + " has no outstanding migration");
        }
        return r;
    }

    private Node requireNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + nodeId);
        }
        return node;
    }
}
