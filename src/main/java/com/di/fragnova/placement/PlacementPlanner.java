package com.di.fragnova.placement;

import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy utility-per-cost assignment of fragments to nodes under per-node budgets.
 * <p>
 * Every (fragment, node) pair is ranked by rho = utility / cost, ties broken by fragment id then node id.
 * Pairs are taken in rank order: a pair commits when its fragment is still unplaced and the node's remaining
 * budget admits the cost; otherwise the fragment stays eligible for its next-ranked node. This approximates
 * multi-knapsack packing; it is not globally optimal.
 * <p>
 * Pure: no shared state, no transfers. Concurrent calls on different inputs are safe.
 */
public final class PlacementPlanner {

    private final CostModel costModel;
    private final UtilityModel utilityModel;

    public PlacementPlanner(PlannerConfig config) {
        this.costModel = new CostModel(config);
        this.utilityModel = new UtilityModel(config);
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public PlacementPlan plan(List<Fragment> fragments, List<Node> nodes) {
        if (fragments == null || fragments.isEmpty()) {
            return PlacementPlan.empty();
        }
        if (nodes == null || nodes.isEmpty()) {
            List<UnplacedFragment> unplaced = new ArrayList<>();
            for (Fragment f : fragments) {
                unplaced.add(new UnplacedFragment(f.getId(), UnplacedReason.NO_NODES));
            }
            return new PlacementPlan(Map.of(), unplaced, Map.of());
        }

        List<PlacementCandidate> ranked = rankCandidates(fragments, nodes);
        Map<String, String> assignments = new LinkedHashMap<>();
        BudgetLedger ledger = assign(ranked, BudgetLedger.open(nodes), assignments);

        List<UnplacedFragment> unplaced = new ArrayList<>();
        for (Fragment f : fragments) {
            if (!assignments.containsKey(f.getId())) {
                unplaced.add(new UnplacedFragment(f.getId(), reasonFor(f, nodes)));
            }
        }
        return new PlacementPlan(assignments, unplaced, ledger.usageByNode());
    }

    /**
     * All pairs with a positive cost, sorted by {@link PlacementCandidate#BY_RANK}.
     */
    List<PlacementCandidate> rankCandidates(List<Fragment> fragments, List<Node> nodes) {
        List<PlacementCandidate> candidates = new ArrayList<>(fragments.size() * nodes.size());
        for (Fragment f : fragments) {
            for (Node n : nodes) {
                ResourceUsage usage = costModel.usage(f, n);
                if (usage.cost() <= 0) continue;
                candidates.add(new PlacementCandidate(f, n, utilityModel.utility(f, n), usage));
            }
        }
        candidates.sort(PlacementCandidate.BY_RANK);
        return candidates;
    }

    /**
     * Commits candidates in order into {@code assignments} and returns the ledger after the last commit.
     */
    BudgetLedger assign(List<PlacementCandidate> ranked, BudgetLedger ledger, Map<String, String> assignments) {
        BudgetLedger current = ledger;
        for (PlacementCandidate c : ranked) {
            if (assignments.containsKey(c.fragmentId())) continue;
            if (current.admits(c.nodeId(), c.usage())) {
                current = current.commit(c.nodeId(), c.usage());
                assignments.put(c.fragmentId(), c.nodeId());
            }
        }
        return current;
    }

    private UnplacedReason reasonFor(Fragment fragment, List<Node> nodes) {
        for (Node n : nodes) {
            if (ResourceUsage.NONE.admits(costModel.usage(fragment, n), n)) {
                return UnplacedReason.CAPACITY_EXHAUSTED;
            }
        }
        return UnplacedReason.EXCEEDS_EVERY_BUDGET;
    }
}
