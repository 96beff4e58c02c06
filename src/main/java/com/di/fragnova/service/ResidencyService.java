package com.di.fragnova.service;

import com.di.fragnova.exception.InvariantViolationException;
import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.PlacementDescriptor;
import com.di.fragnova.placement.PlacementPlan;
import com.di.fragnova.residency.EpochReport;
import com.di.fragnova.residency.MigrationOutcome;
import com.di.fragnova.residency.PlanApplication;
import com.di.fragnova.residency.ResidencyController;
import com.di.fragnova.residency.ResidencyMap;
import com.di.fragnova.residency.ResidencyProperties;
import com.di.fragnova.residency.ResidencySnapshot;
import com.di.fragnova.transport.Transport;
import com.di.fragnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Owns the live {@link ResidencyController}: seeds it from a descriptor's plan, advances epochs and
 * records residency metrics. Re-initializing replaces the controller and its state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResidencyService {

    private final PlacementService placementService;
    private final ResidencyProperties residencyProperties;
    private final Transport transport;
    private final MetricsCollector metricsCollector;

    private volatile ResidencyController controller;

    /**
     * Plans the descriptor and registers every placed fragment on its planned node. Unplaced fragments
     * fit on no node, so they stay unknown to the controller and are reported as untracked.
     */
    public synchronized ResidencyInitialization initialize(PlacementDescriptor descriptor) {
        if (descriptor.nodes().isEmpty()) {
            throw new IllegalArgumentException("Residency needs at least one node");
        }
        PlacementPlan plan = placementService.plan(descriptor);
        ResidencyController next = new ResidencyController(residencyProperties.toPolicy(),
                new ResidencyMap(descriptor.nodes()), transport, placementService.costModel());

        for (Fragment fragment : descriptor.fragments()) {
            String node = plan.assignments().get(fragment.getId());
            if (node != null && !next.register(fragment, node)) {
                throw new InvariantViolationException("Planned fragment " + fragment.getId()
                        + " does not fit its planned node " + node);
            }
        }
        controller = next;
        log.info("[RESIDENCY] Initialized: {} tracked, {} untracked, fast={}, fallback={}",
                plan.assignments().size(), plan.unplaced().size(), next.fastNode(), next.fallbackNode());
        return new ResidencyInitialization(plan, plan.unplacedIds());
    }

    public EpochReport step(Collection<String> accessed) {
        ResidencyController current = requireController();
        long start = System.currentTimeMillis();
        EpochReport report = current.step(accessed);
        metricsCollector.recordEpoch(System.currentTimeMillis() - start, report.getPromoted().size(),
                report.getEvicted().size(), report.getUnknownAccesses().size());
        recordMigrations(report.getMigrations());
        return report;
    }

    /** Replans the descriptor and moves tracked fragments toward the new plan. */
    public PlanApplication rebalance(PlacementDescriptor descriptor) {
        ResidencyController current = requireController();
        PlanApplication application = current.applyPlan(placementService.plan(descriptor));
        recordMigrations(application.migrations());
        return application;
    }

    public ResidencySnapshot snapshot() {
        return requireController().snapshot();
    }

    public boolean isInitialized() {
        return controller != null;
    }

    private void recordMigrations(List<MigrationOutcome> outcomes) {
        for (MigrationOutcome o : outcomes) {
            metricsCollector.recordMigration(o.reason().name(), o.status().name(), o.latencySeconds());
        }
    }

    private ResidencyController requireController() {
        ResidencyController current = controller;
        if (current == null) {
            throw new IllegalStateException("Residency controller is not initialized; POST /api/residency/initialize first");
        }
        return current;
    }
}
