package com.di.fragnova.service;

import com.di.fragnova.model.PlacementDescriptor;
import com.di.fragnova.placement.CostModel;
import com.di.fragnova.placement.PlacementPlan;
import com.di.fragnova.placement.PlacementPlanner;
import com.di.fragnova.placement.PlannerConfig;
import com.di.fragnova.placement.PlannerProperties;
import com.di.fragnova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the placement planner with the configured weights and records planning metrics.
 */
@Slf4j
@Service
public class PlacementService {

    private final PlacementPlanner planner;
    private final MetricsCollector metricsCollector;

    public PlacementService(PlannerProperties plannerProperties, MetricsCollector metricsCollector) {
        PlannerConfig config = plannerProperties.toPlannerConfig();
        this.planner = new PlacementPlanner(config);
        this.metricsCollector = metricsCollector;
        log.info("[PLACEMENT] Planner configured: {}", config);
    }

    public PlacementPlan plan(PlacementDescriptor descriptor) {
        long start = System.currentTimeMillis();
        try {
            PlacementPlan plan = planner.plan(descriptor.fragments(), descriptor.nodes());
            long durationMs = System.currentTimeMillis() - start;
            metricsCollector.recordPlanning(plan.assignments().size(), plan.unplaced().size(), durationMs);
            log.info("[PLACEMENT] Planned {} fragment(s) over {} node(s): placed={}, unplaced={} ({} never placeable), {}ms",
                    descriptor.fragments().size(), descriptor.nodes().size(), plan.assignments().size(),
                    plan.unplaced().size(), plan.neverPlaceableIds().size(), durationMs);
            return plan;
        } catch (RuntimeException e) {
            metricsCollector.recordPlanningError();
            throw e;
        }
    }

    public CostModel costModel() {
        return planner.getCostModel();
    }
}
