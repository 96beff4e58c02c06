package com.di.fragnova.placement;

import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;

/**
 * {@code max(0, w_r * reuse + w_i * importance - w_c * interference)}.
 */
public final class UtilityModel {

    private final double reuseWeight;
    private final double importanceWeight;
    private final double interferenceWeight;

    public UtilityModel(PlannerConfig config) {
        this.reuseWeight = config.reuseWeight();
        this.importanceWeight = config.importanceWeight();
        this.interferenceWeight = config.interferenceWeight();
    }

    public double utility(Fragment fragment, Node node) {
        double raw = reuseWeight * fragment.getReuse()
                + importanceWeight * fragment.getImportance()
                - interferenceWeight * node.getPredictedInterference();
        return Math.max(0.0, raw);
    }
}
