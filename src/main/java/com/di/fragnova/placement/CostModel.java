package com.di.fragnova.placement;

import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.ResourceUsage;

/**
 * Collapses raw bytes and mapping-unit pressure into one scalar cost:
 * {@code size + ceil(size / unitSize) * unitSize * unitPressureWeight}.
 */
public final class CostModel {

    private final long unitSize;
    private final double unitPressureWeight;

    public CostModel(PlannerConfig config) {
        this.unitSize = config.unitSize();
        this.unitPressureWeight = config.unitPressureWeight();
    }

    /** Mapping units a fragment occupies: one per started block of {@code unitSize} bytes. */
    public long units(Fragment fragment) {
        long size = fragment.getSize();
        if (size <= 0) return 0L;
        return size / unitSize + (size % unitSize == 0 ? 0 : 1);
    }

    /**
     * The node argument is unused by the scalar collapse; it is kept so a node-specific model can be swapped in.
     */
    public double cost(Fragment fragment, Node node) {
        return fragment.getSize() + (double) units(fragment) * unitSize * unitPressureWeight;
    }

    public ResourceUsage usage(Fragment fragment, Node node) {
        return new ResourceUsage(cost(fragment, node), units(fragment));
    }
}
