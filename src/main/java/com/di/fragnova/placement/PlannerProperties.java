package com.di.fragnova.placement;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Planner cost model constants and utility weights.
 *
 * <pre>
 * fragnova:
 *   planner:
 *     unit-size: 4096
 *     unit-pressure-weight: 0.1
 *     reuse-weight: 1.0
 *     importance-weight: 0.8
 *     interference-weight: 0.5
 * </pre>
 */
@ConfigurationProperties(prefix = "fragnova.planner")
public class PlannerProperties {

    /** Bytes per mapping unit (one unit per started block). */
    private long unitSize = PlannerConfig.DEFAULT_UNIT_SIZE;
    /** Weight of mapping-unit pressure folded into the scalar cost. */
    private double unitPressureWeight = PlannerConfig.DEFAULT_UNIT_PRESSURE_WEIGHT;
    private double reuseWeight = PlannerConfig.DEFAULT_REUSE_WEIGHT;
    private double importanceWeight = PlannerConfig.DEFAULT_IMPORTANCE_WEIGHT;
    private double interferenceWeight = PlannerConfig.DEFAULT_INTERFERENCE_WEIGHT;

    public long getUnitSize() {
        return unitSize;
    }

    public void setUnitSize(long unitSize) {
        this.unitSize = unitSize;
    }

    public double getUnitPressureWeight() {
        return unitPressureWeight;
    }

    public void setUnitPressureWeight(double unitPressureWeight) {
        this.unitPressureWeight = unitPressureWeight;
    }

    public double getReuseWeight() {
        return reuseWeight;
    }

    public void setReuseWeight(double reuseWeight) {
        this.reuseWeight = reuseWeight;
    }

    public double getImportanceWeight() {
        return importanceWeight;
    }

    public void setImportanceWeight(double importanceWeight) {
        this.importanceWeight = importanceWeight;
    }

    public double getInterferenceWeight() {
        return interferenceWeight;
    }

    public void setInterferenceWeight(double interferenceWeight) {
        this.interferenceWeight = interferenceWeight;
    }

    /** Builds the immutable config used by {@link PlacementPlanner} (avoids passing the bound properties around). */
    public PlannerConfig toPlannerConfig() {
        return new PlannerConfig(unitSize, unitPressureWeight, reuseWeight, importanceWeight, interferenceWeight);
    }
}
