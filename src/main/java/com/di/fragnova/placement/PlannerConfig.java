package com.di.fragnova.placement;

/**
 * Immutable cost and utility parameters for one planning pass.
 * Built from {@link PlannerProperties}; {@link #defaults()} gives the reference weights.
 */
public record PlannerConfig(
        long unitSize,
        double unitPressureWeight,
        double reuseWeight,
        double importanceWeight,
        double interferenceWeight) {

    public static final long DEFAULT_UNIT_SIZE = 4096L;
    public static final double DEFAULT_UNIT_PRESSURE_WEIGHT = 0.1;
    public static final double DEFAULT_REUSE_WEIGHT = 1.0;
    public static final double DEFAULT_IMPORTANCE_WEIGHT = 0.8;
    public static final double DEFAULT_INTERFERENCE_WEIGHT = 0.5;

    public PlannerConfig {
        if (unitSize <= 0) {
            throw new IllegalArgumentException("unitSize must be > 0, got " + unitSize);
        }
        if (!Double.isFinite(unitPressureWeight) || unitPressureWeight < 0) {
            throw new IllegalArgumentException("unitPressureWeight must be a finite value >= 0, got " + unitPressureWeight);
        }
    }

    public static PlannerConfig defaults() {
        return new PlannerConfig(DEFAULT_UNIT_SIZE, DEFAULT_UNIT_PRESSURE_WEIGHT,
                DEFAULT_REUSE_WEIGHT, DEFAULT_IMPORTANCE_WEIGHT, DEFAULT_INTERFERENCE_WEIGHT);
    }

    public PlannerConfig withWeights(double reuse, double importance, double interference) {
        return new PlannerConfig(unitSize, unitPressureWeight, reuse, importance, interference);
    }
}
