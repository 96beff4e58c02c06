package com.di.fragnova.residency;

/**
 * Where a fragment lives right now: {@code RESIDENT(node)} or {@code MIGRATING(node -> target)}.
 * While migrating, {@code node} is still the source; it only changes when the move commits.
 */
public record FragmentResidency(ResidencyStatus status, String node, String target) {

    public static FragmentResidency resident(String node) {
        return new FragmentResidency(ResidencyStatus.RESIDENT, node, null);
    }

    public static FragmentResidency migrating(String from, String to) {
        return new FragmentResidency(ResidencyStatus.MIGRATING, from, to);
    }

    public boolean isMigrating() {
        return status == ResidencyStatus.MIGRATING;
    }

    @Override
    public String toString() {
        return isMigrating() ? "MIGRATING(" + node + "->" + target + ")" : "RESIDENT(" + node + ")";
    }
}
