package com.di.fragnova.residency;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of moving live fragments toward a new placement plan.
 *
 * @param migrations outcome per planned fragment whose residency differed from the plan
 * @param untracked  planned fragment ids the controller does not know; not moved
 */
public record PlanApplication(long epoch, List<MigrationOutcome> migrations, List<String> untracked) {

    public PlanApplication {
        migrations = List.copyOf(migrations);
        untracked = List.copyOf(untracked);
    }

    public List<MigrationOutcome> failures() {
        return migrations.stream().filter(MigrationOutcome::isFailure).collect(Collectors.toList());
    }
}
