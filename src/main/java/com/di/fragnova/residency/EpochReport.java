package com.di.fragnova.residency;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What one epoch did: accesses applied, fragments promoted and evicted, and every migration outcome.
 */
@Value
@Builder
public class EpochReport {
    long epoch;
    /** Known fragments whose access was applied, in request order (duplicates kept). */
    List<String> accessed;
    /** Access ids the controller does not track; ignored. */
    List<String> unknownAccesses;
    /** Whether this epoch ran a promotion round. */
    boolean promotionRound;
    /** Fragments now on the fast node because of this epoch's promotion round. */
    List<String> promoted;
    /** Fragments evicted to the fallback node this epoch (lease reset to epoch + eviction grace). */
    List<String> evicted;
    /** Every migration decided this epoch, including no-ops and failures. */
    List<MigrationOutcome> migrations;

    public List<MigrationOutcome> getFailures() {
        return migrations.stream().filter(MigrationOutcome::isFailure).collect(Collectors.toList());
    }
}
