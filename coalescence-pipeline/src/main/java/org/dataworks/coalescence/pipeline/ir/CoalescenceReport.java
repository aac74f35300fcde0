package org.dataworks.coalescence.pipeline.ir;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a whole run: every tranche the listing produced.
 *
 * @param tranches the tranche reports, in listing order
 * @param listingFailure why the listing stopped early, or null if it ran to the end
 * @param duration wall-clock time of the run
 */
public record CoalescenceReport(List<TrancheReport> tranches, String listingFailure, Duration duration) {

    public CoalescenceReport {
        tranches = List.copyOf(tranches);
    }

    /** True iff the listing completed and every tranche succeeded. */
    public boolean successful() {
        return listingFailure == null && tranches.stream().allMatch(TrancheReport::verdict);
    }

    public int exitCode() {
        return successful() ? 0 : 1;
    }
}
