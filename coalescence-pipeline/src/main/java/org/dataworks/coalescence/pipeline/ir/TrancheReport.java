package org.dataworks.coalescence.pipeline.ir;

import java.time.Duration;
import java.util.List;

/**
 * Timing and outcome of one tranche.
 *
 * @param trancheNumber 1-based position of the tranche in the listing
 * @param summaryCount number of objects listed in the tranche
 * @param malformedKeys keys skipped because they could not be parsed
 * @param batchCount number of batches formed
 * @param outcomes one outcome per batch
 * @param verdict true iff every batch succeeded and no stage failed
 * @param stage the last stage reached
 * @param failure why the tranche stopped before executing, or null
 * @param duration wall-clock time spent on the tranche
 */
public record TrancheReport(
    int trancheNumber,
    int summaryCount,
    List<String> malformedKeys,
    int batchCount,
    List<BatchOutcome> outcomes,
    boolean verdict,
    TrancheStage stage,
    String failure,
    Duration duration
) {
    public TrancheReport {
        malformedKeys = List.copyOf(malformedKeys);
        outcomes = List.copyOf(outcomes);
    }

    public long failedBatches() {
        return outcomes.stream().filter(outcome -> !outcome.success()).count();
    }
}
