package org.dataworks.coalescence.pipeline;

import java.util.List;

import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

/**
 * Reduces batch outcomes to a single verdict: true iff every batch succeeded.
 */
public class ResultAggregator {

    /**
     * @param unitOutcomes the outcomes of each dispatched unit of work
     * @param strictSinglePartition whether a single partition was targeted, so each unit holds one batch
     * @return the tranche verdict
     */
    public boolean aggregate(List<List<BatchOutcome>> unitOutcomes, boolean strictSinglePartition) {
        if (strictSinglePartition) {
            return unitOutcomes.stream().allMatch(ResultAggregator::allSucceeded);
        }
        return allSucceeded(unitOutcomes.stream().flatMap(List::stream).toList());
    }

    public static boolean allSucceeded(List<BatchOutcome> outcomes) {
        return outcomes.stream().allMatch(BatchOutcome::success);
    }
}
