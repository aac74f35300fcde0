package org.dataworks.coalescence.pipeline.dispatch;

import java.util.List;
import java.util.stream.Collectors;

import org.dataworks.coalescence.pipeline.ir.BatchedTranche;

/**
 * One unit per batch, so the batches of a partition run in parallel.
 */
public class ByBatchStrategy implements DispatchStrategy {

    @Override
    public List<WorkUnit> plan(BatchedTranche batched) {
        return batched.batches()
            .map(batch -> new WorkUnit(batch.id(), List.of(batch)))
            .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "by-batch";
    }
}
