package org.dataworks.coalescence.pipeline.dispatch;

import java.util.List;
import java.util.stream.Collectors;

import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchedTranche;

/**
 * One unit per partition: a worker coalesces all of a partition's batches in turn. This keeps the number of
 * concurrent store clients down to the number of partitions.
 */
public class ByPartitionStrategy implements DispatchStrategy {

    @Override
    public List<WorkUnit> plan(BatchedTranche batched) {
        return batched.partitions()
            .filter(batches -> !batches.isEmpty())
            .map(batches -> new WorkUnit(unitId(batches.get(0)), batches))
            .collect(Collectors.toList());
    }

    private static String unitId(Batch first) {
        return first.topic() + "/" + first.partition();
    }

    @Override
    public String toString() {
        return "by-partition";
    }
}
