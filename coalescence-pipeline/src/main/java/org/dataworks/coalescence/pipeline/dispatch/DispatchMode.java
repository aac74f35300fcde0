package org.dataworks.coalescence.pipeline.dispatch;

import org.dataworks.coalescence.pipeline.GroupingEngine;

/**
 * The configurable choice of {@link DispatchStrategy}.
 */
public enum DispatchMode {
    BATCH(new ByBatchStrategy()),
    PARTITION(new ByPartitionStrategy());

    private final DispatchStrategy strategy;

    DispatchMode(DispatchStrategy strategy) {
        this.strategy = strategy;
    }

    public DispatchStrategy strategy() {
        return strategy;
    }

    /**
     * Batches of a single targeted partition are spread across workers; when every partition is processed,
     * partitions are.
     */
    public static DispatchMode defaultFor(int partition) {
        return partition == GroupingEngine.ALL_PARTITIONS ? PARTITION : BATCH;
    }
}
