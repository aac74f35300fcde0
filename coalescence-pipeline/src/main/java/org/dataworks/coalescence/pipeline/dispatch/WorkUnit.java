package org.dataworks.coalescence.pipeline.dispatch;

import java.util.List;

import org.dataworks.coalescence.pipeline.ir.Batch;

/**
 * Batches that one worker coalesces sequentially, in order.
 */
public record WorkUnit(String id, List<Batch> batches) {
    public WorkUnit {
        batches = List.copyOf(batches);
    }
}
