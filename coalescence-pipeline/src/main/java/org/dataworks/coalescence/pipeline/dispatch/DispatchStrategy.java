package org.dataworks.coalescence.pipeline.dispatch;

import java.util.List;

import org.dataworks.coalescence.pipeline.ir.BatchedTranche;

/**
 * Decides the granularity at which a tranche's batches are handed to workers.
 */
public interface DispatchStrategy {

    /**
     * Split the tranche into units of work. Every batch appears in exactly one unit.
     */
    List<WorkUnit> plan(BatchedTranche batched);
}
