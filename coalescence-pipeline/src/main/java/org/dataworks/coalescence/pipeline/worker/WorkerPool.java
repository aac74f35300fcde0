package org.dataworks.coalescence.pipeline.worker;

import java.util.List;
import java.util.concurrent.Future;

import org.dataworks.coalescence.pipeline.dispatch.WorkUnit;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

/**
 * A bounded set of workers that coalesce units of work concurrently.
 * Threads and processes are interchangeable implementations.
 */
public interface WorkerPool extends AutoCloseable {

    /**
     * Queue a unit of work.
     * @param unit the batches to coalesce, in order, on one worker
     * @return the outcomes of the unit's batches, in the unit's order
     */
    Future<List<BatchOutcome>> submit(WorkUnit unit);

    /** The number of units that can run at the same time. */
    int concurrency();

    @Override
    void close();

    /** Zero or less leaves the choice to the pool: one worker per available processor. */
    static int resolveConcurrency(int workers) {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }
}
