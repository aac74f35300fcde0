package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import org.dataworks.coalescence.pipeline.dispatch.DispatchStrategy;
import org.dataworks.coalescence.pipeline.dispatch.WorkUnit;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;
import org.dataworks.coalescence.pipeline.ir.BatchedTranche;
import org.dataworks.coalescence.pipeline.worker.WorkerPool;

import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches a tranche's batches to a worker pool and waits for every unit of work to finish.
 *
 * A unit that fails as a whole (its worker died, the pool refused it) is reported as failed outcomes for each
 * of its batches; other units are unaffected.
 */
@Slf4j
public class TrancheExecutor {

    /**
     * @return the outcomes of each unit of work, in the order the strategy planned them
     */
    public List<List<BatchOutcome>> execute(BatchedTranche batched, DispatchStrategy strategy, WorkerPool pool) {
        List<WorkUnit> units = strategy.plan(batched);
        log.info("Dispatching {} batches as {} units of work {} across {} workers",
            batched.batchCount(), units.size(), strategy, pool.concurrency());

        List<Future<List<BatchOutcome>>> futures = new ArrayList<>(units.size());
        for (WorkUnit unit : units) {
            futures.add(submit(pool, unit));
        }

        List<List<BatchOutcome>> results = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            results.add(await(units.get(i), futures.get(i)));
        }
        return results;
    }

    private static Future<List<BatchOutcome>> submit(WorkerPool pool, WorkUnit unit) {
        try {
            return pool.submit(unit);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool refused unit {}", unit.id(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private static List<BatchOutcome> await(WorkUnit unit, Future<List<BatchOutcome>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for unit {}", unit.id());
            return failAll(unit, e);
        } catch (ExecutionException e) {
            log.error("Unit of work {} failed", unit.id(), e.getCause());
            return failAll(unit, e.getCause());
        }
    }

    private static List<BatchOutcome> failAll(WorkUnit unit, Throwable cause) {
        return unit.batches().stream()
            .map(batch -> BatchOutcome.failed(batch, cause))
            .collect(Collectors.toList());
    }
}
