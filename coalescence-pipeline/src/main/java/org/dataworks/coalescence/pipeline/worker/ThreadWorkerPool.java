package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.dataworks.coalescence.io.ObjectStore;
import org.dataworks.coalescence.io.ObjectStoreFactory;
import org.dataworks.coalescence.pipeline.BatchCoalescer;
import org.dataworks.coalescence.pipeline.dispatch.WorkUnit;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs units of work on a fixed pool of threads sharing this process's memory.
 * Each worker thread opens its own store client on first use; they are closed with the pool.
 */
@Slf4j
public class ThreadWorkerPool implements WorkerPool {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final int concurrency;
    private final ExecutorService executor;
    private final ObjectStoreFactory storeFactory;
    private final BatchCoalescer coalescer;
    private final ThreadLocal<ObjectStore> workerStore = new ThreadLocal<>();
    private final List<ObjectStore> openedStores = new CopyOnWriteArrayList<>();

    public ThreadWorkerPool(int workers, ObjectStoreFactory storeFactory, BatchCoalescer coalescer) {
        this.concurrency = WorkerPool.resolveConcurrency(workers);
        this.executor = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("coalescer-worker-"));
        this.storeFactory = storeFactory;
        this.coalescer = coalescer;
        log.info("Started thread worker pool with {} threads", concurrency);
    }

    @Override
    public Future<List<BatchOutcome>> submit(WorkUnit unit) {
        return executor.submit(() -> coalescer.coalesceAll(storeForThisWorker(), unit.batches()));
    }

    private ObjectStore storeForThisWorker() throws IOException {
        ObjectStore store = workerStore.get();
        if (store == null) {
            store = storeFactory.open();
            workerStore.set(store);
            openedStores.add(store);
        }
        return store;
    }

    @Override
    public int concurrency() {
        return concurrency;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker threads still running after {} seconds, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        openedStores.forEach(ObjectStore::close);
    }
}
