package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.dataworks.coalescence.io.ObjectStoreSettings;
import org.dataworks.coalescence.pipeline.dispatch.WorkUnit;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs each unit of work in its own JVM, isolated from this process's memory.
 *
 * A child runs {@link CoalescenceWorker} on this process's classpath and builds its own store client from the
 * {@link ObjectStoreSettings}. At most {@link #concurrency()} children are alive at once; each is supervised
 * by a thread of this process. Children are not reused: every unit pays a JVM start.
 */
@Slf4j
public class ProcessWorkerPool implements WorkerPool {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final int concurrency;
    private final ExecutorService supervisors;
    private final ObjectStoreSettings settings;
    private final List<String> command;

    public ProcessWorkerPool(int workers, ObjectStoreSettings settings) {
        this(workers, settings, defaultCommand());
    }

    ProcessWorkerPool(int workers, ObjectStoreSettings settings, List<String> command) {
        this.concurrency = WorkerPool.resolveConcurrency(workers);
        this.supervisors = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("coalescer-process-"));
        this.settings = settings;
        this.command = List.copyOf(command);
        log.info("Started process worker pool with {} processes", concurrency);
    }

    static List<String> defaultCommand() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"), CoalescenceWorker.class.getName());
    }

    @Override
    public Future<List<BatchOutcome>> submit(WorkUnit unit) {
        return supervisors.submit(() -> runWorker(unit));
    }

    private List<BatchOutcome> runWorker(WorkUnit unit) throws IOException, InterruptedException {
        log.debug("Launching worker process for unit {}", unit.id());
        Process process = new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                WorkerProtocol.writeRequest(stdin, new WorkerRequest(settings, unit.batches()));
            }
            byte[] stdout;
            try (InputStream input = process.getInputStream()) {
                stdout = input.readAllBytes();
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new WorkerException("Worker for unit " + unit.id() + " exited with status " + exitCode);
            }
            return decode(unit, stdout);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static List<BatchOutcome> decode(WorkUnit unit, byte[] stdout) throws WorkerException {
        List<BatchOutcome> outcomes;
        try {
            outcomes = WorkerProtocol.readOutcomes(stdout);
        } catch (IOException e) {
            throw new WorkerException("Unreadable result from worker for unit " + unit.id(), e);
        }
        if (outcomes.size() != unit.batches().size()) {
            throw new WorkerException("Worker for unit " + unit.id() + " returned " + outcomes.size()
                + " outcomes for " + unit.batches().size() + " batches");
        }
        return outcomes;
    }

    @Override
    public int concurrency() {
        return concurrency;
    }

    @Override
    public void close() {
        supervisors.shutdown();
        try {
            if (!supervisors.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker processes still running after {} seconds, abandoning", SHUTDOWN_TIMEOUT_SECONDS);
                supervisors.shutdownNow();
            }
        } catch (InterruptedException e) {
            supervisors.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
