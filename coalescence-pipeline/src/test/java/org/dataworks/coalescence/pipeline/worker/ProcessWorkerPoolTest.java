package org.dataworks.coalescence.pipeline.worker;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.dataworks.coalescence.io.FileObjectStore;
import org.dataworks.coalescence.io.ObjectSummary;
import org.dataworks.coalescence.pipeline.BatchingEngine;
import org.dataworks.coalescence.pipeline.GroupingEngine;
import org.dataworks.coalescence.pipeline.ResultAggregator;
import org.dataworks.coalescence.pipeline.TestObjects;
import org.dataworks.coalescence.pipeline.TrancheExecutor;
import org.dataworks.coalescence.pipeline.dispatch.ByBatchStrategy;
import org.dataworks.coalescence.pipeline.dispatch.WorkUnit;
import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.dataworks.coalescence.pipeline.worker.CoalescenceWorkerTest.fileSettings;
import static org.dataworks.coalescence.pipeline.worker.CoalescenceWorkerTest.writeBatch;
import static org.junit.jupiter.api.Assertions.*;

class ProcessWorkerPoolTest {

    @TempDir
    Path tempDir;

    private static List<String> javaCommand(String mainClass) {
        List<String> command = new ArrayList<>(ProcessWorkerPool.defaultCommand());
        command.set(command.size() - 1, mainClass);
        return command;
    }

    @Test
    void workerProcessesCoalesceTheirUnits() throws Exception {
        Path bucket = tempDir.resolve("corporate-data");
        for (int i = 0; i < 3; i++) {
            writeBatch(bucket, i, i * 20L);
        }
        var store = FileObjectStore.open(bucket);
        var summaries = store.listTranches("", 100).blockFirst();
        var batched = new BatchingEngine().batch(0, 2,
            new GroupingEngine().group(summaries, GroupingEngine.ALL_PARTITIONS, false));

        List<List<BatchOutcome>> unitOutcomes;
        try (var pool = new ProcessWorkerPool(2, fileSettings(tempDir))) {
            unitOutcomes = new TrancheExecutor().execute(batched, new ByBatchStrategy(), pool);
        }

        assertTrue(new ResultAggregator().aggregate(unitOutcomes, false), unitOutcomes.toString());
        assertEquals(List.of(
                "corporate_storage/ucfs_audit/2020/11/05/data/businessAudit/db.core.claimant_0_0-19.jsonl.gz",
                "corporate_storage/ucfs_audit/2020/11/05/data/businessAudit/db.core.claimant_0_20-39.jsonl.gz",
                "corporate_storage/ucfs_audit/2020/11/05/data/businessAudit/db.core.claimant_0_40-59.jsonl.gz"),
            store.listTranches("", 100).blockFirst().stream().map(ObjectSummary::key).sorted().toList());
    }

    @Test
    void workerThatExitsWithAnErrorFailsTheUnit() throws Exception {
        Batch batch = writeBatch(tempDir.resolve("corporate-data"), 0, 0);
        var unit = new WorkUnit(batch.id(), List.of(batch));

        try (var pool = new ProcessWorkerPool(1, fileSettings(tempDir), javaCommand(CrashingWorker.class.getName()))) {
            var thrown = assertThrows(ExecutionException.class, () -> pool.submit(unit).get());
            var cause = assertInstanceOf(WorkerException.class, thrown.getCause());
            assertTrue(cause.getMessage().contains("status " + CrashingWorker.EXIT_STATUS), cause.getMessage());
        }
        assertTrue(Files.exists(tempDir.resolve("corporate-data").resolve(batch.descriptors().get(0).key())));
    }

    @Test
    void workerThatAnswersNothingFailsTheUnit() throws Exception {
        Batch batch = writeBatch(tempDir.resolve("corporate-data"), 0, 0);
        var unit = new WorkUnit(batch.id(), List.of(batch));

        try (var pool = new ProcessWorkerPool(1, fileSettings(tempDir), javaCommand(SilentWorker.class.getName()))) {
            var thrown = assertThrows(ExecutionException.class, () -> pool.submit(unit).get());
            var cause = assertInstanceOf(WorkerException.class, thrown.getCause());
            assertTrue(cause.getMessage().contains("Unreadable"), cause.getMessage());
        }
    }

    @Test
    void failedUnitsBecomeFailedOutcomes() throws Exception {
        Path bucket = tempDir.resolve("corporate-data");
        var batched = new BatchingEngine().batch(0, 2, new GroupingEngine().group(
            List.of(
                new ObjectSummary(writeBatch(bucket, 0, 0).descriptors().get(0).key(), 10),
                new ObjectSummary(TestObjects.dataKey("db.core.claimant", 0, 10, 19), 10)),
            GroupingEngine.ALL_PARTITIONS, false));

        List<List<BatchOutcome>> unitOutcomes;
        try (var pool = new ProcessWorkerPool(1, fileSettings(tempDir), javaCommand(CrashingWorker.class.getName()))) {
            unitOutcomes = new TrancheExecutor().execute(batched, new ByBatchStrategy(), pool);
        }

        assertEquals(1, unitOutcomes.size());
        assertFalse(unitOutcomes.get(0).get(0).success());
        assertTrue(unitOutcomes.get(0).get(0).error().startsWith("WorkerException"), unitOutcomes.get(0).get(0).error());
    }
}
