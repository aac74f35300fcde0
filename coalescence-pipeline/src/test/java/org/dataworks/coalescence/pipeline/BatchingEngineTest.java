package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchedTranche;
import org.dataworks.coalescence.pipeline.ir.GroupedTranche;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;
import org.dataworks.coalescence.pipeline.ir.PartitionGroup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.dataworks.coalescence.pipeline.TestObjects.group;
import static org.junit.jupiter.api.Assertions.*;

class BatchingEngineTest {

    private final BatchingEngine engine = new BatchingEngine();

    private static List<Integer> batchSizes(List<Batch> batches) {
        return batches.stream().map(Batch::objectCount).toList();
    }

    @Test
    void batchesStayWithinTheSizeLimit() {
        var partition = group("db.core.claimant", 0, 40, 40, 40, 40, 40);

        List<Batch> batches = engine.batchPartition(100, 0, partition);

        assertEquals(List.of(2, 2, 1), batchSizes(batches));
        assertTrue(batches.stream().allMatch(batch -> batch.totalBytes() <= 100));
    }

    @Test
    void batchExactlyAtTheSizeLimitIsKept() {
        var partition = group("db.core.claimant", 0, 50, 50, 50);

        assertEquals(List.of(2, 1), batchSizes(engine.batchPartition(100, 0, partition)));
    }

    @Test
    void batchesStayWithinTheFileLimit() {
        var partition = group("db.core.claimant", 0, 1, 1, 1, 1, 1, 1, 1);

        assertEquals(List.of(3, 3, 1), batchSizes(engine.batchPartition(1_000, 3, partition)));
    }

    @Test
    void oversizedObjectsSitAloneInTheirBatch() {
        var partition = group("db.core.claimant", 0, 10, 500, 10, 10);

        List<Batch> batches = engine.batchPartition(100, 10, partition);

        assertEquals(List.of(1, 1, 2), batchSizes(batches));
        assertEquals(500, batches.get(1).totalBytes());
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "-1, -1", "0, -5"})
    void nonPositiveLimitsAreUnbounded(long sizeLimit, int fileLimit) {
        var partition = group("db.core.claimant", 0, 1_000_000, 1_000_000, 1_000_000);

        assertEquals(List.of(3), batchSizes(engine.batchPartition(sizeLimit, fileLimit, partition)));
    }

    @Test
    void batchesAreIndexedInPartitionOrder() {
        var partition = group("db.core.claimant", 7, 60, 60, 60);

        List<Batch> batches = engine.batchPartition(100, 0, partition);

        assertEquals(List.of("db.core.claimant/7/0", "db.core.claimant/7/1", "db.core.claimant/7/2"),
            batches.stream().map(Batch::id).toList());
    }

    @Test
    void concatenatedBatchesReproduceEveryPartition() {
        var claimant = group("db.core.claimant", 0, 30, 90, 20, 20, 20, 80, 5);
        var contract = group("db.core.contract", 3, 100, 1, 1, 1);
        var grouped = new GroupedTranche(Map.of(
            "db.core.claimant", Map.of(0, claimant),
            "db.core.contract", Map.of(3, contract)), List.of());

        BatchedTranche batched = engine.batch(100, 3, grouped);

        for (PartitionGroup partition : List.of(claimant, contract)) {
            List<ObjectDescriptor> concatenated = new ArrayList<>();
            batched.topics().get(partition.topic()).get(partition.partition())
                .forEach(batch -> concatenated.addAll(batch.descriptors()));
            assertEquals(partition.descriptors(), concatenated);
        }
        assertEquals(grouped.descriptorCount(), batched.batches().mapToInt(Batch::objectCount).sum());
    }

    @Test
    void batchingIsIdempotent() {
        var grouped = new GroupedTranche(
            Map.of("db.core.claimant", Map.of(0, group("db.core.claimant", 0, 30, 90, 20, 20))), List.of());

        assertEquals(engine.batch(100, 10, grouped), engine.batch(100, 10, grouped));
    }

    @Test
    void emptyTrancheHasNoBatches() {
        BatchedTranche batched = engine.batch(100, 10, new GroupedTranche(Map.of(), List.of()));

        assertEquals(0, batched.batchCount());
        assertEquals(0, batched.partitionCount());
    }
}
