package org.dataworks.coalescence.pipeline.worker;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.dataworks.coalescence.io.ObjectStoreSettings;
import org.dataworks.coalescence.pipeline.TestObjects;
import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class CoalescenceWorkerTest {

    @TempDir
    Path tempDir;

    static ObjectStoreSettings fileSettings(Path root) {
        return ObjectStoreSettings.builder()
            .kind(ObjectStoreSettings.Kind.FILE)
            .bucket("corporate-data")
            .location(root.toString())
            .build();
    }

    static Batch writeBatch(Path bucket, int index, long start) throws Exception {
        var first = TestObjects.descriptor("db.core.claimant", 0, start, start + 9, 10);
        var second = TestObjects.descriptor("db.core.claimant", 0, start + 10, start + 19, 10);
        for (var descriptor : List.of(first, second)) {
            Path path = bucket.resolve(descriptor.key());
            Files.createDirectories(path.getParent());
            Files.write(path, TestObjects.content(descriptor.key()));
        }
        return new Batch("db.core.claimant", 0, index, List.of(first, second));
    }

    private static byte[] request(ObjectStoreSettings settings, List<Batch> batches) throws Exception {
        var json = new ByteArrayOutputStream();
        WorkerProtocol.writeRequest(json, new WorkerRequest(settings, batches));
        return json.toByteArray();
    }

    @Test
    void coalescesTheRequestedBatchesAndAnswersWithTheirOutcomes() throws Exception {
        Path bucket = tempDir.resolve("corporate-data");
        var batches = List.of(writeBatch(bucket, 0, 0), writeBatch(bucket, 1, 20));
        var output = new ByteArrayOutputStream();

        int exitCode = CoalescenceWorker.run(
            new ByteArrayInputStream(request(fileSettings(tempDir), batches)), output);

        assertEquals(0, exitCode);
        List<BatchOutcome> outcomes = WorkerProtocol.readOutcomes(output.toByteArray());
        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().allMatch(BatchOutcome::success));
        assertEquals(batches.get(1).mergedKey(), outcomes.get(1).mergedKey());
        assertTrue(Files.isRegularFile(bucket.resolve(batches.get(0).mergedKey())));
        assertFalse(Files.exists(bucket.resolve(batches.get(0).descriptors().get(0).key())));
    }

    @Test
    void failedBatchesAreStillAnswered() throws Exception {
        Path bucket = tempDir.resolve("corporate-data");
        var present = writeBatch(bucket, 0, 0);
        var missing = new Batch("db.core.claimant", 0, 1, List.of(
            TestObjects.descriptor("db.core.claimant", 0, 100, 109, 10),
            TestObjects.descriptor("db.core.claimant", 0, 110, 119, 10)));
        var output = new ByteArrayOutputStream();

        int exitCode = CoalescenceWorker.run(
            new ByteArrayInputStream(request(fileSettings(tempDir), List.of(present, missing))), output);

        assertEquals(0, exitCode);
        List<BatchOutcome> outcomes = WorkerProtocol.readOutcomes(output.toByteArray());
        assertEquals(List.of(true, false), outcomes.stream().map(BatchOutcome::success).toList());
        assertNotNull(outcomes.get(1).error());
    }

    @Test
    void unreadableRequestIsRejected() {
        var output = new ByteArrayOutputStream();

        int exitCode = CoalescenceWorker.run(
            new ByteArrayInputStream("not json".getBytes(StandardCharsets.UTF_8)), output);

        assertEquals(CoalescenceWorker.EXIT_BAD_REQUEST, exitCode);
        assertEquals(0, output.size());
    }

    @Test
    void storeThatCannotBeOpenedIsReported() throws Exception {
        Path notADirectory = Files.writeString(tempDir.resolve("plain-file"), "x");
        var output = new ByteArrayOutputStream();

        int exitCode = CoalescenceWorker.run(
            new ByteArrayInputStream(request(fileSettings(notADirectory), List.of())), output);

        assertEquals(CoalescenceWorker.EXIT_STORE_FAILURE, exitCode);
        assertEquals(0, output.size());
    }

    @Test
    void requestsSurviveTheWireUnchanged() throws Exception {
        var batch = writeBatch(tempDir, 3, 40);
        var settings = fileSettings(tempDir);

        WorkerRequest decoded = WorkerProtocol.readRequest(new ByteArrayInputStream(request(settings, List.of(batch))));

        assertEquals(settings, decoded.settings());
        assertEquals(List.of(batch), decoded.batches());
    }
}
