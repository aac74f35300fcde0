package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.dataworks.coalescence.io.ObjectStore;
import org.dataworks.coalescence.pipeline.BatchIOException.Phase;
import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;

import lombok.extern.slf4j.Slf4j;

/**
 * Merges the objects of a batch into one object and deletes the originals.
 *
 * Holds no state: the same instance may be used from any number of threads, and a worker process
 * builds its own. Every failure is contained in the returned outcome, nothing is rolled back.
 */
@Slf4j
public class BatchCoalescer {

    public BatchOutcome coalesce(ObjectStore store, Batch batch) {
        if (batch.objectCount() <= 1) {
            log.debug("Not processing batch {} of size {}", batch.id(), batch.objectCount());
            return BatchOutcome.skipped(batch);
        }

        String mergedKey = batch.mergedKey();
        try {
            List<byte[]> contents = readAll(store, batch);
            write(store, batch, mergedKey, contents);
            deleteSources(store, batch, mergedKey);
        } catch (BatchIOException e) {
            log.error("Error coalescing batch {}", batch.id(), e);
            return BatchOutcome.failed(batch, e);
        }

        log.info("Coalesced {} objects ({} bytes) of batch {} into {}",
            batch.objectCount(), batch.totalBytes(), batch.id(), mergedKey);
        return BatchOutcome.merged(batch, mergedKey);
    }

    /** Coalesce the batches one after another, in order. */
    public List<BatchOutcome> coalesceAll(ObjectStore store, List<Batch> batches) {
        List<BatchOutcome> outcomes = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            outcomes.add(coalesce(store, batch));
        }
        return outcomes;
    }

    private List<byte[]> readAll(ObjectStore store, Batch batch) throws BatchIOException {
        List<byte[]> contents = new ArrayList<>(batch.objectCount());
        for (ObjectDescriptor descriptor : batch.descriptors()) {
            try {
                contents.add(store.read(descriptor.key()));
            } catch (Exception e) {
                throw new BatchIOException(Phase.READ, batch.id(), descriptor.key(), e);
            }
        }
        return contents;
    }

    private void write(ObjectStore store, Batch batch, String mergedKey, List<byte[]> contents)
        throws BatchIOException {
        try {
            store.writeMerged(mergedKey, contents);
        } catch (Exception e) {
            throw new BatchIOException(Phase.WRITE, batch.id(), mergedKey, e);
        }
    }

    private void deleteSources(ObjectStore store, Batch batch, String mergedKey) throws BatchIOException {
        // The merged object can take the key of a source when the batch was merged on a previous run
        List<String> sources = batch.descriptors().stream()
            .map(ObjectDescriptor::key)
            .filter(key -> !key.equals(mergedKey))
            .collect(Collectors.toList());
        try {
            store.delete(sources);
        } catch (Exception e) {
            throw new BatchIOException(Phase.DELETE, batch.id(), sources.size() + " sources", e);
        }
    }
}
