package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.dataworks.coalescence.pipeline.ir.Batch;
import org.dataworks.coalescence.pipeline.ir.BatchedTranche;
import org.dataworks.coalescence.pipeline.ir.GroupedTranche;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;
import org.dataworks.coalescence.pipeline.ir.PartitionGroup;

/**
 * Slices each partition of a grouped tranche into batches bounded by byte size and object count.
 *
 * A batch is closed before the next descriptor when adding it would take the batch over {@code sizeLimit}
 * bytes, or when the batch already holds {@code fileLimit} descriptors. An object larger than
 * {@code sizeLimit} on its own always ends up alone in its batch. A limit of zero or less disables that bound.
 */
public class BatchingEngine {

    public BatchedTranche batch(long sizeLimit, int fileLimit, GroupedTranche grouped) {
        Map<String, Map<Integer, List<Batch>>> topics = new LinkedHashMap<>();
        grouped.topics().forEach((topic, partitions) -> {
            Map<Integer, List<Batch>> batched = new LinkedHashMap<>();
            partitions.forEach((partition, group) -> batched.put(partition, batchPartition(sizeLimit, fileLimit, group)));
            topics.put(topic, batched);
        });
        return new BatchedTranche(topics);
    }

    List<Batch> batchPartition(long sizeLimit, int fileLimit, PartitionGroup group) {
        List<Batch> batches = new ArrayList<>();
        List<ObjectDescriptor> current = new ArrayList<>();
        long currentBytes = 0;

        for (ObjectDescriptor descriptor : group.descriptors()) {
            if (!current.isEmpty() && closesBatch(sizeLimit, fileLimit, current.size(), currentBytes, descriptor)) {
                batches.add(new Batch(group.topic(), group.partition(), batches.size(), current));
                current = new ArrayList<>();
                currentBytes = 0;
            }
            current.add(descriptor);
            currentBytes += descriptor.size();
        }

        if (!current.isEmpty()) {
            batches.add(new Batch(group.topic(), group.partition(), batches.size(), current));
        }
        return batches;
    }

    private static boolean closesBatch(long sizeLimit, int fileLimit, int currentCount, long currentBytes,
                                       ObjectDescriptor next) {
        boolean sizeExceeded = sizeLimit > 0 && currentBytes + next.size() > sizeLimit;
        boolean countReached = fileLimit > 0 && currentCount >= fileLimit;
        return sizeExceeded || countReached;
    }
}
