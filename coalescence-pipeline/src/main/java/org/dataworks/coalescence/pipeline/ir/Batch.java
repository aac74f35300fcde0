package org.dataworks.coalescence.pipeline.ir;

import java.util.List;

/**
 * A run of consecutive descriptors from one partition that is coalesced into a single object.
 *
 * @param topic the topic of every descriptor in the batch
 * @param partition the partition of every descriptor in the batch
 * @param index the position of this batch among its partition's batches
 * @param descriptors the members, in listing order
 */
public record Batch(String topic, int partition, int index, List<ObjectDescriptor> descriptors) {

    public Batch {
        descriptors = List.copyOf(descriptors);
    }

    public String id() {
        return topic + "/" + partition + "/" + index;
    }

    public int objectCount() {
        return descriptors.size();
    }

    public long totalBytes() {
        return descriptors.stream().mapToLong(ObjectDescriptor::size).sum();
    }

    /** Key of the object this batch is merged into. */
    public String mergedKey() {
        return descriptors.get(0).layout().mergedKey(descriptors);
    }
}
