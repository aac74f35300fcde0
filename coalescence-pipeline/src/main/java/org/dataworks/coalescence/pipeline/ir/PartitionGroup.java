package org.dataworks.coalescence.pipeline.ir;

import java.util.List;

/**
 * The descriptors of one topic partition, in listing order.
 */
public record PartitionGroup(String topic, int partition, List<ObjectDescriptor> descriptors) {
    public PartitionGroup {
        descriptors = List.copyOf(descriptors);
    }
}
