package org.dataworks.coalescence.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A tranche's batches, by topic then partition, each partition's batches in order.
 */
public record BatchedTranche(Map<String, Map<Integer, List<Batch>>> topics) {

    public BatchedTranche {
        Map<String, Map<Integer, List<Batch>>> copy = new LinkedHashMap<>();
        topics.forEach((topic, partitions) -> {
            Map<Integer, List<Batch>> partitionsCopy = new LinkedHashMap<>();
            partitions.forEach((partition, batches) -> partitionsCopy.put(partition, List.copyOf(batches)));
            copy.put(topic, Collections.unmodifiableMap(partitionsCopy));
        });
        topics = Collections.unmodifiableMap(copy);
    }

    /** Each partition's batch list, topic by topic. */
    public Stream<List<Batch>> partitions() {
        return topics.values().stream().flatMap(partitions -> partitions.values().stream());
    }

    public Stream<Batch> batches() {
        return partitions().flatMap(List::stream);
    }

    public int batchCount() {
        return partitions().mapToInt(List::size).sum();
    }

    public int partitionCount() {
        return topics.values().stream().mapToInt(Map::size).sum();
    }
}
