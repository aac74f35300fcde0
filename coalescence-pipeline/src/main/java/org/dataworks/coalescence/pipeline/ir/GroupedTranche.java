package org.dataworks.coalescence.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A tranche's descriptors grouped by topic, then by partition. Both levels keep first-seen order.
 *
 * @param topics topic to partition to group
 * @param malformedKeys keys that were left out because they could not be parsed
 */
public record GroupedTranche(Map<String, Map<Integer, PartitionGroup>> topics, List<String> malformedKeys) {

    public GroupedTranche {
        Map<String, Map<Integer, PartitionGroup>> copy = new LinkedHashMap<>();
        topics.forEach((topic, partitions) ->
            copy.put(topic, Collections.unmodifiableMap(new LinkedHashMap<>(partitions))));
        topics = Collections.unmodifiableMap(copy);
        malformedKeys = List.copyOf(malformedKeys);
    }

    public Stream<PartitionGroup> partitionGroups() {
        return topics.values().stream().flatMap(partitions -> partitions.values().stream());
    }

    public int descriptorCount() {
        return partitionGroups().mapToInt(group -> group.descriptors().size()).sum();
    }
}
