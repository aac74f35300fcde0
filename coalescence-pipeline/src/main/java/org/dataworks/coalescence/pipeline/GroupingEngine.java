package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.dataworks.coalescence.io.ObjectSummary;
import org.dataworks.coalescence.pipeline.ir.GroupedTranche;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;
import org.dataworks.coalescence.pipeline.ir.PartitionGroup;
import org.dataworks.coalescence.pipeline.key.KeyLayout;
import org.dataworks.coalescence.pipeline.key.MalformedKeyException;

import lombok.extern.slf4j.Slf4j;

/**
 * Groups a tranche of listed objects by topic and partition.
 *
 * Keys that cannot be parsed are left out with a warning; they do not fail the tranche.
 */
@Slf4j
public class GroupingEngine {
    public static final int ALL_PARTITIONS = -1;
    public static final int MAX_PARTITION = 19;

    /**
     * @param summaries the tranche, in listing order
     * @param partition {@link #ALL_PARTITIONS}, or the only partition to keep
     * @param manifests whether the keys are streaming manifests rather than data files
     * @return the grouped tranche
     */
    public GroupedTranche group(List<ObjectSummary> summaries, int partition, boolean manifests) {
        checkPartition(partition);
        KeyLayout layout = KeyLayout.of(manifests);

        Map<String, Map<Integer, List<ObjectDescriptor>>> grouped = new LinkedHashMap<>();
        List<String> malformedKeys = new ArrayList<>();
        for (ObjectSummary summary : summaries) {
            ObjectDescriptor descriptor;
            try {
                descriptor = layout.describe(summary);
            } catch (MalformedKeyException e) {
                log.warn("Skipping object: {}", e.getMessage());
                malformedKeys.add(summary.key());
                continue;
            }
            if (partition != ALL_PARTITIONS && descriptor.partition() != partition) {
                continue;
            }
            grouped.computeIfAbsent(descriptor.topic(), topic -> new LinkedHashMap<>())
                .computeIfAbsent(descriptor.partition(), p -> new ArrayList<>())
                .add(descriptor);
        }

        Map<String, Map<Integer, PartitionGroup>> topics = new LinkedHashMap<>();
        grouped.forEach((topic, partitions) -> {
            Map<Integer, PartitionGroup> groups = new LinkedHashMap<>();
            partitions.forEach((p, descriptors) -> groups.put(p, new PartitionGroup(topic, p, descriptors)));
            topics.put(topic, groups);
        });
        return new GroupedTranche(topics, malformedKeys);
    }

    public static void checkPartition(int partition) {
        if (partition < ALL_PARTITIONS || partition > MAX_PARTITION) {
            throw new IllegalArgumentException("Partition must be between " + ALL_PARTITIONS
                + " and " + MAX_PARTITION + ", got " + partition);
        }
    }
}
