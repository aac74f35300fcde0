package org.dataworks.coalescence.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.dataworks.coalescence.io.ObjectSummary;
import org.dataworks.coalescence.pipeline.ir.GroupedTranche;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;
import org.dataworks.coalescence.pipeline.ir.PartitionGroup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.dataworks.coalescence.pipeline.TestObjects.summary;
import static org.junit.jupiter.api.Assertions.*;

class GroupingEngineTest {

    private final GroupingEngine engine = new GroupingEngine();

    private static List<ObjectSummary> mixedTranche() {
        return List.of(
            summary("db.core.claimant", 0, 0, 9, 10),
            summary("db.core.contract", 1, 0, 9, 20),
            summary("db.core.claimant", 1, 0, 9, 30),
            summary("db.core.claimant", 0, 10, 19, 40),
            summary("db.core.contract", 1, 10, 19, 50),
            summary("db.core.claimant", 0, 20, 29, 60));
    }

    @Test
    void everyDescriptorLandsInExactlyOneGroupInListingOrder() {
        var summaries = mixedTranche();

        GroupedTranche grouped = engine.group(summaries, GroupingEngine.ALL_PARTITIONS, false);

        assertEquals(List.of("db.core.claimant", "db.core.contract"), new ArrayList<>(grouped.topics().keySet()));
        assertEquals(List.of(0, 1), new ArrayList<>(grouped.topics().get("db.core.claimant").keySet()));
        assertEquals(summaries.size(), grouped.descriptorCount());

        PartitionGroup claimantZero = grouped.topics().get("db.core.claimant").get(0);
        assertEquals(List.of(summaries.get(0).key(), summaries.get(3).key(), summaries.get(5).key()),
            claimantZero.descriptors().stream().map(ObjectDescriptor::key).toList());

        var regrouped = grouped.partitionGroups()
            .flatMap(group -> group.descriptors().stream())
            .map(ObjectDescriptor::key)
            .sorted()
            .toList();
        assertEquals(summaries.stream().map(ObjectSummary::key).sorted().toList(), regrouped);
    }

    @Test
    void singlePartitionExcludesTheOthers() {
        GroupedTranche grouped = engine.group(mixedTranche(), 1, false);

        assertEquals(3, grouped.descriptorCount());
        assertTrue(grouped.partitionGroups().allMatch(group -> group.partition() == 1));
        assertTrue(grouped.malformedKeys().isEmpty());
    }

    @Test
    void partitionWithNoObjectsGivesAnEmptyTranche() {
        GroupedTranche grouped = engine.group(mixedTranche(), 19, false);

        assertTrue(grouped.topics().isEmpty());
        assertEquals(0, grouped.descriptorCount());
    }

    @Test
    void malformedKeysAreSkippedAndReported() {
        var summaries = List.of(
            summary("db.core.claimant", 0, 0, 9, 10),
            new ObjectSummary(TestObjects.PREFIX + "_SUCCESS", 0),
            summary("db.core.claimant", 0, 10, 19, 10));

        GroupedTranche grouped = engine.group(summaries, GroupingEngine.ALL_PARTITIONS, false);

        assertEquals(2, grouped.descriptorCount());
        assertEquals(List.of(TestObjects.PREFIX + "_SUCCESS"), grouped.malformedKeys());
    }

    @Test
    void manifestModeParsesManifestKeysAndSkipsDataKeys() {
        var summaries = List.of(
            new ObjectSummary("streaming/main/db.core.contract_10_1000-2000.txt", 5),
            new ObjectSummary("streaming/main/db.core.contract_10_2001-3000.txt", 5),
            summary("db.core.contract", 10, 0, 9, 5));

        GroupedTranche grouped = engine.group(summaries, GroupingEngine.ALL_PARTITIONS, true);

        assertEquals(2, grouped.topics().get("db.core.contract").get(10).descriptors().size());
        assertEquals(1, grouped.malformedKeys().size());
    }

    @Test
    void emptyTrancheGroupsToNothing() {
        GroupedTranche grouped = engine.group(List.of(), GroupingEngine.ALL_PARTITIONS, false);

        assertTrue(grouped.topics().isEmpty());
        assertTrue(grouped.malformedKeys().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {-2, 20, 100})
    void partitionsOutsideTheValidRangeAreRejected(int partition) {
        assertThrows(IllegalArgumentException.class, () -> engine.group(mixedTranche(), partition, false));
    }

    @Test
    void groupingIsIdempotent() {
        var summaries = mixedTranche();

        assertEquals(engine.group(summaries, GroupingEngine.ALL_PARTITIONS, false),
            engine.group(summaries, GroupingEngine.ALL_PARTITIONS, false));
    }
}
