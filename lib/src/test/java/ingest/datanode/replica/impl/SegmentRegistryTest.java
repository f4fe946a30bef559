package ingest.datanode.replica.impl;

import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.MsgPosition;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SegmentRegistryTest {
    private static final MsgPosition START = MsgPosition.of("insert-channel-0", "0", 100L);
    private static final MsgPosition P = MsgPosition.of("insert-channel-0", "10", 110L);
    private static final MsgPosition Q = MsgPosition.of("insert-channel-0", "17", 120L);

    @Test
    void newSegment() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.emptyList());

        Segment segment = registry.getById(5L);
        assertEquals(5L, segment.getSegmentId());
        assertEquals(1L, segment.getCollectionId());
        assertEquals(0L, segment.getPartitionId());
        assertEquals(0L, segment.getNumRows());
        assertEquals(0L, segment.getMemorySize());
        assertTrue(segment.isNew());
        assertEquals(100L, segment.getCreateTime());
        assertEquals(0L, segment.getEndTime());
        assertTrue(segment.getEndPositions().isEmpty());
    }

    @Test
    void hasSegmentFollowsAddAndRemove() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        for (long id = 0; id < 10; id++) {
            registry.add(id, 1L, 0L, id, Collections.emptyList());
        }
        registry.remove(4L);
        registry.remove(9L);

        for (long id = 0; id < 10; id++) {
            assertEquals(id != 4L && id != 9L, registry.hasSegment(id));
        }
        assertEquals(8, registry.count());
    }

    @Test
    void removeKeepsOrder() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(1L, 1L, 0L, 0L, Collections.emptyList());
        registry.add(2L, 1L, 0L, 0L, Collections.emptyList());
        registry.add(3L, 2L, 0L, 0L, Collections.emptyList());
        registry.add(4L, 1L, 0L, 0L, Collections.emptyList());

        registry.remove(1L);
        assertEquals(Arrays.asList(2L, 3L, 4L), registry.getSegmentIds());
        assertEquals(Arrays.asList(2L, 4L), registry.getSegmentIdsOfCollection(1L));
        assertTrue(registry.getSegmentIdsOfCollection(7L).isEmpty());
    }

    @Test
    void removeMissing() {
        SegmentRegistry registry = new SegmentRegistry(8);
        assertThrows(NotFoundException.class, () -> registry.remove(5L));
    }

    @Test
    void updateStatistics() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.singletonList(START));

        registry.updateStatistics(5L, 10L, 110L, Collections.singletonList(P));
        registry.updateStatistics(5L, 7L, 120L, Collections.singletonList(Q));

        Segment segment = registry.getById(5L);
        assertEquals(17L, segment.getNumRows());
        assertEquals(120L, segment.getEndTime());
        assertEquals(Collections.singletonList(Q), segment.getEndPositions());
        assertEquals(Collections.singletonList(START), segment.getStartPositions());
        assertEquals(0L, segment.getMemorySize());
    }

    @Test
    void updateMissing() {
        SegmentRegistry registry = new SegmentRegistry(8);
        assertThrows(NotFoundException.class,
            () -> registry.updateStatistics(5L, 1L, 1L, Collections.emptyList()));
    }

    @Test
    void negativeDeltaRejected() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.emptyList());
        registry.updateStatistics(5L, 3L, 110L, Collections.singletonList(P));

        assertThrows(IllegalArgumentException.class,
            () -> registry.updateStatistics(5L, -1L, 120L, Collections.singletonList(Q)));
        Segment segment = registry.getById(5L);
        assertEquals(3L, segment.getNumRows());
        assertEquals(110L, segment.getEndTime());
        assertEquals(Collections.singletonList(P), segment.getEndPositions());
    }

    @Test
    void snapshotClearsNewFlagOnce() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.singletonList(START));

        SegmentStatisticsUpdates first = registry.snapshotAndAcknowledge(5L);
        assertTrue(first.isNewSegment());
        assertEquals(5L, first.getSegmentId());
        assertEquals(100L, first.getCreateTime());
        assertEquals(Collections.singletonList(START), first.getStartPositions());
        assertFalse(registry.getById(5L).isNew());

        SegmentStatisticsUpdates second = registry.snapshotAndAcknowledge(5L);
        assertFalse(second.isNewSegment());

        registry.updateStatistics(5L, 10L, 110L, Collections.singletonList(P));
        SegmentStatisticsUpdates third = registry.snapshotAndAcknowledge(5L);
        assertFalse(third.isNewSegment());
        assertEquals(10L, third.getNumRows());
        assertEquals(110L, third.getEndTime());
        assertEquals(Collections.singletonList(P), third.getEndPositions());
    }

    @Test
    void snapshotMissing() {
        SegmentRegistry registry = new SegmentRegistry(8);
        assertThrows(NotFoundException.class, () -> registry.snapshotAndAcknowledge(5L));
    }

    @Test
    void viewIsDetached() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.emptyList());
        Segment before = registry.getById(5L);

        registry.updateStatistics(5L, 10L, 110L, Collections.singletonList(P));
        assertEquals(0L, before.getNumRows());
        assertTrue(before.isNew());
        assertThrows(UnsupportedOperationException.class, () -> before.getEndPositions().add(Q));
    }

    @Test
    void suppliedPositionsAreCopied() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        List<MsgPosition> positions = new ArrayList<>(Collections.singletonList(P));
        registry.add(5L, 1L, 0L, 100L, Collections.emptyList());
        registry.updateStatistics(5L, 1L, 110L, positions);

        positions.add(Q);
        assertEquals(Collections.singletonList(P), registry.getById(5L).getEndPositions());
    }

    @Test
    void duplicateIdKeepsFirst() throws NotFoundException {
        SegmentRegistry registry = new SegmentRegistry(8);
        registry.add(5L, 1L, 0L, 100L, Collections.emptyList());
        registry.updateStatistics(5L, 10L, 110L, Collections.singletonList(P));
        registry.add(5L, 2L, 3L, 200L, Collections.emptyList());

        Segment segment = registry.getById(5L);
        assertEquals(1, registry.count());
        assertEquals(1L, segment.getCollectionId());
        assertEquals(10L, segment.getNumRows());
    }
}
