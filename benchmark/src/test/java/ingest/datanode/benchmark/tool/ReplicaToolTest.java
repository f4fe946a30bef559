package ingest.datanode.benchmark.tool;

import ingest.datanode.apis.CollectionReplica;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class ReplicaToolTest {

    @Test
    void testSeed() {
        CollectionReplica replica = ReplicaTool.buildReplica(false, 16);
        List<Long> segmentIds = ReplicaTool.seed(replica, 3, 4, 2);

        Assertions.assertEquals(3, replica.getCollectionNum());
        Assertions.assertEquals(12, segmentIds.size());
        Assertions.assertEquals(segmentIds, replica.getSegmentIds());
        Assertions.assertEquals(4, replica.getSegmentIdsOfCollection(1000L).size());
    }

    @Test
    void testIngestAndSnapshot() throws NotFoundException {
        CollectionReplica replica = ReplicaTool.buildReplica(true, 16);
        long segmentId = ReplicaTool.seed(replica, 1, 1, 2).get(0);

        Assertions.assertTrue(ReplicaTool.ingest(replica, segmentId, 5L, 10L, 2));
        Assertions.assertTrue(ReplicaTool.ingest(replica, segmentId, 3L, 11L, 2));
        Segment segment = replica.getSegmentById(segmentId);
        Assertions.assertEquals(8L, segment.getNumRows());
        Assertions.assertEquals(ReplicaTool.positions(2, 11L), segment.getEndPositions());

        SegmentStatisticsUpdates updates = ReplicaTool.snapshot(replica, segmentId);
        Assertions.assertNotNull(updates);
        Assertions.assertTrue(updates.isNewSegment());
    }

    @Test
    void testMissingSegment() {
        CollectionReplica replica = ReplicaTool.buildReplica(false, 16);

        Assertions.assertFalse(ReplicaTool.ingest(replica, 42L, 1L, 1L, 1));
        Assertions.assertNull(ReplicaTool.snapshot(replica, 42L));
    }
}
