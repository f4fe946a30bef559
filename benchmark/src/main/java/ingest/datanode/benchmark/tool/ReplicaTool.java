package ingest.datanode.benchmark.tool;

import ingest.datanode.apis.CollectionReplica;
import ingest.datanode.apis.ReplicaConfiguration;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.CollectionSchema;
import ingest.datanode.models.MsgPosition;
import ingest.datanode.models.SegmentStatisticsUpdates;
import ingest.datanode.replica.impl.CollectionReplicaImpl;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers to build and drive a replica in benchmarks.
 */
public class ReplicaTool {

    public static final String CHANNEL_PREFIX = "insert-channel-";

    private static final long FIRST_COLLECTION_ID = 1000L;

    public static CollectionReplica buildReplica(boolean fairLock, int segmentCapacity) {
        ReplicaConfiguration configuration = ReplicaConfiguration.newBuilder()
                .setFairLock(fairLock)
                .setInitialSegmentCapacity(segmentCapacity)
                .build();
        return new CollectionReplicaImpl(configuration);
    }

    /**
     * Register collections and their segments, each segment starting from position 0 of every channel.
     *
     * @return ids of the created segments
     */
    public static List<Long> seed(CollectionReplica replica, int collectionCount, int segmentsPerCollection,
            int channelCount) {
        List<MsgPosition> startPositions = positions(channelCount, 0L);
        List<Long> segmentIds = new ArrayList<>(collectionCount * segmentsPerCollection);
        long segmentId = 0L;
        for (int c = 0; c < collectionCount; c++) {
            long collectionId = FIRST_COLLECTION_ID + c;
            replica.addCollection(collectionId, CollectionSchema.of("collection-" + c));
            for (int s = 0; s < segmentsPerCollection; s++) {
                replica.addSegment(segmentId, collectionId, 0L, System.currentTimeMillis(), startPositions);
                segmentIds.add(segmentId);
                segmentId++;
            }
        }
        return segmentIds;
    }

    /**
     * Record an ingestion round for a segment.
     *
     * @return false if the segment is no longer owned by the replica
     */
    public static boolean ingest(CollectionReplica replica, long segmentId, long rows, long endTime,
            int channelCount) {
        try {
            replica.updateStatistics(segmentId, rows, endTime, positions(channelCount, endTime));
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    /**
     * @return the statistics snapshot, or null if the segment is no longer owned by the replica
     */
    public static SegmentStatisticsUpdates snapshot(CollectionReplica replica, long segmentId) {
        try {
            return replica.getSegmentStatisticsUpdates(segmentId);
        } catch (NotFoundException e) {
            return null;
        }
    }

    public static List<MsgPosition> positions(int channelCount, long offset) {
        List<MsgPosition> positions = new ArrayList<>(channelCount);
        for (int i = 0; i < channelCount; i++) {
            positions.add(MsgPosition.of(CHANNEL_PREFIX + i, String.valueOf(offset), offset));
        }
        return positions;
    }
}
