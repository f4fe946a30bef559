package ingest.datanode.replica.impl;

import com.google.common.collect.ImmutableList;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.MsgPosition;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * SegmentRegistry keeps the segments owned by the node and their ingestion statistics.
 * <p>
 * Segments are keyed by id, so removal does not reorder the remaining ones. Not thread safe, callers guard it with
 * the replica lock.
 */
class SegmentRegistry {
    private static final Logger log = LoggerFactory.getLogger(SegmentRegistry.class);

    private final Map<Long, SegmentState> segments;

    SegmentRegistry(int initialCapacity) {
        this.segments = new LinkedHashMap<>(initialCapacity);
    }

    int count() {
        return segments.size();
    }

    /**
     * Register a new segment with empty statistics. An already registered id keeps its current segment.
     *
     * @param segmentId      segment id
     * @param collectionId   owning collection id
     * @param partitionId    owning partition id
     * @param createTime     creation timestamp
     * @param startPositions positions the segment starts consuming from
     */
    void add(long segmentId, long collectionId, long partitionId, long createTime, List<MsgPosition> startPositions) {
        checkNotNull(startPositions, "startPositions should not be null");
        SegmentState state = new SegmentState(segmentId, collectionId, partitionId, createTime,
            ImmutableList.copyOf(startPositions));
        if (segments.putIfAbsent(segmentId, state) != null) {
            log.warn("Segment {} already exists, ignore the duplicated one of collection {}, partition {}", segmentId,
                collectionId, partitionId);
            return;
        }
        log.info("Add segment {}, collection {}, partition {}", segmentId, collectionId, partitionId);
    }

    void remove(long segmentId) throws NotFoundException {
        if (segments.remove(segmentId) == null) {
            throw NotFoundException.segment(segmentId);
        }
        log.info("Remove segment {}", segmentId);
    }

    boolean hasSegment(long segmentId) {
        return segments.containsKey(segmentId);
    }

    Segment getById(long segmentId) throws NotFoundException {
        return find(segmentId).toSegment();
    }

    List<Long> getSegmentIds() {
        return ImmutableList.copyOf(segments.keySet());
    }

    List<Long> getSegmentIdsOfCollection(long collectionId) {
        ImmutableList.Builder<Long> ids = ImmutableList.builder();
        for (SegmentState state : segments.values()) {
            if (state.collectionId == collectionId) {
                ids.add(state.segmentId);
            }
        }
        return ids.build();
    }

    /**
     * Apply newly ingested data to a segment's statistics.
     * The memory size is reset to zero on every update.
     *
     * @param segmentId    segment id
     * @param deltaRows    rows ingested since the last update
     * @param endTime      timestamp of the latest ingested data
     * @param endPositions consumed positions, replacing the previous ones
     * @throws NotFoundException if the segment is unknown
     */
    void updateStatistics(long segmentId, long deltaRows, long endTime, List<MsgPosition> endPositions)
        throws NotFoundException {
        checkArgument(deltaRows >= 0, "numRows should not be negative, segment %s, numRows %s", segmentId, deltaRows);
        checkNotNull(endPositions, "endPositions should not be null");
        SegmentState state = find(segmentId);
        log.debug("Update segment {} row nums: {}", segmentId, deltaRows);
        state.memorySize = 0;
        state.numRows += deltaRows;
        state.endTime = endTime;
        state.endPositions = ImmutableList.copyOf(endPositions);
    }

    /**
     * Snapshot the statistics of a segment and clear its new flag.
     *
     * @param segmentId segment id
     * @return statistics carrying the flag as it was before this call
     * @throws NotFoundException if the segment is unknown
     */
    SegmentStatisticsUpdates snapshotAndAcknowledge(long segmentId) throws NotFoundException {
        SegmentState state = find(segmentId);
        SegmentStatisticsUpdates updates = SegmentStatisticsUpdates.newBuilder()
            .setSegmentId(segmentId)
            .setMemorySize(state.memorySize)
            .setNumRows(state.numRows)
            .setNewSegment(state.isNew)
            .setCreateTime(state.createTime)
            .setEndTime(state.endTime)
            .setStartPositions(state.startPositions)
            .setEndPositions(state.endPositions)
            .build();
        state.isNew = false;
        return updates;
    }

    private SegmentState find(long segmentId) throws NotFoundException {
        SegmentState state = segments.get(segmentId);
        if (state == null) {
            throw NotFoundException.segment(segmentId);
        }
        return state;
    }

    private static class SegmentState {
        private final long segmentId;
        private final long collectionId;
        private final long partitionId;
        private final long createTime;
        private final ImmutableList<MsgPosition> startPositions;

        private long numRows;
        private long memorySize;
        private boolean isNew = true;
        private long endTime;
        private ImmutableList<MsgPosition> endPositions = ImmutableList.of();

        SegmentState(long segmentId, long collectionId, long partitionId, long createTime,
            ImmutableList<MsgPosition> startPositions) {
            this.segmentId = segmentId;
            this.collectionId = collectionId;
            this.partitionId = partitionId;
            this.createTime = createTime;
            this.startPositions = startPositions;
        }

        Segment toSegment() {
            return new Segment(segmentId, collectionId, partitionId, numRows, memorySize, isNew, createTime, endTime,
                startPositions, endPositions);
        }
    }
}
