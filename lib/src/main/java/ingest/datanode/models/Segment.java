package ingest.datanode.models;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Read-only view of a segment at the moment it was looked up.
 * Later statistics updates are not reflected in an existing view.
 */
public class Segment {
    private final long segmentId;
    private final long collectionId;
    private final long partitionId;
    private final long numRows;
    private final long memorySize;
    private final boolean isNew;
    private final long createTime;
    private final long endTime;
    private final ImmutableList<MsgPosition> startPositions;
    private final ImmutableList<MsgPosition> endPositions;

    public Segment(long segmentId, long collectionId, long partitionId, long numRows, long memorySize,
        boolean isNew, long createTime, long endTime, List<MsgPosition> startPositions,
        List<MsgPosition> endPositions) {
        this.segmentId = segmentId;
        this.collectionId = collectionId;
        this.partitionId = partitionId;
        this.numRows = numRows;
        this.memorySize = memorySize;
        this.isNew = isNew;
        this.createTime = createTime;
        this.endTime = endTime;
        this.startPositions = ImmutableList.copyOf(startPositions);
        this.endPositions = ImmutableList.copyOf(endPositions);
    }

    public long getSegmentId() {
        return segmentId;
    }

    public long getCollectionId() {
        return collectionId;
    }

    public long getPartitionId() {
        return partitionId;
    }

    public long getNumRows() {
        return numRows;
    }

    public long getMemorySize() {
        return memorySize;
    }

    /**
     * Whether no statistics snapshot has been taken of this segment yet.
     *
     * @return true until the first snapshot
     */
    public boolean isNew() {
        return isNew;
    }

    public long getCreateTime() {
        return createTime;
    }

    /**
     * Get the end time of the last statistics update, 0 if there was none.
     *
     * @return end time
     */
    public long getEndTime() {
        return endTime;
    }

    public List<MsgPosition> getStartPositions() {
        return startPositions;
    }

    public List<MsgPosition> getEndPositions() {
        return endPositions;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("segmentId", segmentId)
            .add("collectionId", collectionId)
            .add("partitionId", partitionId)
            .add("numRows", numRows)
            .add("memorySize", memorySize)
            .add("isNew", isNew)
            .add("createTime", createTime)
            .add("endTime", endTime)
            .toString();
    }
}
