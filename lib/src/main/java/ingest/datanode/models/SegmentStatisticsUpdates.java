package ingest.datanode.models;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Point-in-time statistics of one segment, consumed by flush decision logic.
 */
public class SegmentStatisticsUpdates {
    private final long segmentId;
    private final long memorySize;
    private final long numRows;
    private final boolean isNewSegment;
    private final long createTime;
    private final long endTime;
    private final ImmutableList<MsgPosition> startPositions;
    private final ImmutableList<MsgPosition> endPositions;

    private SegmentStatisticsUpdates(Builder builder) {
        this.segmentId = builder.segmentId;
        this.memorySize = builder.memorySize;
        this.numRows = builder.numRows;
        this.isNewSegment = builder.isNewSegment;
        this.createTime = builder.createTime;
        this.endTime = builder.endTime;
        this.startPositions = ImmutableList.copyOf(builder.startPositions);
        this.endPositions = ImmutableList.copyOf(builder.endPositions);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public long getSegmentId() {
        return segmentId;
    }

    public long getMemorySize() {
        return memorySize;
    }

    public long getNumRows() {
        return numRows;
    }

    /**
     * Whether this is the first snapshot ever taken of the segment.
     *
     * @return true only for the first snapshot
     */
    public boolean isNewSegment() {
        return isNewSegment;
    }

    public long getCreateTime() {
        return createTime;
    }

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
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        SegmentStatisticsUpdates other = (SegmentStatisticsUpdates) obj;
        return segmentId == other.segmentId
            && memorySize == other.memorySize
            && numRows == other.numRows
            && isNewSegment == other.isNewSegment
            && createTime == other.createTime
            && endTime == other.endTime
            && startPositions.equals(other.startPositions)
            && endPositions.equals(other.endPositions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentId, memorySize, numRows, isNewSegment, createTime, endTime, startPositions,
            endPositions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("segmentId", segmentId)
            .add("memorySize", memorySize)
            .add("numRows", numRows)
            .add("isNewSegment", isNewSegment)
            .add("createTime", createTime)
            .add("endTime", endTime)
            .add("startPositions", startPositions)
            .add("endPositions", endPositions)
            .toString();
    }

    public static class Builder {
        private long segmentId;
        private long memorySize;
        private long numRows;
        private boolean isNewSegment;
        private long createTime;
        private long endTime;
        private List<MsgPosition> startPositions = ImmutableList.of();
        private List<MsgPosition> endPositions = ImmutableList.of();

        private Builder() {
        }

        public Builder setSegmentId(long segmentId) {
            this.segmentId = segmentId;
            return this;
        }

        public Builder setMemorySize(long memorySize) {
            this.memorySize = memorySize;
            return this;
        }

        public Builder setNumRows(long numRows) {
            this.numRows = numRows;
            return this;
        }

        public Builder setNewSegment(boolean isNewSegment) {
            this.isNewSegment = isNewSegment;
            return this;
        }

        public Builder setCreateTime(long createTime) {
            this.createTime = createTime;
            return this;
        }

        public Builder setEndTime(long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder setStartPositions(List<MsgPosition> startPositions) {
            checkNotNull(startPositions, "startPositions should not be null");
            this.startPositions = startPositions;
            return this;
        }

        public Builder setEndPositions(List<MsgPosition> endPositions) {
            checkNotNull(endPositions, "endPositions should not be null");
            this.endPositions = endPositions;
            return this;
        }

        public SegmentStatisticsUpdates build() {
            return new SegmentStatisticsUpdates(this);
        }
    }
}
