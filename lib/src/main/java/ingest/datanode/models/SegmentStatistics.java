package ingest.datanode.models;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A batch of segment statistics reported by one node in a single round.
 */
public class SegmentStatistics {
    private final long nodeId;
    private final long timestamp;
    private final ImmutableList<SegmentStatisticsUpdates> segStats;

    public SegmentStatistics(long nodeId, long timestamp, List<SegmentStatisticsUpdates> segStats) {
        this.nodeId = nodeId;
        this.timestamp = timestamp;
        this.segStats = ImmutableList.copyOf(segStats);
    }

    public long getNodeId() {
        return nodeId;
    }

    /**
     * Get the wall clock time, in milliseconds, when the batch was built.
     *
     * @return report timestamp
     */
    public long getTimestamp() {
        return timestamp;
    }

    public List<SegmentStatisticsUpdates> getSegStats() {
        return segStats;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("nodeId", nodeId)
            .add("timestamp", timestamp)
            .add("segStats", segStats.size())
            .toString();
    }
}
