package ingest.datanode.benchmark.jmh;

import ingest.datanode.apis.CollectionReplica;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import lombok.Getter;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import static ingest.datanode.benchmark.tool.ReplicaTool.buildReplica;
import static ingest.datanode.benchmark.tool.ReplicaTool.ingest;
import static ingest.datanode.benchmark.tool.ReplicaTool.seed;
import static ingest.datanode.benchmark.tool.ReplicaTool.snapshot;

/**
 * Readers, ingestion writers and a statistics reporter contending on one replica.
 */
@State(Scope.Thread)
public class ReplicaContention {

    @State(Scope.Benchmark)
    @Getter
    public static class ReplicaState {
        @Param({"16"})
        private int collectionCount;
        @Param({"64"})
        private int segmentsPerCollection;
        @Param({"2"})
        private int channelCount;
        @Param({"false"})
        private boolean fairLock;

        private CollectionReplica replica;
        private List<Long> segmentIds;
        private final AtomicLong clock = new AtomicLong();

        @Setup
        public void setup() {
            replica = buildReplica(fairLock, collectionCount * segmentsPerCollection);
            segmentIds = seed(replica, collectionCount, segmentsPerCollection, channelCount);
        }

        long randomSegmentId() {
            return segmentIds.get(ThreadLocalRandom.current().nextInt(segmentIds.size()));
        }
    }

    @Benchmark
    @Group("replica")
    public Segment read(ReplicaState state) throws NotFoundException {
        long segmentId = state.randomSegmentId();
        if (!state.getReplica().hasSegment(segmentId)) {
            throw new IllegalStateException("segment " + segmentId + " is missing");
        }
        return state.getReplica().getSegmentById(segmentId);
    }

    @Benchmark
    @Group("replica")
    public boolean write(ReplicaState state) {
        long segmentId = state.randomSegmentId();
        long endTime = state.getClock().incrementAndGet();
        if (!ingest(state.getReplica(), segmentId, 1L, endTime, state.getChannelCount())) {
            throw new IllegalStateException("failed to update segment " + segmentId);
        }
        return true;
    }

    @Benchmark
    @Group("replica")
    public SegmentStatisticsUpdates report(ReplicaState state) {
        long segmentId = state.randomSegmentId();
        SegmentStatisticsUpdates updates = snapshot(state.getReplica(), segmentId);
        if (updates == null) {
            throw new IllegalStateException("failed to snapshot segment " + segmentId);
        }
        return updates;
    }
}
